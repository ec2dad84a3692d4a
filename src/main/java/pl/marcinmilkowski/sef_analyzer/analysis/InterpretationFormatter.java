package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;

import java.util.Locale;

/**
 * Renders trees as nested {@code (LEFT RELATION RIGHT)} triples.
 *
 * An argument with an attached modifier is rendered as that modifier's triple,
 * otherwise as its upper-cased word.
 */
public final class InterpretationFormatter {

    public static final String NO_INTERPRETATION = "NO INTERPRETATION";

    private InterpretationFormatter() {
    }

    public static String format(Interpretation interpretation) {
        if (interpretation == null || interpretation.triple() == null) {
            return NO_INTERPRETATION;
        }
        return formatNode(interpretation);
    }

    public static String formatWithSenses(SensedInterpretation interpretation) {
        if (interpretation == null) {
            return NO_INTERPRETATION;
        }
        return formatSensedNode(interpretation);
    }

    private static String formatNode(Interpretation node) {
        ComplexTriple triple = node.triple();
        String left = node.left() != null ? formatNode(node.left()) : upper(triple.leftWord());
        String right = node.right() != null ? formatNode(node.right()) : upper(triple.rightWord());
        return "(" + left + " " + upper(triple.relationWord()) + " " + right + ")";
    }

    private static String formatSensedNode(SensedInterpretation node) {
        String left = node.left() != null ? formatSensedNode(node.left()) : upper(node.leftLabel());
        String right = node.right() != null ? formatSensedNode(node.right()) : upper(node.rightLabel());
        return "(" + left + " " + upper(node.relationLabel()) + " " + right + ")";
    }

    private static String upper(String word) {
        return word == null ? "?" : word.toUpperCase(Locale.ROOT);
    }
}
