package pl.marcinmilkowski.sef_analyzer.lexicon;

import java.util.List;
import java.util.Set;

/**
 * One sense of a word: its syntactic class, grammatical features and
 * semantic classes.
 *
 * Semantic classes are ordered from the most specific to the most abstract;
 * root selection rewards matches on earlier classes.
 */
public record WordSense(
    String word,                   // Canonical lowercase form
    int senseNumber,               // 1-based, unique per word
    String syntacticClass,         // N, V, ADJ, ADV, ART, PREP, ...
    Set<String> features,          // SING, PL, PAST, ...
    List<String> semanticClasses   // Most specific first
) {

    public WordSense {
        features = Set.copyOf(features);
        semanticClasses = List.copyOf(semanticClasses);
    }

    /**
     * Check whether a class tag is this sense's syntactic class or one of its semantic classes.
     */
    public boolean matchesClass(String tag) {
        return syntacticClass.equals(tag) || semanticClasses.contains(tag);
    }

    /**
     * Label used in sense-annotated structures, e.g. {@code pitcher_1}.
     */
    public String label() {
        return word + "_" + senseNumber;
    }

    @Override
    public String toString() {
        return String.format("%s(%s, %s)", label(), syntacticClass, semanticClasses);
    }
}
