package pl.marcinmilkowski.sef_analyzer.sef;

import java.util.List;

/**
 * Semantic Event Form: a licensed {@code (left relation right)} combination of class tags.
 *
 * Tags may be syntactic ({@code N}, {@code V}) or semantic ({@code PERSON}, {@code HIT}).
 * Word order is not part of the form; {@link OrderRule} checks it per relation.
 */
public record Sef(String left, String relation, String right) {

    /** Implicit modification relation, never realized by a word. */
    public static final String MOD = "MOD";

    public Sef {
        if (left == null || left.isBlank() || relation == null || relation.isBlank()
                || right == null || right.isBlank()) {
            throw new IllegalArgumentException("SEF tags must not be blank");
        }
    }

    public boolean isModification() {
        return MOD.equals(relation);
    }

    public List<String> tags() {
        return List.of(left, relation, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + relation + " " + right + ")";
    }
}
