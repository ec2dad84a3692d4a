package pl.marcinmilkowski.sef_analyzer.sef;

import java.util.Set;

/**
 * Specificity score of a SEF: 10 per bare part-of-speech tag, so lower is more semantic.
 */
public final class AbstractionLevel {

    public static final Set<String> SYNTACTIC_CLASSES = Set.of("N", "V", "ADJ", "ADV", "ART", "PREP");

    private static final int SYNTACTIC_TAG_WEIGHT = 10;

    private AbstractionLevel() {
    }

    public static int of(Sef sef) {
        int score = 0;
        for (String tag : sef.tags()) {
            if (SYNTACTIC_CLASSES.contains(tag)) {
                score += SYNTACTIC_TAG_WEIGHT;
            }
        }
        return score;
    }
}
