package pl.marcinmilkowski.sef_analyzer.lexicon;

import java.util.ArrayList;
import java.util.List;

/**
 * Surface-form reductions tried when a token is missing from the lexicon.
 *
 * Candidates are produced in a fixed priority order: possessive, plural
 * {@code s}, plural {@code es}, past {@code ed}, gerund {@code ing} and
 * adverbial {@code ly}. The length guards keep short words intact.
 */
public final class WordNormalizer {

    private WordNormalizer() {
    }

    /**
     * Reduction candidates for a lowercase token, in the order they should be tried.
     */
    public static List<String> candidates(String word) {
        List<String> tried = new ArrayList<>();
        if (word.endsWith("'s")) {
            tried.add(word.substring(0, word.length() - 2));
        }
        if (word.endsWith("s") && word.length() > 3) {
            tried.add(word.substring(0, word.length() - 1));
        }
        if (word.endsWith("es") && word.length() > 4) {
            tried.add(word.substring(0, word.length() - 2));
        }
        if (word.endsWith("ed") && word.length() > 3) {
            tried.add(word.substring(0, word.length() - 2));
        }
        if (word.endsWith("ing") && word.length() > 4) {
            tried.add(word.substring(0, word.length() - 3));
        }
        if (word.endsWith("ly") && word.length() > 3) {
            tried.add(word.substring(0, word.length() - 2));
        }
        tried.removeIf(String::isEmpty);
        return tried;
    }

    /**
     * Find the senses of the first candidate the lexicon knows.
     *
     * @return senses of the first known reduction, or an empty list
     */
    public static List<WordSense> lookupReduced(Lexicon lexicon, String word) {
        for (String candidate : candidates(word)) {
            List<WordSense> senses = lexicon.lookup(candidate);
            if (!senses.isEmpty()) {
                return senses;
            }
        }
        return List.of();
    }
}
