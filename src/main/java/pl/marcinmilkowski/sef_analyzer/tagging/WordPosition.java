package pl.marcinmilkowski.sef_analyzer.tagging;

import pl.marcinmilkowski.sef_analyzer.lexicon.WordSense;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A word of the analyzed sentence with its candidate senses and every class tag they contribute.
 */
public record WordPosition(
    int position,           // 1-based, left to right
    String word,            // Cleaned surface form
    List<WordSense> senses, // Never empty once the generic fallback has run
    Set<String> classes     // Syntactic and semantic tags of all senses
) {

    public WordPosition {
        senses = List.copyOf(senses);
        classes = Collections.unmodifiableSet(new LinkedHashSet<>(classes));
    }

    /**
     * Build a position, deriving its classes from the senses.
     */
    public static WordPosition of(int position, String word, List<WordSense> senses) {
        Set<String> classes = new LinkedHashSet<>();
        for (WordSense sense : senses) {
            classes.add(sense.syntacticClass());
            classes.addAll(sense.semanticClasses());
        }
        return new WordPosition(position, word, senses, classes);
    }

    public boolean hasClass(String tag) {
        return classes.contains(tag);
    }
}
