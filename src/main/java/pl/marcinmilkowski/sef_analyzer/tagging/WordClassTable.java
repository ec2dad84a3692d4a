package pl.marcinmilkowski.sef_analyzer.tagging;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Position to word/classes table of one sentence.
 *
 * Built fresh for every analysis; iteration runs left to right.
 */
public final class WordClassTable implements Iterable<WordPosition> {

    private final Map<Integer, WordPosition> positions;

    public WordClassTable(Collection<WordPosition> words) {
        Map<Integer, WordPosition> byPosition = new TreeMap<>();
        for (WordPosition word : words) {
            if (word.position() < 1) {
                throw new IllegalArgumentException("Positions are 1-based: " + word.position());
            }
            if (byPosition.put(word.position(), word) != null) {
                throw new IllegalArgumentException("Duplicate position: " + word.position());
            }
        }
        this.positions = Collections.unmodifiableMap(byPosition);
    }

    /**
     * @return the word at a position, or null if the position is not in the sentence
     */
    public WordPosition get(int position) {
        return positions.get(position);
    }

    public boolean contains(int position) {
        return positions.containsKey(position);
    }

    public Set<Integer> positions() {
        return positions.keySet();
    }

    /**
     * Union of every class tag in the sentence.
     */
    public Set<String> allClasses() {
        Set<String> all = new LinkedHashSet<>();
        for (WordPosition word : positions.values()) {
            all.addAll(word.classes());
        }
        return all;
    }

    /**
     * Number of positions carrying at least one of the given tags.
     */
    public int countPositionsWithAny(String first, String second) {
        int count = 0;
        for (WordPosition word : positions.values()) {
            if (word.hasClass(first) || word.hasClass(second)) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    @Override
    public Iterator<WordPosition> iterator() {
        return positions.values().iterator();
    }

    @Override
    public String toString() {
        List<String> lines = new ArrayList<>();
        for (WordPosition word : positions.values()) {
            lines.add(word.position() + ". " + word.word() + ": " + word.classes());
        }
        return String.join("\n", lines);
    }
}
