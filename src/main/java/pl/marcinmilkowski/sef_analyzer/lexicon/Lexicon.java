package pl.marcinmilkowski.sef_analyzer.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Word to senses dictionary.
 *
 * <p>Senses are kept in declaration order. The dictionary only grows: seed
 * senses are added at construction, custom senses are merged from the
 * optional {@link CustomLexiconStore}, and generic senses are appended for
 * unknown words while analyzing.</p>
 *
 * <p>Mutators are serialized on this object. Each word's sense list is
 * replaced by a new immutable list, so {@link #lookup(String)} needs no
 * locking and never observes a half-added entry.</p>
 */
public class Lexicon {
    private static final Logger logger = LoggerFactory.getLogger(Lexicon.class);

    public static final String GENERIC_SYNTACTIC_CLASS = "N";
    public static final String GENERIC_SEMANTIC_CLASS = "OBJECT";

    private final Map<String, List<WordSense>> entries = new ConcurrentHashMap<>();
    private final CustomLexiconStore customStore;

    /**
     * Create an empty lexicon without persistence.
     */
    public Lexicon() {
        this(List.of(), null);
    }

    /**
     * Create a lexicon from seed senses, then merge everything found in the custom store.
     *
     * @param seed        senses to add, in declaration order
     * @param customStore persisted custom senses, or null for none
     */
    public Lexicon(Collection<WordSense> seed, CustomLexiconStore customStore) {
        this.customStore = customStore;
        for (WordSense sense : seed) {
            addSense(sense);
        }
        if (customStore != null) {
            for (WordSense sense : customStore.readAll()) {
                addSense(sense);
            }
        }
    }

    /**
     * Lexicon with the bundled seed vocabulary and no persistence.
     */
    public static Lexicon createDefault() {
        return new Lexicon(SeedLexicon.loadBundled().getSenses(), null);
    }

    /**
     * Lexicon with the bundled seed vocabulary, merged with and persisting to a custom store.
     */
    public static Lexicon createDefault(Path customStorePath) {
        return new Lexicon(SeedLexicon.loadBundled().getSenses(), new CustomLexiconStore(customStorePath));
    }

    /**
     * Get all senses of a word, ignoring case.
     *
     * @return senses in declaration order, empty if the word is unknown
     */
    public List<WordSense> lookup(String word) {
        if (word == null) {
            return List.of();
        }
        return entries.getOrDefault(normalize(word), List.of());
    }

    /**
     * Append a sense. Identical senses are not merged.
     */
    public void addSense(String word, int senseNumber, String syntacticClass,
                         Collection<String> features, List<String> semanticClasses) {
        addSense(new WordSense(normalize(word), senseNumber, syntacticClass,
            new LinkedHashSet<>(features), semanticClasses));
    }

    public synchronized void addSense(WordSense sense) {
        String key = normalize(sense.word());
        List<WordSense> current = entries.getOrDefault(key, List.of());
        List<WordSense> updated = new ArrayList<>(current.size() + 1);
        updated.addAll(current);
        updated.add(sense);
        entries.put(key, List.copyOf(updated));
    }

    /**
     * Add a generic noun/OBJECT sense for a word the lexicon cannot resolve.
     *
     * @param word    the unknown word
     * @param persist whether to append the sense to the custom store as well
     * @return all senses of the word, including the new one
     */
    public synchronized List<WordSense> addGenericSense(String word, boolean persist) {
        String key = normalize(word);
        int senseNumber = lookup(key).size() + 1;
        WordSense generic = new WordSense(key, senseNumber, GENERIC_SYNTACTIC_CLASS,
            Set.of(), List.of(GENERIC_SEMANTIC_CLASS));
        addSense(generic);

        if (persist) {
            if (customStore == null) {
                logger.warn("No custom lexicon store configured; '{}' is kept in memory only", key);
            } else {
                customStore.append(generic);
            }
        }
        return lookup(key);
    }

    /**
     * Union of the syntactic and semantic classes of every sense of a word.
     */
    public Set<String> getClassesForWord(String word) {
        Set<String> classes = new LinkedHashSet<>();
        for (WordSense sense : lookup(word)) {
            classes.add(sense.syntacticClass());
            classes.addAll(sense.semanticClasses());
        }
        return classes;
    }

    public boolean contains(String word) {
        return !lookup(word).isEmpty();
    }

    /**
     * Number of distinct words.
     */
    public int size() {
        return entries.size();
    }

    public CustomLexiconStore getCustomStore() {
        return customStore;
    }

    private static String normalize(String word) {
        return word.toLowerCase(Locale.ROOT);
    }
}
