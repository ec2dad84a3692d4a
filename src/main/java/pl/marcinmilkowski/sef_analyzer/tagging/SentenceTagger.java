package pl.marcinmilkowski.sef_analyzer.tagging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sef_analyzer.lexicon.Lexicon;
import pl.marcinmilkowski.sef_analyzer.lexicon.WordNormalizer;
import pl.marcinmilkowski.sef_analyzer.lexicon.WordSense;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw input into a {@link WordClassTable}.
 *
 * <p>Every position ends up with at least one sense: unknown tokens are
 * retried through {@link WordNormalizer} and, failing that, receive a
 * non-persisted generic noun sense from the lexicon.</p>
 */
public class SentenceTagger {
    private static final Logger logger = LoggerFactory.getLogger(SentenceTagger.class);

    private final Lexicon lexicon;

    public SentenceTagger(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * Lowercase a sentence, drop everything but letters, digits and whitespace, split on whitespace.
     */
    public static List<String> clean(String sentence) {
        if (sentence == null) {
            return List.of();
        }
        StringBuilder cleaned = new StringBuilder(sentence.length());
        for (char c : sentence.toCharArray()) {
            if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
                cleaned.append(Character.toLowerCase(c));
            }
        }
        String trimmed = cleaned.toString().trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("\\s+"));
    }

    /**
     * Lowercase pre-split tokens and strip everything but letters and digits; empty tokens are dropped.
     */
    public static List<String> clean(List<String> tokens) {
        List<String> cleaned = new ArrayList<>();
        if (tokens == null) {
            return cleaned;
        }
        for (String token : tokens) {
            if (token == null) {
                continue;
            }
            StringBuilder sb = new StringBuilder(token.length());
            for (char c : token.toCharArray()) {
                if (Character.isLetterOrDigit(c)) {
                    sb.append(c);
                }
            }
            if (sb.length() > 0) {
                cleaned.add(sb.toString().toLowerCase(Locale.ROOT));
            }
        }
        return cleaned;
    }

    /**
     * Look up every cleaned token and build the position table.
     */
    public WordClassTable tag(List<String> cleanedTokens) {
        List<WordPosition> words = new ArrayList<>(cleanedTokens.size());
        int position = 1;
        for (String word : cleanedTokens) {
            words.add(WordPosition.of(position++, word, resolveSenses(word)));
        }
        return new WordClassTable(words);
    }

    /**
     * Senses for one token: direct lookup, then surface-form reductions, then the generic fallback.
     */
    List<WordSense> resolveSenses(String word) {
        List<WordSense> senses = lexicon.lookup(word);
        if (!senses.isEmpty()) {
            return senses;
        }

        senses = WordNormalizer.lookupReduced(lexicon, word);
        if (!senses.isEmpty()) {
            logger.info("Auto-mapped '{}' -> '{}'", word, senses.get(0).word());
            return senses;
        }

        logger.info("Unknown word '{}': adding generic noun sense", word);
        return lexicon.addGenericSense(word, false);
    }
}
