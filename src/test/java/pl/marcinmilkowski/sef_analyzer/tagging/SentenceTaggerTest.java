package pl.marcinmilkowski.sef_analyzer.tagging;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.sef_analyzer.lexicon.Lexicon;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SentenceTagger and WordClassTable.
 */
class SentenceTaggerTest {

    private Lexicon lexicon;
    private SentenceTagger tagger;

    @BeforeEach
    void setUp() {
        lexicon = Lexicon.createDefault();
        tagger = new SentenceTagger(lexicon);
    }

    @Test
    @DisplayName("Sentences are lowercased and stripped of punctuation")
    void cleanSentence() {
        assertEquals(List.of("the", "angry", "pitcher", "struck"),
            SentenceTagger.clean("The angry   pitcher, struck!"));
        assertTrue(SentenceTagger.clean("  ?! ").isEmpty());
        assertTrue(SentenceTagger.clean((String) null).isEmpty());
    }

    @Test
    @DisplayName("Pre-split tokens are cleaned one by one")
    void cleanTokens() {
        assertEquals(List.of("the", "batters"),
            SentenceTagger.clean(Arrays.asList("The", "...", null, "Batter's")));
        assertTrue(SentenceTagger.clean((List<String>) null).isEmpty());
    }

    @Test
    @DisplayName("Positions are 1-based and follow the input")
    void positions() {
        WordClassTable table = tagger.tag(SentenceTagger.clean("the angry pitcher struck the careless batter"));

        assertEquals(7, table.size());
        assertEquals(Set.of(1, 2, 3, 4, 5, 6, 7), table.positions());
        assertEquals("pitcher", table.get(3).word());
        assertTrue(table.get(3).hasClass("PERSON"));
        assertTrue(table.get(3).hasClass("CONTAINER"));
        assertNull(table.get(8));
        assertEquals(2, table.countPositionsWithAny("PERSON", "PERSON"));
        assertEquals(3, table.countPositionsWithAny("PERSON", "EMOTION"));
    }

    @Test
    @DisplayName("Inflected forms resolve through reductions")
    void autoMapping() {
        WordClassTable table = tagger.tag(List.of("umpires"));

        WordPosition umpires = table.get(1);
        assertEquals("umpires", umpires.word());
        assertEquals("umpire", umpires.senses().get(0).word());
        assertTrue(umpires.hasClass("OFFICIAL"));
        assertFalse(lexicon.contains("umpires"));
    }

    @Test
    @DisplayName("Every position gets a sense, unknown words a generic one")
    void fallbackTotality() {
        WordClassTable table = tagger.tag(SentenceTagger.clean("the xyzzy struck plugh"));

        for (WordPosition word : table) {
            assertFalse(word.senses().isEmpty(), "no senses for " + word.word());
            assertFalse(word.classes().isEmpty(), "no classes for " + word.word());
        }
        assertEquals(Set.of("N", "OBJECT"), table.get(2).classes());
        assertTrue(lexicon.contains("xyzzy"));
        assertEquals(1, lexicon.lookup("xyzzy").size());

        tagger.tag(List.of("xyzzy"));
        assertEquals(1, lexicon.lookup("xyzzy").size());
    }

    @Test
    @DisplayName("Duplicate positions are rejected")
    void duplicatePositions() {
        WordPosition first = WordPosition.of(1, "the", lexicon.lookup("the"));
        WordPosition second = WordPosition.of(1, "batter", lexicon.lookup("batter"));

        assertThrows(IllegalArgumentException.class, () -> new WordClassTable(List.of(first, second)));
    }
}
