package pl.marcinmilkowski.sef_analyzer.lexicon;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SeedLexicon.
 */
class SeedLexiconTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Bundled seed loads in declaration order")
    void bundled() {
        SeedLexicon seed = SeedLexicon.loadBundled();

        assertEquals("1.0", seed.getVersion());
        assertTrue(seed.getSenses().size() > 100);
        assertEquals("read", seed.getSenses().get(0).word());
    }

    @Test
    @DisplayName("Missing version is rejected")
    void missingVersion() {
        String content = "{\"entries\": [{\"word\": \"a\", \"sense_number\": 1, \"syntactic_class\": \"ART\","
            + " \"semantic_classes\": [\"INDEFINITE\"]}]}";
        assertThrows(IllegalArgumentException.class, () -> new SeedLexicon(content, "test"));
    }

    @Test
    @DisplayName("Empty entry list is rejected")
    void emptyEntries() {
        assertThrows(IllegalArgumentException.class,
            () -> new SeedLexicon("{\"version\": \"1.0\", \"entries\": []}", "test"));
    }

    @Test
    @DisplayName("Duplicate sense numbers are rejected")
    void duplicateSense() {
        String entry = "{\"word\": \"fish\", \"sense_number\": 1, \"syntactic_class\": \"N\","
            + " \"semantic_classes\": [\"ANIMAL\"]}";
        String content = "{\"version\": \"1.0\", \"entries\": [" + entry + ", " + entry + "]}";

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new SeedLexicon(content, "test"));
        assertTrue(e.getMessage().contains("fish_1"));
    }

    @Test
    @DisplayName("Missing file is an IOException")
    void missingFile() {
        assertThrows(IOException.class, () -> SeedLexicon.load(tempDir.resolve("absent.json")));
    }
}
