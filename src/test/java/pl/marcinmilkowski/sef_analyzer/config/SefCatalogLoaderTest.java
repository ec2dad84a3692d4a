package pl.marcinmilkowski.sef_analyzer.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;
import pl.marcinmilkowski.sef_analyzer.sef.SefCatalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SefCatalogLoader.
 */
class SefCatalogLoaderTest {

    private static SefCatalogLoader testCatalog;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadTestCatalog() throws IOException {
        testCatalog = new SefCatalogLoader(Paths.get("src/test/resources/test-sef-catalog.json"));
    }

    @Test
    @DisplayName("Bundled catalog holds the paper's SEFs")
    void bundledCatalog() {
        SefCatalogLoader loader = SefCatalogLoader.createDefault();

        assertEquals("1.0", loader.getVersion());
        assertEquals(59, loader.getSefs().size());
        assertTrue(loader.getSefs().contains(new Sef("PERSON", "HIT", "PERSON")));
        assertTrue(loader.getSefs().contains(new Sef("PERSON", "MOD", "EMOTION")));
        assertTrue(loader.getSefs().contains(new Sef("INSECT", "SIMILAR", "WEAPON")));
        assertEquals(new Sef("N", "V", "N"), loader.getSefs().get(0));
    }

    @Test
    @DisplayName("Catalog keeps declaration order")
    void testCatalogFromFile() {
        SefCatalog catalog = testCatalog.toCatalog();

        assertEquals("test-1", catalog.getVersion());
        assertEquals(6, catalog.size());
        assertEquals(new Sef("PERSON", "HIT", "PERSON"), catalog.getSefs().get(5));
        assertTrue(catalog.contains(new Sef("N", "MOD", "ART")));
        assertFalse(catalog.contains(new Sef("PERSON", "CONSUME", "FOOD")));
    }

    @Test
    @DisplayName("Relations are listed once, in first-use order")
    void relations() {
        assertEquals(List.of("V", "MOD", "HIT"), List.copyOf(testCatalog.getRelations()));
        assertEquals(4, testCatalog.getSefsForRelation("mod").size());
        assertEquals(1, testCatalog.getSefsForRelation("HIT").size());
    }

    @Test
    @DisplayName("Exported JSON loads back to the same SEFs")
    void jsonExport() {
        SefCatalogLoader loader = SefCatalogLoader.createDefault();

        SefCatalogLoader reloaded = new SefCatalogLoader(loader.toJson().toJSONString(), "export");

        assertEquals(loader.getVersion(), reloaded.getVersion());
        assertEquals(loader.getSefs(), reloaded.getSefs());
    }

    @Test
    @DisplayName("Missing file is an IOException")
    void missingFile() {
        assertThrows(IOException.class, () -> new SefCatalogLoader(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("Missing version is rejected")
    void missingVersion() throws IOException {
        Path file = write("{\"sefs\": [{\"left\": \"N\", \"relation\": \"V\", \"right\": \"N\"}]}");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new SefCatalogLoader(file));
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    @DisplayName("Empty SEF list is rejected")
    void emptySefs() throws IOException {
        Path file = write("{\"version\": \"1.0\", \"sefs\": []}");
        assertThrows(IllegalArgumentException.class, () -> new SefCatalogLoader(file));
    }

    @Test
    @DisplayName("Blank tag is rejected")
    void blankTag() throws IOException {
        Path file = write("{\"version\": \"1.0\", \"sefs\": [{\"left\": \"N\", \"relation\": \" \", \"right\": \"N\"}]}");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new SefCatalogLoader(file));
        assertTrue(e.getMessage().contains("relation"));
    }

    @Test
    @DisplayName("Duplicate SEF is rejected")
    void duplicateSef() throws IOException {
        Path file = write("{\"version\": \"1.0\", \"sefs\": ["
            + "{\"left\": \"N\", \"relation\": \"V\", \"right\": \"N\"},"
            + "{\"left\": \"N\", \"relation\": \"V\", \"right\": \"N\"}]}");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new SefCatalogLoader(file));
        assertTrue(e.getMessage().contains("(N V N)"));
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("catalog.json");
        Files.writeString(file, content);
        return file;
    }
}
