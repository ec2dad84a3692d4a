package pl.marcinmilkowski.sef_analyzer.lexicon;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the seed vocabulary from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "entries": [
 *     {
 *       "word": "pitcher",
 *       "sense_number": 1,
 *       "syntactic_class": "N",
 *       "features": ["SING"],
 *       "semantic_classes": ["PERSON", "ATHLETE"]
 *     },
 *     ...
 *   ]
 * }
 *
 * Entries keep their declaration order; a word's senses must have distinct numbers.
 */
public class SeedLexicon {
    private static final Logger logger = LoggerFactory.getLogger(SeedLexicon.class);

    public static final String BUNDLED_RESOURCE = "/lexicon/seed-lexicon.json";

    private final String version;
    private final List<WordSense> senses;

    /**
     * Parse a seed lexicon document.
     *
     * @param content JSON text
     * @param source  description of where the text came from, for messages
     * @throws IllegalArgumentException if the document is invalid
     */
    public SeedLexicon(String content, String source) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty seed lexicon: " + source);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in seed lexicon");
        }
        this.version = parsedVersion;

        JSONArray entries = root.getJSONArray("entries");
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'entries' array in seed lexicon");
        }

        List<WordSense> loaded = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            WordSense sense = SenseJson.fromSeedEntry(entries.getJSONObject(i), i);
            if (!seen.add(sense.label())) {
                throw new IllegalArgumentException("Duplicate sense: " + sense.label());
            }
            loaded.add(sense);
        }
        this.senses = Collections.unmodifiableList(loaded);

        logger.info("Loaded seed lexicon version {}: {} senses from {}", version, senses.size(), source);
    }

    /**
     * Load a seed lexicon file.
     *
     * @throws IOException if the file cannot be read
     */
    public static SeedLexicon load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Seed lexicon file not found: " + path);
        }
        return new SeedLexicon(Files.readString(path), path.toString());
    }

    /**
     * Load the vocabulary bundled with the library.
     */
    public static SeedLexicon loadBundled() {
        try (InputStream in = SeedLexicon.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled seed lexicon: " + BUNDLED_RESOURCE);
            }
            return new SeedLexicon(new String(in.readAllBytes(), StandardCharsets.UTF_8), BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled seed lexicon: " + BUNDLED_RESOURCE, e);
        }
    }

    public String getVersion() {
        return version;
    }

    public List<WordSense> getSenses() {
        return senses;
    }
}
