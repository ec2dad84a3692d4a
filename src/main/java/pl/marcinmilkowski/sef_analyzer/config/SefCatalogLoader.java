package pl.marcinmilkowski.sef_analyzer.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;
import pl.marcinmilkowski.sef_analyzer.sef.SefCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Loads the SEF catalog from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "sefs": [
 *     { "left": "PERSON", "relation": "HIT", "right": "PERSON" },
 *     { "left": "N", "relation": "MOD", "right": "ADJ" },
 *     ...
 *   ]
 * }
 *
 * Declaration order is kept; it only affects presentation and the order in
 * which equally ranked candidates are produced.
 */
public class SefCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(SefCatalogLoader.class);

    public static final String BUNDLED_RESOURCE = "/sef-catalog.json";

    private final String version;
    private final List<Sef> sefs;

    /**
     * Load a catalog from the specified path.
     *
     * @param configPath Path to the catalog file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public SefCatalogLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    /**
     * Parse catalog JSON text.
     *
     * @param content JSON text
     * @param source  where the text came from, for messages
     * @throws IllegalArgumentException if the document is invalid
     */
    public SefCatalogLoader(String content, String source) {
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Empty SEF catalog: " + source);
        }

        // Validate version
        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in SEF catalog");
        }
        this.version = parsedVersion;

        JSONArray sefsArray = root.getJSONArray("sefs");
        if (sefsArray == null || sefsArray.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'sefs' array in SEF catalog");
        }

        List<Sef> loadedSefs = new ArrayList<>();
        Set<Sef> seen = new HashSet<>();
        for (int i = 0; i < sefsArray.size(); i++) {
            JSONObject sefObj = sefsArray.getJSONObject(i);
            if (sefObj == null) {
                throw new IllegalArgumentException("Invalid SEF at index " + i);
            }

            String left = requireTag(sefObj, "left", i);
            String relation = requireTag(sefObj, "relation", i);
            String right = requireTag(sefObj, "right", i);
            Sef sef = new Sef(left, relation, right);

            if (!seen.add(sef)) {
                throw new IllegalArgumentException("Duplicate SEF: " + sef);
            }
            loadedSefs.add(sef);
        }
        this.sefs = Collections.unmodifiableList(loadedSefs);

        logger.info("Loaded SEF catalog version {}: {} SEFs ({} relations) from {}",
            version, sefs.size(), getRelations().size(), source);
    }

    /**
     * Load the catalog bundled with the library.
     */
    public static SefCatalogLoader createDefault() {
        try (InputStream in = SefCatalogLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled SEF catalog: " + BUNDLED_RESOURCE);
            }
            return new SefCatalogLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8), BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled SEF catalog: " + BUNDLED_RESOURCE, e);
        }
    }

    /**
     * Build the catalog used by the analyzer.
     */
    public SefCatalog toCatalog() {
        return new SefCatalog(version, sefs);
    }

    public List<Sef> getSefs() {
        return sefs;
    }

    /**
     * Get the distinct relation tags, in first-use order.
     */
    public Set<String> getRelations() {
        return sefs.stream()
            .map(Sef::relation)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Get the SEFs using a relation tag.
     */
    public List<Sef> getSefsForRelation(String relation) {
        return sefs.stream()
            .filter(s -> s.relation().equalsIgnoreCase(relation))
            .collect(Collectors.toList());
    }

    public String getVersion() {
        return version;
    }

    /**
     * Export the loaded catalog as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        JSONArray sefsArray = new JSONArray();
        for (Sef sef : sefs) {
            JSONObject obj = new JSONObject();
            obj.put("left", sef.left());
            obj.put("relation", sef.relation());
            obj.put("right", sef.right());
            sefsArray.add(obj);
        }
        root.put("sefs", sefsArray);
        return root;
    }

    private static String requireTag(JSONObject sefObj, String field, int index) {
        String tag = sefObj.getString(field);
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' field for SEF at index " + index);
        }
        return tag.trim();
    }

    private static String readFile(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("SEF catalog file not found: " + configPath);
        }
        return Files.readString(configPath);
    }
}
