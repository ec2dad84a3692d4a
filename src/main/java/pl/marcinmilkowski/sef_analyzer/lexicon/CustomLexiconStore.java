package pl.marcinmilkowski.sef_analyzer.lexicon;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted store of senses added at runtime.
 *
 * Expected JSON structure:
 * {
 *   "xyzzy": [
 *     {
 *       "sense_number": 1,
 *       "syntactic_class": "N",
 *       "features": [],
 *       "semantic_classes": ["OBJECT"]
 *     }
 *   ]
 * }
 *
 * The store is read in full and rewritten in full (read, merge, write).
 * A missing, unreadable or corrupt file is never fatal: reads return nothing
 * and failed writes are logged.
 */
public class CustomLexiconStore {
    private static final Logger logger = LoggerFactory.getLogger(CustomLexiconStore.class);

    private final Path path;

    public CustomLexiconStore(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Read every stored sense, in file order.
     *
     * @return stored senses, or an empty list if the file is absent or invalid
     */
    public List<WordSense> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            JSONObject root = readRoot();
            List<WordSense> senses = new ArrayList<>();
            for (String word : root.keySet()) {
                JSONArray stored = root.getJSONArray(word);
                if (stored == null) {
                    continue;
                }
                for (int i = 0; i < stored.size(); i++) {
                    senses.add(SenseJson.fromStoreEntry(word, stored.getJSONObject(i)));
                }
            }
            logger.info("Loaded {} custom senses from {}", senses.size(), path);
            return senses;
        } catch (IOException | RuntimeException e) {
            logger.warn("Ignoring unreadable custom lexicon {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    /**
     * Append one sense under its word, keeping everything already stored.
     *
     * @return true if the store was written
     */
    public boolean append(WordSense sense) {
        try {
            JSONObject root = Files.exists(path) ? readRoot() : new JSONObject();
            JSONArray stored = root.getJSONArray(sense.word());
            if (stored == null) {
                stored = new JSONArray();
                root.put(sense.word(), stored);
            }
            stored.add(SenseJson.toStoreEntry(sense));

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, JSON.toJSONString(root, JSONWriter.Feature.PrettyFormat));
            logger.debug("Persisted {} to {}", sense.label(), path);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not persist {} to {}: {}", sense.label(), path, e.getMessage());
            return false;
        }
    }

    private JSONObject readRoot() throws IOException {
        String content = Files.readString(path);
        JSONObject root = JSON.parseObject(content);
        if (root == null) {
            throw new IOException("Empty custom lexicon: " + path);
        }
        return root;
    }
}
