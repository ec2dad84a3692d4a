package pl.marcinmilkowski.sef_analyzer.lexicon;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * JSON form of a {@link WordSense}, shared by the seed lexicon and the custom store.
 */
final class SenseJson {

    private SenseJson() {
    }

    /**
     * Parse a custom store entry. Missing fields fall back to the generic noun sense.
     */
    static WordSense fromStoreEntry(String word, JSONObject obj) {
        if (obj == null) {
            throw new IllegalArgumentException("Invalid sense entry for '" + word + "'");
        }
        String syntacticClass = obj.getString("syntactic_class");
        List<String> semanticClasses = strings(obj.getJSONArray("semantic_classes"));
        return new WordSense(
            word.toLowerCase(Locale.ROOT),
            obj.getIntValue("sense_number", 1),
            syntacticClass != null ? syntacticClass : Lexicon.GENERIC_SYNTACTIC_CLASS,
            new LinkedHashSet<>(strings(obj.getJSONArray("features"))),
            semanticClasses.isEmpty() ? List.of(Lexicon.GENERIC_SEMANTIC_CLASS) : semanticClasses
        );
    }

    /**
     * Parse a seed lexicon entry, which names its word and must be complete.
     */
    static WordSense fromSeedEntry(JSONObject obj, int index) {
        if (obj == null) {
            throw new IllegalArgumentException("Invalid lexicon entry at index " + index);
        }
        String word = obj.getString("word");
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("Missing 'word' field for lexicon entry at index " + index);
        }
        String syntacticClass = obj.getString("syntactic_class");
        if (syntacticClass == null || syntacticClass.isBlank()) {
            throw new IllegalArgumentException("Missing 'syntactic_class' for '" + word + "'");
        }
        List<String> semanticClasses = strings(obj.getJSONArray("semantic_classes"));
        if (semanticClasses.isEmpty()) {
            throw new IllegalArgumentException("Missing 'semantic_classes' for '" + word + "'");
        }
        return new WordSense(
            word.toLowerCase(Locale.ROOT),
            obj.getIntValue("sense_number", 1),
            syntacticClass,
            new LinkedHashSet<>(strings(obj.getJSONArray("features"))),
            semanticClasses
        );
    }

    static JSONObject toStoreEntry(WordSense sense) {
        JSONObject obj = new JSONObject();
        obj.put("sense_number", sense.senseNumber());
        obj.put("syntactic_class", sense.syntacticClass());
        obj.put("features", new JSONArray(sense.features().stream().sorted().toList()));
        obj.put("semantic_classes", new JSONArray(sense.semanticClasses()));
        return obj;
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }
}
