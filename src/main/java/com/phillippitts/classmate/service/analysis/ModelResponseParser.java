package com.phillippitts.classmate.service.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lenient JSON extraction from model replies.
 *
 * <p>Models wrap JSON in markdown fences or add prose around it. The parser strips fences,
 * then falls back to the outermost {@code {...}} span.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class ModelResponseParser {

    private static final Logger LOG = LogManager.getLogger(ModelResponseParser.class);

    private ModelResponseParser() {
        // Utility class - prevent instantiation
    }

    public static Optional<JSONObject> parseObject(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String text = stripFences(reply.trim());
        try {
            return Optional.of(new JSONObject(text));
        } catch (JSONException e) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                try {
                    return Optional.of(new JSONObject(text.substring(start, end + 1)));
                } catch (JSONException nested) {
                    LOG.debug("Embedded JSON span did not parse: {}", nested.getMessage());
                }
            }
            LOG.warn("Cannot parse model reply as JSON: {}", text.length() > 200 ? text.substring(0, 200) : text);
            return Optional.empty();
        }
    }

    static String stripFences(String text) {
        String result = text;
        if (result.startsWith("```json")) {
            result = result.substring(7);
        } else if (result.startsWith("```")) {
            result = result.substring(3);
        }
        if (result.endsWith("```")) {
            result = result.substring(0, result.length() - 3);
        }
        return result.trim();
    }

    /**
     * Reads a list field. String elements are taken as-is; object elements are rendered by
     * joining the non-blank values of {@code objectFields} with {@code " - "}.
     */
    public static List<String> stringList(JSONObject json, String key, String... objectFields) {
        JSONArray array = json.optJSONArray(key);
        List<String> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (item instanceof JSONObject object) {
                List<String> parts = new ArrayList<>();
                for (String field : objectFields) {
                    String value = object.optString(field, "").trim();
                    if (!value.isEmpty()) {
                        parts.add(value);
                    }
                }
                if (!parts.isEmpty()) {
                    out.add(String.join(" - ", parts));
                }
            } else if (item != null && item != JSONObject.NULL) {
                String value = item.toString().trim();
                if (!value.isEmpty()) {
                    out.add(value);
                }
            }
        }
        return out;
    }

    /** Reads a confidence-like number, accepting numeric strings; clamped to [0, 1]. */
    public static double unitInterval(JSONObject json, String key) {
        double value = json.optDouble(key, 0.0);
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }
}
