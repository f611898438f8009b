package com.purchasingpower.salesgraph.util;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the schema-less metadata bags on nodes and edges.
 */
public final class MetadataMaps {

    public static final String CREATED_AT = "created_at";
    public static final String INTENT_ID = "intent_id";
    public static final String SOURCE = "source";
    public static final String WEBSITE = "website";

    private MetadataMaps() {
    }

    /**
     * Creation metadata: epoch seconds as a double, plus intent and provenance when given.
     */
    public static Map<String, Object> created(String intentId, String source) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Instant now = Instant.now();
        metadata.put(CREATED_AT, now.getEpochSecond() + now.getNano() / 1_000_000_000.0);
        if (intentId != null) {
            metadata.put(INTENT_ID, intentId);
        }
        if (source != null) {
            metadata.put(SOURCE, source);
        }
        return metadata;
    }

    /**
     * Copies nested maps and lists so the copy can be mutated independently.
     */
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }

    /**
     * Reads a numeric value, treating absent or non-numeric entries as zero.
     */
    public static double number(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }
}
