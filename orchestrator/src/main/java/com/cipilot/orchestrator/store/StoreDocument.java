package com.cipilot.orchestrator.store;

import java.util.Map;

/**
 * One document as the store returns it.
 */
public record StoreDocument(String id, String content, Map<String, Object> metadata) {

    public StoreDocument {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String stringValue(String key, String fallback) {
        Object v = metadata.get(key);
        return v == null ? fallback : v.toString();
    }

    public long longValue(String key, long fallback) {
        Object v = metadata.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return (long) Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
