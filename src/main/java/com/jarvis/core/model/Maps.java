package com.jarvis.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy helpers for the loosely-typed JSON-like maps carried by tasks and events.
 * Unlike {@link Map#copyOf}, null values survive.
 */
public final class Maps {

    private Maps() {}

    public static Map<String, Object> frozenCopy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Map<String, Object> merged(Map<String, ?> base, Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return Collections.unmodifiableMap(merged);
    }
}
