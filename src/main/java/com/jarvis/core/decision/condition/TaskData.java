package com.jarvis.core.decision.condition;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Reads values out of a task's loosely-typed data map.
 */
final class TaskData {

    private TaskData() {}

    /** Resolves a dotted path such as {@code budget.total}; null when any segment is missing. */
    static Object at(Map<String, Object> data, String path) {
        Object current = data;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    static Double number(Map<String, Object> data, String path) {
        Object value = at(data, path);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + path + "' is not numeric: " + s);
            }
        }
        throw new IllegalArgumentException("'" + path + "' is not numeric: " + value);
    }

    static Instant instant(Map<String, Object> data, String path) {
        Object value = at(data, path);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant i) {
            return i;
        }
        try {
            return Instant.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + path + "' is not an ISO-8601 instant: " + value);
        }
    }
}
