package com.jarvis.core.events.schema;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * JSON value kinds a payload field may hold.
 */
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    /** ISO-8601 instant, either as string or {@link Instant}. */
    TIMESTAMP,
    LIST,
    OBJECT;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()));
            case BOOLEAN -> value instanceof Boolean;
            case TIMESTAMP -> value instanceof Instant || (value instanceof String s && isInstant(s));
            case LIST -> value instanceof List<?>;
            case OBJECT -> value instanceof Map<?, ?>;
        };
    }

    private static boolean isInstant(String raw) {
        try {
            Instant.parse(raw);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
