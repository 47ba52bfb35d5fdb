package com.jarvis.core.events.schema;

import java.util.Set;

/**
 * Constraint on one payload field.
 *
 * @param name          field name
 * @param type          expected value kind
 * @param required      whether the field must be present and non-null
 * @param allowedValues permitted string values, empty for any
 * @param min           inclusive lower bound for numbers, null for none
 * @param max           inclusive upper bound for numbers, null for none
 */
public record FieldSpec(String name, FieldType type, boolean required, Set<String> allowedValues,
                        Double min, Double max) {

    public FieldSpec {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    /** Returns the problem with {@code value}, or null when it satisfies this field. */
    String check(Object value) {
        if (value == null) {
            return required ? "missing required field '" + name + "'" : null;
        }
        if (!type.accepts(value)) {
            return "field '" + name + "' must be " + type.name().toLowerCase();
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(String.valueOf(value))) {
            return "field '" + name + "' must be one of " + allowedValues.stream().sorted().toList();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (min != null && d < min) {
                return "field '" + name + "' must be >= " + min;
            }
            if (max != null && d > max) {
                return "field '" + name + "' must be <= " + max;
            }
        }
        return null;
    }
}
