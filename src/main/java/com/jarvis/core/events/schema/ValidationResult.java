package com.jarvis.core.events.schema;

import java.util.List;

/**
 * Result of validating an event payload against its topic schema.
 *
 * @param valid  true if validation passed with no errors
 * @param errors human-readable error messages, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    public static ValidationResult fail(String error) {
        return new ValidationResult(false, List.of(error));
    }
}
