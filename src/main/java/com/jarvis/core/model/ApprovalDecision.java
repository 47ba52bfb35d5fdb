package com.jarvis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Human verdict on an approval request.
 */
public enum ApprovalDecision {
    APPROVED,
    REJECTED,
    MODIFIED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalDecision fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
