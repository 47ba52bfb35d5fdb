package com.jarvis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered risk classification: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskLevel fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
