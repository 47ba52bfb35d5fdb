package com.jarvis.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DecisionAction {
    AUTO_APPROVE,
    REQUEST_APPROVAL,
    REJECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionAction fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
