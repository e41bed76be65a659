package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Confidence fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("confidence is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
