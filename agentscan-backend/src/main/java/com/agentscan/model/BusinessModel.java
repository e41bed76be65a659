package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse classification of what a merchant sells. {@link #RETAIL} is the default.
 */
public enum BusinessModel {
    RETAIL,
    MARKETPLACE,
    SAAS,
    API_PROVIDER;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BusinessModel fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("business model is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
