package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanStatus {
    COMPLETED,
    FAILED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
