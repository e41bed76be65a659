package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Detection status of one protocol on one domain.
 *
 * <p>The first four constants are ranked; {@link #NOT_APPLICABLE} is terminal and has no rank.
 */
public enum DetectionStatus {
    CONFIRMED("confirmed", 4),
    PLATFORM_ENABLED("platform_enabled", 3),
    ELIGIBLE("eligible", 2),
    NOT_DETECTED("not_detected", 1),
    NOT_APPLICABLE("not_applicable", null);

    private final String wireName;
    private final Integer rank;

    DetectionStatus(String wireName, Integer rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns the rank, or {@code null} for {@link #NOT_APPLICABLE}.
     */
    public Integer getRank() {
        return rank;
    }

    public boolean isRanked() {
        return rank != null;
    }

    public boolean isDetected() {
        return this == CONFIRMED || this == PLATFORM_ENABLED || this == ELIGIBLE;
    }

    @JsonCreator
    public static DetectionStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (DetectionStatus s : values()) {
            if (s.wireName.equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown detection status: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
