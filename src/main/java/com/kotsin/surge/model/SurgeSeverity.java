package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SurgeSeverity - Four-tier classification of how far a surge peak deviates
 * from baseline, in standard deviations.
 *
 * Rank order: MINOR (1) < MODERATE (2) < SIGNIFICANT (3) < CRITICAL (4)
 */
public enum SurgeSeverity {

    MINOR("minor", 1),
    MODERATE("moderate", 2),
    SIGNIFICANT("significant", 3),
    CRITICAL("critical", 4);

    private final String wireName;
    private final int rank;

    SurgeSeverity(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Check if this severity is at least as high as another.
     */
    public boolean isAtLeast(SurgeSeverity other) {
        return this.rank >= other.rank;
    }

    @JsonCreator
    public static SurgeSeverity fromWireName(String value) {
        for (SurgeSeverity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown surge severity: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
