package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ActivityLevel - Where the most recent data point sits relative to baseline.
 */
public enum ActivityLevel {

    BELOW_BASELINE("below-baseline"),   // <= -1 std dev
    NORMAL("normal"),
    ELEVATED("elevated"),               // >= 1 std dev
    SURGING("surging");                 // >= minStandardDeviations

    private final String wireName;

    ActivityLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ActivityLevel fromWireName(String value) {
        for (ActivityLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown activity level: " + value);
    }
}
