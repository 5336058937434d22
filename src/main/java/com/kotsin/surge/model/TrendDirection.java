package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String wireName;

    TrendDirection(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TrendDirection fromWireName(String value) {
        for (TrendDirection direction : values()) {
            if (direction.wireName.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown trend direction: " + value);
    }
}
