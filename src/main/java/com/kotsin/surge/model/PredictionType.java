package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PredictionType {

    UPCOMING_SURGE("upcoming-surge"),
    CONTINUATION("continuation"),
    DECLINE("decline");

    private final String wireName;

    PredictionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static PredictionType fromWireName(String value) {
        for (PredictionType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown prediction type: " + value);
    }
}
