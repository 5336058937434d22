package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SurgeType - What kind of activity change a surge event represents.
 */
public enum SurgeType {

    SUDDEN_SPIKE("sudden-spike"),            // Sharp increase in short timeframe
    SUSTAINED_TREND("sustained-trend"),      // Gradual increase over longer period
    RECURRING_PATTERN("recurring-pattern"),  // Seasonal/cyclical pattern
    EVENT_DRIVEN("event-driven"),            // Correlated with external event
    COMPETITOR_RELATED("competitor-related"); // Tied to competitor activity

    private final String wireName;

    SurgeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SurgeType fromWireName(String value) {
        for (SurgeType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown surge type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
