package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TimeGranularity - Bucket width of a signal time series.
 */
public enum TimeGranularity {

    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String wireName;

    TimeGranularity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TimeGranularity fromWireName(String value) {
        for (TimeGranularity granularity : values()) {
            if (granularity.wireName.equalsIgnoreCase(value) || granularity.name().equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown time granularity: " + value);
    }
}
