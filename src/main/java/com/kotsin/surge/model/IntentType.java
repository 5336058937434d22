package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * IntentType - Kind of buying-intent behavior a signal represents.
 *
 * CHURN_FROM_COMPETITOR and COMPLIANCE_NEED are high-signal intents: they
 * contribute their own potential causes when they appear in a surge.
 */
public enum IntentType {

    CHURN_FROM_COMPETITOR("churn-from-competitor"),
    ACTIVE_EVALUATION("active-evaluation"),
    PAIN_POINT_EXPRESSION("pain-point-expression"),
    FEATURE_COMPARISON("feature-comparison"),
    BUDGET_ALLOCATION("budget-allocation"),
    VENDOR_SEARCH("vendor-search"),
    IMPLEMENTATION_PLANNING("implementation-planning"),
    CONTRACT_RENEWAL("contract-renewal"),
    GROWTH_EXPANSION("growth-expansion"),
    COMPLIANCE_NEED("compliance-need");

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static IntentType fromWireName(String value) {
        for (IntentType intent : values()) {
            if (intent.wireName.equalsIgnoreCase(value) || intent.name().equalsIgnoreCase(value)) {
                return intent;
            }
        }
        throw new IllegalArgumentException("Unknown intent type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
