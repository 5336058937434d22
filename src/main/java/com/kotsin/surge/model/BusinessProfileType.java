package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * BusinessProfileType - Profile tag of the business whose signals are analyzed.
 * Carried in {@link SurgeContext}; it does not alter the detection math.
 */
public enum BusinessProfileType {

    LOCAL_SERVICE_B2B("local-service-b2b"),
    LOCAL_SERVICE_B2C("local-service-b2c"),
    REGIONAL_B2B_AGENCY("regional-b2b-agency"),
    REGIONAL_RETAIL_B2C("regional-retail-b2c"),
    NATIONAL_SAAS_B2B("national-saas-b2b"),
    NATIONAL_PRODUCT_B2C("national-product-b2c"),
    GLOBAL_SAAS_B2B("global-saas-b2b");

    private final String wireName;

    BusinessProfileType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static BusinessProfileType fromWireName(String value) {
        for (BusinessProfileType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown business profile type: " + value);
    }
}
