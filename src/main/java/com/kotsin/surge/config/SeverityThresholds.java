package com.kotsin.surge.config;

import com.kotsin.surge.model.SurgeSeverity;

/**
 * Standard-deviation cut-points for the four severity tiers.
 * Must be non-decreasing from minor to critical.
 */
public record SeverityThresholds(double minor, double moderate, double significant, double critical) {

    public static SeverityThresholds defaults() {
        return new SeverityThresholds(2.0, 2.5, 3.0, 4.0);
    }

    /**
     * Cut-point for one severity tier.
     */
    public double thresholdFor(SurgeSeverity severity) {
        return switch (severity) {
            case MINOR -> minor;
            case MODERATE -> moderate;
            case SIGNIFICANT -> significant;
            case CRITICAL -> critical;
        };
    }

    public boolean isAscending() {
        return minor <= moderate && moderate <= significant && significant <= critical;
    }
}
