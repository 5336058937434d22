package com.kotsin.surge.model;

/**
 * SurgeCheck - Result of a single-value surge check.
 *
 * @param surging  whether the value clears the minor severity cut-point
 * @param severity highest cut-point met, null when not surging
 * @param stdDevs  distance from the baseline mean in standard deviations
 */
public record SurgeCheck(boolean surging, SurgeSeverity severity, double stdDevs) {

    public static SurgeCheck notSurging(double stdDevs) {
        return new SurgeCheck(false, null, stdDevs);
    }
}
