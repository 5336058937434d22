package com.kotsin.surge.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable detector configuration.
 *
 * Updates go through {@link #merge(SurgeConfigOverrides)} which returns a new
 * instance, so a config handed to an analysis run never changes underneath it.
 */
public final class SurgeDetectorConfig {

    // Sensitivity
    private final double minStandardDeviations;     // Min std devs above baseline
    private final double minPercentageIncrease;     // Min % increase to flag
    private final int minDataPointsForBaseline;     // Min points for a valid baseline

    // Detection windows
    private final int surgeWindowHours;
    private final int trendWindowDays;
    private final int baselineWindowDays;

    private final SeverityThresholds severityThresholds;

    // Pattern detection
    private final boolean detectRecurringPatterns;
    private final int patternWindowWeeks;

    private SurgeDetectorConfig(Builder builder) {
        this.minStandardDeviations = builder.minStandardDeviations;
        this.minPercentageIncrease = builder.minPercentageIncrease;
        this.minDataPointsForBaseline = builder.minDataPointsForBaseline;
        this.surgeWindowHours = builder.surgeWindowHours;
        this.trendWindowDays = builder.trendWindowDays;
        this.baselineWindowDays = builder.baselineWindowDays;
        this.severityThresholds = Objects.requireNonNull(builder.severityThresholds,
                "Severity thresholds cannot be null");
        this.detectRecurringPatterns = builder.detectRecurringPatterns;
        this.patternWindowWeeks = builder.patternWindowWeeks;
    }

    public static SurgeDetectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public double getMinStandardDeviations() { return minStandardDeviations; }
    public double getMinPercentageIncrease() { return minPercentageIncrease; }
    public int getMinDataPointsForBaseline() { return minDataPointsForBaseline; }
    public int getSurgeWindowHours() { return surgeWindowHours; }
    public int getTrendWindowDays() { return trendWindowDays; }
    public int getBaselineWindowDays() { return baselineWindowDays; }
    public SeverityThresholds getSeverityThresholds() { return severityThresholds; }
    public boolean isDetectRecurringPatterns() { return detectRecurringPatterns; }
    public int getPatternWindowWeeks() { return patternWindowWeeks; }

    /**
     * New config with every non-null override applied on top of this one.
     *
     * @throws IllegalArgumentException if the merged config is invalid
     */
    public SurgeDetectorConfig merge(SurgeConfigOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        Builder b = toBuilder();
        if (overrides.getMinStandardDeviations() != null) b.minStandardDeviations(overrides.getMinStandardDeviations());
        if (overrides.getMinPercentageIncrease() != null) b.minPercentageIncrease(overrides.getMinPercentageIncrease());
        if (overrides.getMinDataPointsForBaseline() != null) b.minDataPointsForBaseline(overrides.getMinDataPointsForBaseline());
        if (overrides.getSurgeWindowHours() != null) b.surgeWindowHours(overrides.getSurgeWindowHours());
        if (overrides.getTrendWindowDays() != null) b.trendWindowDays(overrides.getTrendWindowDays());
        if (overrides.getBaselineWindowDays() != null) b.baselineWindowDays(overrides.getBaselineWindowDays());
        if (overrides.getSeverityThresholds() != null) b.severityThresholds(overrides.getSeverityThresholds());
        if (overrides.getDetectRecurringPatterns() != null) b.detectRecurringPatterns(overrides.getDetectRecurringPatterns());
        if (overrides.getPatternWindowWeeks() != null) b.patternWindowWeeks(overrides.getPatternWindowWeeks());

        SurgeDetectorConfig merged = b.build();
        merged.validate();
        return merged;
    }

    /**
     * Problems that make this config unusable. Empty when valid.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (!isNonNegative(minStandardDeviations)) {
            errors.add("minStandardDeviations must be a non-negative number: " + minStandardDeviations);
        }
        if (!isNonNegative(minPercentageIncrease)) {
            errors.add("minPercentageIncrease must be a non-negative number: " + minPercentageIncrease);
        }
        if (minDataPointsForBaseline < 0) {
            errors.add("minDataPointsForBaseline must not be negative: " + minDataPointsForBaseline);
        }
        if (surgeWindowHours < 0 || trendWindowDays < 0 || baselineWindowDays < 0 || patternWindowWeeks < 0) {
            errors.add("detection windows must not be negative");
        }
        if (!isNonNegative(severityThresholds.minor()) || !isNonNegative(severityThresholds.critical())) {
            errors.add("severity thresholds must be non-negative numbers: " + severityThresholds);
        } else if (!severityThresholds.isAscending()) {
            errors.add("severity thresholds must ascend from minor to critical: " + severityThresholds);
        }
        return errors;
    }

    /**
     * @throws IllegalArgumentException listing every problem found
     */
    public void validate() {
        List<String> errors = validationErrors();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid surge detector config: " + String.join("; ", errors));
        }
    }

    private static boolean isNonNegative(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value) && value >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurgeDetectorConfig that)) return false;
        return Double.compare(minStandardDeviations, that.minStandardDeviations) == 0
                && Double.compare(minPercentageIncrease, that.minPercentageIncrease) == 0
                && minDataPointsForBaseline == that.minDataPointsForBaseline
                && surgeWindowHours == that.surgeWindowHours
                && trendWindowDays == that.trendWindowDays
                && baselineWindowDays == that.baselineWindowDays
                && detectRecurringPatterns == that.detectRecurringPatterns
                && patternWindowWeeks == that.patternWindowWeeks
                && severityThresholds.equals(that.severityThresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minStandardDeviations, minPercentageIncrease, minDataPointsForBaseline,
                surgeWindowHours, trendWindowDays, baselineWindowDays, severityThresholds,
                detectRecurringPatterns, patternWindowWeeks);
    }

    @Override
    public String toString() {
        return "SurgeDetectorConfig{minStdDevs=" + minStandardDeviations +
               ", minPctIncrease=" + minPercentageIncrease +
               ", minBaselinePoints=" + minDataPointsForBaseline +
               ", surgeWindowHours=" + surgeWindowHours +
               ", trendWindowDays=" + trendWindowDays +
               ", baselineWindowDays=" + baselineWindowDays +
               ", severity=" + severityThresholds +
               ", recurringPatterns=" + detectRecurringPatterns +
               ", patternWindowWeeks=" + patternWindowWeeks + "}";
    }

    /**
     * Builder for SurgeDetectorConfig. Starts from the default values.
     */
    public static class Builder {
        private double minStandardDeviations = 2.0;
        private double minPercentageIncrease = 50.0;
        private int minDataPointsForBaseline = 14;
        private int surgeWindowHours = 24;
        private int trendWindowDays = 14;
        private int baselineWindowDays = 30;
        private SeverityThresholds severityThresholds = SeverityThresholds.defaults();
        private boolean detectRecurringPatterns = true;
        private int patternWindowWeeks = 8;

        public Builder minStandardDeviations(double minStandardDeviations) {
            this.minStandardDeviations = minStandardDeviations;
            return this;
        }

        public Builder minPercentageIncrease(double minPercentageIncrease) {
            this.minPercentageIncrease = minPercentageIncrease;
            return this;
        }

        public Builder minDataPointsForBaseline(int minDataPointsForBaseline) {
            this.minDataPointsForBaseline = minDataPointsForBaseline;
            return this;
        }

        public Builder surgeWindowHours(int surgeWindowHours) {
            this.surgeWindowHours = surgeWindowHours;
            return this;
        }

        public Builder trendWindowDays(int trendWindowDays) {
            this.trendWindowDays = trendWindowDays;
            return this;
        }

        public Builder baselineWindowDays(int baselineWindowDays) {
            this.baselineWindowDays = baselineWindowDays;
            return this;
        }

        public Builder severityThresholds(SeverityThresholds severityThresholds) {
            this.severityThresholds = severityThresholds;
            return this;
        }

        public Builder detectRecurringPatterns(boolean detectRecurringPatterns) {
            this.detectRecurringPatterns = detectRecurringPatterns;
            return this;
        }

        public Builder patternWindowWeeks(int patternWindowWeeks) {
            this.patternWindowWeeks = patternWindowWeeks;
            return this;
        }

        public SurgeDetectorConfig build() {
            return new SurgeDetectorConfig(this);
        }
    }

    /**
     * Create a builder from this config.
     */
    public Builder toBuilder() {
        return new Builder()
            .minStandardDeviations(minStandardDeviations)
            .minPercentageIncrease(minPercentageIncrease)
            .minDataPointsForBaseline(minDataPointsForBaseline)
            .surgeWindowHours(surgeWindowHours)
            .trendWindowDays(trendWindowDays)
            .baselineWindowDays(baselineWindowDays)
            .severityThresholds(severityThresholds)
            .detectRecurringPatterns(detectRecurringPatterns)
            .patternWindowWeeks(patternWindowWeeks);
    }
}
