package com.kotsin.surge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * SurgeDetectorProperties - Externalized detector thresholds.
 *
 * All values can be tuned via application.yml:
 * surge.detector.min-standard-deviations=2
 * surge.detector.severity.critical=4
 * etc.
 *
 * Bound once at startup and converted to an immutable {@link SurgeDetectorConfig}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "surge.detector")
public class SurgeDetectorProperties {

    // ============ SENSITIVITY ============

    /**
     * Minimum standard deviations above the baseline mean for a point to count as surging.
     * Default: 2
     */
    private double minStandardDeviations = 2.0;

    /**
     * Minimum percentage increase over the baseline mean for a point to count as surging.
     * Default: 50 (%)
     */
    private double minPercentageIncrease = 50.0;

    /**
     * Minimum points for a valid baseline. Fewer points produce a zero baseline.
     * Default: 14
     */
    private int minDataPointsForBaseline = 14;

    // ============ DETECTION WINDOWS ============

    private int surgeWindowHours = 24;

    private int trendWindowDays = 14;

    private int baselineWindowDays = 30;

    // ============ SEVERITY ============

    private Severity severity = new Severity();

    // ============ PATTERN DETECTION ============

    /**
     * Enable seasonal pattern matching.
     * Default: true
     */
    private boolean detectRecurringPatterns = true;

    private int patternWindowWeeks = 8;

    @Data
    public static class Severity {
        private double minor = 2.0;
        private double moderate = 2.5;
        private double significant = 3.0;
        private double critical = 4.0;
    }

    public SurgeDetectorConfig toConfig() {
        return SurgeDetectorConfig.builder()
                .minStandardDeviations(minStandardDeviations)
                .minPercentageIncrease(minPercentageIncrease)
                .minDataPointsForBaseline(minDataPointsForBaseline)
                .surgeWindowHours(surgeWindowHours)
                .trendWindowDays(trendWindowDays)
                .baselineWindowDays(baselineWindowDays)
                .severityThresholds(new SeverityThresholds(
                        severity.getMinor(), severity.getModerate(),
                        severity.getSignificant(), severity.getCritical()))
                .detectRecurringPatterns(detectRecurringPatterns)
                .patternWindowWeeks(patternWindowWeeks)
                .build();
    }
}
