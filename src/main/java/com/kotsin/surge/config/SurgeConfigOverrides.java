package com.kotsin.surge.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial configuration update. Null fields keep the current value.
 * severityThresholds replaces all four cut-points at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurgeConfigOverrides {

    private Double minStandardDeviations;
    private Double minPercentageIncrease;
    private Integer minDataPointsForBaseline;

    private Integer surgeWindowHours;
    private Integer trendWindowDays;
    private Integer baselineWindowDays;

    private SeverityThresholds severityThresholds;

    private Boolean detectRecurringPatterns;
    private Integer patternWindowWeeks;
}
