package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * BaselineStats - Historical profile of a signal used as the comparison point
 * for anomaly detection.
 *
 * Recomputed on every analysis. When fewer points than
 * minDataPointsForBaseline are available every statistic is zero, which in
 * turn disables surge detection (stddev == 0).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineStats {

    private double mean;
    private double standardDeviation;   // population (divide by N)
    private double median;
    private double percentile75;
    private double percentile90;
    private double percentile95;
    private double minValue;
    private double maxValue;
    private int dataPointCount;

    private TrendDirection trendDirection;
    private double trendStrength;       // 0-1

    /**
     * Zero-valued baseline for insufficient data.
     */
    public static BaselineStats insufficient(int dataPointCount) {
        return BaselineStats.builder()
                .dataPointCount(dataPointCount)
                .trendDirection(TrendDirection.STABLE)
                .trendStrength(0)
                .build();
    }
}
