package com.kotsin.surge.calculator;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.TimeSeriesData;
import com.kotsin.surge.model.TrendDirection;
import com.kotsin.surge.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * BaselineCalculator - Historical profile of a signal time series.
 *
 * Computes:
 * 1. Mean and population standard deviation
 * 2. Median and 75/90/95 percentiles (linear interpolation)
 * 3. Min/max
 * 4. Trend direction and strength from an OLS slope over point position
 *
 * Below minDataPointsForBaseline points the baseline is all zeros, which
 * keeps downstream surge detection silent instead of failing.
 */
@Slf4j
@Component
public class BaselineCalculator {

    private static final int MIN_POINTS_FOR_TREND = 4;
    private static final double TREND_DIRECTION_RATIO = 0.01;   // slope vs mean
    private static final double TREND_STRENGTH_SCALE = 10.0;

    public BaselineStats calculate(TimeSeriesData data, SurgeDetectorConfig config) {
        List<SignalDataPoint> points = data.getDataPoints();
        double[] values = points.stream().mapToDouble(SignalDataPoint::getCount).toArray();

        if (values.length < config.getMinDataPointsForBaseline()) {
            log.debug("BASELINE | insufficient data | points={} | required={}",
                    values.length, config.getMinDataPointsForBaseline());
            return BaselineStats.insufficient(values.length);
        }
        if (values.length == 0) {
            // minDataPointsForBaseline configured as 0
            return BaselineStats.insufficient(0);
        }

        double mean = MathUtils.mean(values);
        double standardDeviation = MathUtils.populationStdDev(values, mean);

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        Trend trend = calculateTrend(values);

        return BaselineStats.builder()
                .mean(mean)
                .standardDeviation(standardDeviation)
                .median(MathUtils.percentile(sorted, 50))
                .percentile75(MathUtils.percentile(sorted, 75))
                .percentile90(MathUtils.percentile(sorted, 90))
                .percentile95(MathUtils.percentile(sorted, 95))
                .minValue(sorted[0])
                .maxValue(sorted[sorted.length - 1])
                .dataPointCount(values.length)
                .trendDirection(trend.direction())
                .trendStrength(trend.strength())
                .build();
    }

    /**
     * Trend from a simple linear regression of count against position index.
     */
    Trend calculateTrend(double[] values) {
        if (values.length < MIN_POINTS_FOR_TREND) {
            return Trend.STABLE;
        }

        double slope = MathUtils.regressionSlope(values);
        double avgY = MathUtils.mean(values);

        // Normalize slope to strength (0-1)
        double normalizedSlope = Math.abs(slope) / Math.max(avgY, 1);
        double strength = Math.min(1, normalizedSlope * TREND_STRENGTH_SCALE);

        if (slope > TREND_DIRECTION_RATIO * avgY) {
            return new Trend(TrendDirection.INCREASING, strength);
        } else if (slope < -TREND_DIRECTION_RATIO * avgY) {
            return new Trend(TrendDirection.DECREASING, strength);
        }
        return Trend.STABLE;
    }

    record Trend(TrendDirection direction, double strength) {
        static final Trend STABLE = new Trend(TrendDirection.STABLE, 0);
    }
}
