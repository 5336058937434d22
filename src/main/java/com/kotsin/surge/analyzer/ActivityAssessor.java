package com.kotsin.surge.analyzer;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.ActivityLevel;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.CurrentActivity;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.util.MathUtils;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ActivityAssessor - Where the latest data point sits against the baseline.
 *
 * Levels by distance from the mean:
 * - SURGING:        >= minStandardDeviations
 * - ELEVATED:       >= 1 std dev
 * - BELOW_BASELINE: <= -1 std dev
 * - NORMAL:         otherwise, or whenever stddev is 0
 */
@Component
public class ActivityAssessor {

    public CurrentActivity assess(List<SignalDataPoint> points, BaselineStats baseline, SurgeDetectorConfig config) {
        if (points.isEmpty()) {
            return CurrentActivity.empty();
        }

        SignalDataPoint latest = points.stream()
                .max(Comparator.comparing(SignalDataPoint::getTimestamp))
                .orElseThrow();
        double currentValue = latest.getCount();

        List<Double> values = points.stream()
                .map(SignalDataPoint::getCount)
                .collect(Collectors.toList());

        return CurrentActivity.builder()
                .level(levelFor(currentValue, baseline, config))
                .value(currentValue)
                .percentileRank(MathUtils.percentileRank(values, currentValue))
                .build();
    }

    ActivityLevel levelFor(double value, BaselineStats baseline, SurgeDetectorConfig config) {
        if (baseline.getStandardDeviation() == 0) {
            return ActivityLevel.NORMAL;
        }
        double stdDevs = (value - baseline.getMean()) / baseline.getStandardDeviation();
        if (stdDevs >= config.getMinStandardDeviations()) return ActivityLevel.SURGING;
        if (stdDevs >= 1) return ActivityLevel.ELEVATED;
        if (stdDevs <= -1) return ActivityLevel.BELOW_BASELINE;
        return ActivityLevel.NORMAL;
    }
}
