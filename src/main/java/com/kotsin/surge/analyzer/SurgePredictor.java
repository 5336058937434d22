package com.kotsin.surge.analyzer;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.detector.SeasonalPatternDetector;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.PredictionType;
import com.kotsin.surge.model.SeasonalPatternMatch;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgePrediction;
import com.kotsin.surge.model.TimeSeriesData;
import com.kotsin.surge.model.TrendDirection;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * SurgePredictor - Forward-looking hints from ongoing surges, the baseline
 * trend and upcoming seasonal patterns.
 *
 * Sources:
 * 1. Ongoing surge        -> CONTINUATION (0.7, 24-72 hours)
 * 2. Strong trend (> 0.5) -> UPCOMING_SURGE or DECLINE (0.5, 1-2 weeks)
 * 3. Top two seasonal matches due within 60 days -> UPCOMING_SURGE
 */
@Component
public class SurgePredictor {

    private static final double CONTINUATION_PROBABILITY = 0.7;
    private static final double CONTINUATION_CONFIDENCE = 0.6;
    private static final double TREND_PROBABILITY = 0.5;
    private static final double MIN_TREND_STRENGTH = 0.5;
    private static final int MAX_SEASONAL_PREDICTIONS = 2;
    private static final long SEASONAL_HORIZON_DAYS = 60;
    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private final SeasonalPatternDetector seasonalPatternDetector;
    private final Clock clock;

    public SurgePredictor(SeasonalPatternDetector seasonalPatternDetector, Clock clock) {
        this.seasonalPatternDetector = seasonalPatternDetector;
        this.clock = clock;
    }

    /**
     * Predictions sorted by probability descending.
     */
    public List<SurgePrediction> predict(TimeSeriesData data, BaselineStats baseline,
                                         List<SurgeEvent> surges, SurgeDetectorConfig config) {
        List<SurgePrediction> predictions = new ArrayList<>();

        Optional<SurgeEvent> ongoing = surges.stream().filter(SurgeEvent::isOngoing).findFirst();
        ongoing.ifPresent(surge -> predictions.add(SurgePrediction.builder()
                .type(PredictionType.CONTINUATION)
                .probability(CONTINUATION_PROBABILITY)
                .expectedTimeframe("24-72 hours")
                .basedOn("Active " + surge.getSeverity() + " surge in progress")
                .confidence(CONTINUATION_CONFIDENCE)
                .build()));

        if (baseline.getTrendDirection() == TrendDirection.INCREASING
                && baseline.getTrendStrength() > MIN_TREND_STRENGTH) {
            predictions.add(trendPrediction(PredictionType.UPCOMING_SURGE,
                    "Strong upward trend detected", baseline.getTrendStrength()));
        } else if (baseline.getTrendDirection() == TrendDirection.DECREASING
                && baseline.getTrendStrength() > MIN_TREND_STRENGTH) {
            predictions.add(trendPrediction(PredictionType.DECLINE,
                    "Downward trend detected", baseline.getTrendStrength()));
        }

        List<SeasonalPatternMatch> matches = seasonalPatternDetector.detect(data, config);
        for (SeasonalPatternMatch match : matches.subList(0, Math.min(MAX_SEASONAL_PREDICTIONS, matches.size()))) {
            long daysUntil = daysUntil(match);
            if (daysUntil > 0 && daysUntil <= SEASONAL_HORIZON_DAYS) {
                predictions.add(SurgePrediction.builder()
                        .type(PredictionType.UPCOMING_SURGE)
                        .probability(match.getConfidence())
                        .expectedTimeframe(daysUntil + " days (" + match.getPattern() + ")")
                        .basedOn("Historical seasonal pattern: " + match.getPattern())
                        .confidence(match.getConfidence())
                        .build());
            }
        }

        predictions.sort(Comparator.comparingDouble(SurgePrediction::getProbability).reversed());
        return predictions;
    }

    private SurgePrediction trendPrediction(PredictionType type, String basedOn, double strength) {
        return SurgePrediction.builder()
                .type(type)
                .probability(TREND_PROBABILITY)
                .expectedTimeframe("1-2 weeks")
                .basedOn(basedOn)
                .confidence(strength)
                .build();
    }

    /**
     * Whole days from now until the match's next occurrence, rounded up.
     */
    private long daysUntil(SeasonalPatternMatch match) {
        long nextMillis = match.getNextOccurrence().atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return (long) Math.ceil((nextMillis - clock.millis()) / MILLIS_PER_DAY);
    }
}
