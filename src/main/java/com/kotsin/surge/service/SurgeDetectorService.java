package com.kotsin.surge.service;

import com.kotsin.surge.analyzer.ActivityAssessor;
import com.kotsin.surge.analyzer.RecommendationGenerator;
import com.kotsin.surge.analyzer.SurgePredictor;
import com.kotsin.surge.analyzer.SurgeSummarizer;
import com.kotsin.surge.calculator.BaselineCalculator;
import com.kotsin.surge.calculator.ConfidenceScorer;
import com.kotsin.surge.config.SeverityThresholds;
import com.kotsin.surge.config.SurgeConfigOverrides;
import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.config.SurgeDetectorProperties;
import com.kotsin.surge.detector.CauseAttributor;
import com.kotsin.surge.detector.CauseRuleTable;
import com.kotsin.surge.detector.SeasonalPatternDetector;
import com.kotsin.surge.detector.SurgeClassifier;
import com.kotsin.surge.detector.SurgeEventFinalizer;
import com.kotsin.surge.detector.SurgeScanner;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.CurrentActivity;
import com.kotsin.surge.model.SeasonalPatternMatch;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.SurgeAnalysisResult;
import com.kotsin.surge.model.SurgeCheck;
import com.kotsin.surge.model.SurgeContext;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgePrediction;
import com.kotsin.surge.model.SurgeSeverity;
import com.kotsin.surge.model.SurgeSummary;
import com.kotsin.surge.model.TimeSeriesData;
import com.kotsin.surge.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SurgeDetectorService - Entry point for surge analysis over a signal
 * activity time series.
 *
 * Pipeline per analysis:
 * 1. Baseline statistics
 * 2. Surge scan and finalization
 * 3. Current activity
 * 4. Predictions
 * 5. Summary
 *
 * Each call snapshots the config once. Config updates are copy-on-write, so
 * an analysis in flight never sees a half-applied update.
 */
@Slf4j
@Service
public class SurgeDetectorService {

    private static final SurgeSeverity[] SEVERITY_DESCENDING = {
            SurgeSeverity.CRITICAL, SurgeSeverity.SIGNIFICANT, SurgeSeverity.MODERATE, SurgeSeverity.MINOR
    };

    private final AtomicReference<SurgeDetectorConfig> config;

    private final BaselineCalculator baselineCalculator;
    private final SurgeScanner surgeScanner;
    private final SeasonalPatternDetector seasonalPatternDetector;
    private final ActivityAssessor activityAssessor;
    private final SurgePredictor surgePredictor;
    private final SurgeSummarizer surgeSummarizer;

    @Autowired
    public SurgeDetectorService(SurgeDetectorProperties properties,
                                BaselineCalculator baselineCalculator,
                                SurgeScanner surgeScanner,
                                SeasonalPatternDetector seasonalPatternDetector,
                                ActivityAssessor activityAssessor,
                                SurgePredictor surgePredictor,
                                SurgeSummarizer surgeSummarizer) {
        this(properties.toConfig(), baselineCalculator, surgeScanner, seasonalPatternDetector,
                activityAssessor, surgePredictor, surgeSummarizer);
    }

    /**
     * Standalone service with default config and the UTC system clock.
     */
    public SurgeDetectorService() {
        this(SurgeDetectorConfig.defaults(), Clock.systemUTC());
    }

    /**
     * Standalone service wired with the default pipeline components.
     */
    public SurgeDetectorService(SurgeDetectorConfig config, Clock clock) {
        this(config, clock, new SeasonalPatternDetector(clock));
    }

    private SurgeDetectorService(SurgeDetectorConfig config, Clock clock, SeasonalPatternDetector seasonalPatternDetector) {
        this(config,
                new BaselineCalculator(),
                new SurgeScanner(new SurgeEventFinalizer(
                        new SurgeClassifier(),
                        new CauseAttributor(CauseRuleTable.defaults()),
                        new ConfidenceScorer(),
                        new RecommendationGenerator(),
                        clock), clock),
                seasonalPatternDetector,
                new ActivityAssessor(),
                new SurgePredictor(seasonalPatternDetector, clock),
                new SurgeSummarizer());
    }

    SurgeDetectorService(SurgeDetectorConfig config,
                         BaselineCalculator baselineCalculator,
                         SurgeScanner surgeScanner,
                         SeasonalPatternDetector seasonalPatternDetector,
                         ActivityAssessor activityAssessor,
                         SurgePredictor surgePredictor,
                         SurgeSummarizer surgeSummarizer) {
        Objects.requireNonNull(config, "Config cannot be null");
        config.validate();
        this.config = new AtomicReference<>(config);
        this.baselineCalculator = baselineCalculator;
        this.surgeScanner = surgeScanner;
        this.seasonalPatternDetector = seasonalPatternDetector;
        this.activityAssessor = activityAssessor;
        this.surgePredictor = surgePredictor;
        this.surgeSummarizer = surgeSummarizer;
    }

    // ======================== ANALYSIS ========================

    public SurgeAnalysisResult analyzeSurges(TimeSeriesData data) {
        return analyzeSurges(data, null);
    }

    /**
     * Full surge analysis of one series.
     *
     * @param data    series of counts, expected in chronological order
     * @param context optional competitor names, news headlines and profile tag
     */
    public SurgeAnalysisResult analyzeSurges(TimeSeriesData data, SurgeContext context) {
        SurgeDetectorConfig snapshot = config.get();
        TimeSeriesData series = normalize(data);
        SurgeContext ctx = ValidationUtils.getOrDefault(context, SurgeContext.none());

        BaselineStats baseline = baselineCalculator.calculate(series, snapshot);
        List<SurgeEvent> surges = surgeScanner.scan(series.getDataPoints(), baseline, ctx, snapshot);
        CurrentActivity currentActivity = activityAssessor.assess(series.getDataPoints(), baseline, snapshot);
        List<SurgePrediction> predictions = surgePredictor.predict(series, baseline, surges, snapshot);
        SurgeSummary summary = surgeSummarizer.summarize(surges);

        log.info("SURGE ANALYSIS | points={} | mean={} | stdDev={} | surges={} | active={} | level={} | predictions={}",
                series.size(),
                String.format("%.2f", baseline.getMean()),
                String.format("%.2f", baseline.getStandardDeviation()),
                surges.size(), summary.getActiveSurges(),
                currentActivity.getLevel(), predictions.size());

        return SurgeAnalysisResult.builder()
                .surges(surges)
                .baseline(baseline)
                .currentActivity(currentActivity)
                .predictions(predictions)
                .summary(summary)
                .build();
    }

    public BaselineStats calculateBaseline(TimeSeriesData data) {
        return baselineCalculator.calculate(normalize(data), config.get());
    }

    /**
     * Surge events against a precomputed baseline, sorted by
     * standardDeviationsAbove descending.
     */
    public List<SurgeEvent> detectSurges(TimeSeriesData data, BaselineStats baseline, SurgeContext context) {
        return surgeScanner.scan(normalize(data).getDataPoints(), baseline,
                ValidationUtils.getOrDefault(context, SurgeContext.none()), config.get());
    }

    /**
     * Single-value check against the severity cut-points, without event
     * extraction.
     */
    public SurgeCheck isCurrentlySurging(double currentValue, BaselineStats baseline) {
        if (baseline.getStandardDeviation() == 0) {
            return SurgeCheck.notSurging(0);
        }

        double stdDevs = (currentValue - baseline.getMean()) / baseline.getStandardDeviation();
        SeverityThresholds thresholds = config.get().getSeverityThresholds();
        for (SurgeSeverity severity : SEVERITY_DESCENDING) {
            if (stdDevs >= thresholds.thresholdFor(severity)) {
                return new SurgeCheck(true, severity, stdDevs);
            }
        }
        return SurgeCheck.notSurging(stdDevs);
    }

    public List<SeasonalPatternMatch> detectSeasonalPatterns(TimeSeriesData data) {
        return seasonalPatternDetector.detect(normalize(data), config.get());
    }

    // ======================== CONFIG ========================

    public SurgeDetectorConfig getConfig() {
        return config.get();
    }

    /**
     * Merge the non-null overrides into the current config.
     *
     * @throws IllegalArgumentException if the merged config is invalid; the
     *                                  current config stays in force
     */
    public void updateConfig(SurgeConfigOverrides overrides) {
        SurgeDetectorConfig updated = config.updateAndGet(current -> current.merge(overrides));
        log.info("Surge detector config updated: {}", updated);
    }

    // ======================== INPUT BOUNDARY ========================

    /**
     * Null series become empty, points without a timestamp are dropped and
     * out-of-order points are stably sorted. The caller's series is never
     * modified.
     */
    TimeSeriesData normalize(TimeSeriesData data) {
        if (data == null || data.getDataPoints() == null) {
            return TimeSeriesData.builder().build();
        }

        List<SignalDataPoint> points = data.getDataPoints();
        if (!ValidationUtils.allValid(points)) {
            List<SignalDataPoint> valid = new ArrayList<>();
            for (SignalDataPoint point : points) {
                if (ValidationUtils.isValid(point)) {
                    valid.add(point);
                }
            }
            log.warn("Dropped {} data points without a timestamp", points.size() - valid.size());
            points = valid;
        }

        if (!ValidationUtils.isChronological(points)) {
            log.warn("Data points not in chronological order - sorting {} points by timestamp", points.size());
            points = new ArrayList<>(points);
            points.sort(Comparator.comparing(SignalDataPoint::getTimestamp));
        }

        if (points == data.getDataPoints()) {
            return data;
        }
        return data.toBuilder().dataPoints(points).build();
    }
}
