package com.kotsin.surge.service;

import com.kotsin.surge.config.SeverityThresholds;
import com.kotsin.surge.config.SurgeConfigOverrides;
import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.ActivityLevel;
import com.kotsin.surge.model.BaselineStats;
import com.kotsin.surge.model.SeasonalPattern;
import com.kotsin.surge.model.SeasonalPatternMatch;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.SurgeAnalysisResult;
import com.kotsin.surge.model.SurgeCheck;
import com.kotsin.surge.model.SurgeContext;
import com.kotsin.surge.model.SurgeEvent;
import com.kotsin.surge.model.SurgeSeverity;
import com.kotsin.surge.model.SurgeType;
import com.kotsin.surge.model.TimeSeriesData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.kotsin.surge.SignalFixtures.MAY_1;
import static com.kotsin.surge.SignalFixtures.constant;
import static com.kotsin.surge.SignalFixtures.daily;
import static com.kotsin.surge.SignalFixtures.fixedClock;
import static com.kotsin.surge.SignalFixtures.series;
import static com.kotsin.surge.SignalFixtures.spikeCounts;
import static com.kotsin.surge.SignalFixtures.yearEndHeavySeries;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SurgeDetectorServiceTest - End-to-end analysis through the public API.
 *
 * Clock fixed at 2024-06-15 UTC; daily fixtures start 2024-05-01.
 */
@DisplayName("SurgeDetectorService")
class SurgeDetectorServiceTest {

    private SurgeDetectorService service;

    @BeforeEach
    void setUp() {
        service = new SurgeDetectorService(SurgeDetectorConfig.defaults(), fixedClock());
    }

    // ========== SCENARIOS ==========

    @Test
    @DisplayName("Constant series: zero stddev, no surges, not surging")
    void testConstantSeries() {
        SurgeAnalysisResult result = service.analyzeSurges(series(constant(30, 10)));

        assertEquals(10.0, result.getBaseline().getMean(), 1e-9);
        assertEquals(0.0, result.getBaseline().getStandardDeviation(), 1e-9);
        assertTrue(result.getSurges().isEmpty());

        SurgeCheck check = service.isCurrentlySurging(10, result.getBaseline());
        assertFalse(check.surging());
        assertNull(check.severity());
        assertEquals(0.0, check.stdDevs());
    }

    @Test
    @DisplayName("Three-day jump: one closed surge from the first jump day, at least moderate")
    void testThreeDayJump() {
        SurgeAnalysisResult result = service.analyzeSurges(series(spikeCounts()));

        assertTrue(result.getBaseline().getStandardDeviation() > 0);
        assertEquals(1, result.getSurges().size());

        SurgeEvent surge = result.getSurges().get(0);
        assertEquals(MAY_1.plus(Duration.ofDays(20)), surge.getStartTime());
        assertEquals(MAY_1.plus(Duration.ofDays(22)), surge.getEndTime());
        assertFalse(surge.isOngoing());
        assertTrue(surge.getSeverity().isAtLeast(SurgeSeverity.MODERATE));
        assertEquals(SurgeType.SUDDEN_SPIKE, surge.getType());
        assertTrue(surge.getPotentialCauses().isEmpty());
        // 0.5 base + 0.1 (>= 2.5 std devs) + 0.05 (>= 14 baseline points)
        assertEquals(0.65, surge.getConfidence(), 1e-9);
        assertTrue(surge.getRecommendation().startsWith("MODERATE:"));

        assertEquals(1, result.getSummary().getTotalSurgesDetected());
        assertEquals(0, result.getSummary().getActiveSurges());
        assertEquals(ActivityLevel.NORMAL, result.getCurrentActivity().getLevel());
    }

    @Test
    @DisplayName("Year-end heavy series matches a pattern covering November and December")
    void testSeasonalPattern() {
        List<SeasonalPatternMatch> matches = service.detectSeasonalPatterns(yearEndHeavySeries());

        SeasonalPatternMatch q4 = matches.stream()
                .filter(match -> match.getPattern().equals(SeasonalPattern.Q4_BUDGET.getPatternName()))
                .findFirst()
                .orElseThrow();
        assertTrue(SeasonalPattern.Q4_BUDGET.getMonths().containsAll(List.of(11, 12)));
        assertTrue(q4.getConfidence() > 0);
        assertTrue(q4.getNextOccurrence().isAfter(LocalDate.of(2024, 6, 15)));
    }

    @Test
    @DisplayName("Empty series: zero baseline, normal activity, sudden-spike summary default")
    void testEmptySeries() {
        SurgeAnalysisResult result = service.analyzeSurges(series());

        assertEquals(0.0, result.getBaseline().getMean());
        assertEquals(0.0, result.getBaseline().getStandardDeviation());
        assertEquals(0, result.getBaseline().getDataPointCount());
        assertTrue(result.getSurges().isEmpty());
        assertEquals(ActivityLevel.NORMAL, result.getCurrentActivity().getLevel());
        assertEquals(0, result.getSummary().getTotalSurgesDetected());
        assertEquals(SurgeType.SUDDEN_SPIKE, result.getSummary().getMostCommonSurgeType());
    }

    @Test
    @DisplayName("Competitor-tagged surge is competitor-related even with matching news")
    void testCompetitorBeatsNews() {
        List<SignalDataPoint> points = daily(MAY_1, spikeCounts());
        for (int day = 20; day <= 22; day++) {
            points.get(day).setCompetitor("Acme");
        }
        SurgeContext context = SurgeContext.builder()
                .competitors(new ArrayList<>(List.of("Acme")))
                .recentNews(new ArrayList<>(List.of("Acme raised a Series C")))
                .build();

        SurgeEvent surge = service.analyzeSurges(series(points), context).getSurges().get(0);

        assertEquals(SurgeType.COMPETITOR_RELATED, surge.getType());
        assertEquals(List.of("Funding announcement", "Competitor activity: Acme"), surge.getPotentialCauses());
        assertEquals(List.of("Acme"), surge.getRelatedCompetitors());
    }

    @Test
    @DisplayName("Matching news without competitor tags makes the surge event-driven")
    void testNewsMakesEventDriven() {
        SurgeContext context = SurgeContext.builder()
                .recentNews(new ArrayList<>(List.of("Regional outage reported")))
                .build();

        SurgeEvent surge = service.analyzeSurges(series(spikeCounts()), context).getSurges().get(0);

        assertEquals(SurgeType.EVENT_DRIVEN, surge.getType());
        assertEquals(List.of("Service outage"), surge.getPotentialCauses());
    }

    // ========== DEGRADED INPUT ==========

    @Test
    @DisplayName("Fewer points than the baseline minimum never surge")
    void testInsufficientData() {
        SurgeAnalysisResult result = service.analyzeSurges(series(10, 11, 9, 10, 100, 10));

        assertEquals(0.0, result.getBaseline().getStandardDeviation());
        assertEquals(6, result.getBaseline().getDataPointCount());
        assertTrue(result.getSurges().isEmpty());
    }

    @Test
    @DisplayName("Null series is analyzed as empty")
    void testNullSeries() {
        SurgeAnalysisResult result = service.analyzeSurges(null);

        assertTrue(result.getSurges().isEmpty());
        assertEquals(0, result.getSummary().getTotalSurgesDetected());
        assertTrue(service.detectSeasonalPatterns(null).isEmpty());
    }

    @Test
    @DisplayName("Unsorted input is sorted for analysis without touching the caller's list")
    void testUnsortedInput() {
        List<SignalDataPoint> points = daily(MAY_1, spikeCounts());
        Collections.reverse(points);
        TimeSeriesData reversed = series(points);
        SignalDataPoint firstBefore = reversed.getDataPoints().get(0);

        SurgeAnalysisResult result = service.analyzeSurges(reversed);

        assertEquals(1, result.getSurges().size());
        assertEquals(MAY_1.plus(Duration.ofDays(20)), result.getSurges().get(0).getStartTime());
        assertFalse(result.getSurges().get(0).isOngoing());
        assertSame(firstBefore, reversed.getDataPoints().get(0));
    }

    @Test
    @DisplayName("Points without a timestamp are dropped")
    void testNullTimestampsDropped() {
        List<SignalDataPoint> points = new ArrayList<>(daily(MAY_1, spikeCounts()));
        points.add(5, SignalDataPoint.builder().count(1000).build());

        SurgeAnalysisResult result = service.analyzeSurges(series(points));

        assertEquals(25, result.getBaseline().getDataPointCount());
        assertEquals(1, result.getSurges().size());
    }

    // ========== SINGLE-POINT CHECK ==========

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "30, CRITICAL",
            "26, SIGNIFICANT",
            "23, MODERATE",
            "20, MINOR"
    })
    @DisplayName("isCurrentlySurging reports the highest cut-point met")
    void testIsCurrentlySurging(double value, SurgeSeverity expected) {
        BaselineStats baseline = BaselineStats.builder().mean(10).standardDeviation(5).build();

        SurgeCheck check = service.isCurrentlySurging(value, baseline);

        assertTrue(check.surging());
        assertEquals(expected, check.severity());
        assertEquals((value - 10) / 5, check.stdDevs(), 1e-9);
    }

    @Test
    @DisplayName("isCurrentlySurging below the minor cut-point keeps the distance")
    void testNotSurging() {
        SurgeCheck check = service.isCurrentlySurging(19, BaselineStats.builder().mean(10).standardDeviation(5).build());

        assertFalse(check.surging());
        assertNull(check.severity());
        assertEquals(1.8, check.stdDevs(), 1e-9);
    }

    // ========== CONFIG ==========

    @Test
    @DisplayName("updateConfig merges overrides and keeps other fields")
    void testConfigRoundTrip() {
        SurgeDetectorConfig before = service.getConfig();
        SeverityThresholds strict = new SeverityThresholds(3.0, 3.5, 4.0, 5.0);

        service.updateConfig(SurgeConfigOverrides.builder()
                .minStandardDeviations(3.0)
                .severityThresholds(strict)
                .build());

        SurgeDetectorConfig after = service.getConfig();
        assertEquals(3.0, after.getMinStandardDeviations());
        assertEquals(strict, after.getSeverityThresholds());
        assertEquals(before.getMinPercentageIncrease(), after.getMinPercentageIncrease());
        assertEquals(before.getMinDataPointsForBaseline(), after.getMinDataPointsForBaseline());
        assertEquals(before.isDetectRecurringPatterns(), after.isDetectRecurringPatterns());
        assertEquals(before.getPatternWindowWeeks(), after.getPatternWindowWeeks());
        assertEquals(before.toBuilder().minStandardDeviations(3.0).severityThresholds(strict).build(), after);
    }

    @Test
    @DisplayName("Updated thresholds apply to later analyses")
    void testConfigAppliesToAnalysis() {
        // Spike sits 2.7 std devs above: raising the bar to 3 hides it
        service.updateConfig(SurgeConfigOverrides.builder().minStandardDeviations(3.0).build());

        assertTrue(service.analyzeSurges(series(spikeCounts())).getSurges().isEmpty());
    }

    @Test
    @DisplayName("Invalid update is rejected and the previous config stays")
    void testInvalidUpdateRejected() {
        SurgeDetectorConfig before = service.getConfig();

        assertThrows(IllegalArgumentException.class, () -> service.updateConfig(SurgeConfigOverrides.builder()
                .minPercentageIncrease(-5.0)
                .build()));

        assertSame(before, service.getConfig());
    }

    @Test
    @DisplayName("Default constructor starts from the default config")
    void testDefaultConstructor() {
        assertEquals(SurgeDetectorConfig.defaults(), new SurgeDetectorService().getConfig());
    }
}
