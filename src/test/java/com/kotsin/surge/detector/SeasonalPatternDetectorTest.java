package com.kotsin.surge.detector;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.SeasonalPattern;
import com.kotsin.surge.model.SeasonalPatternMatch;
import com.kotsin.surge.model.TimeSeriesData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.kotsin.surge.SignalFixtures.constant;
import static com.kotsin.surge.SignalFixtures.fixedClock;
import static com.kotsin.surge.SignalFixtures.series;
import static com.kotsin.surge.SignalFixtures.yearEndHeavySeries;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Clock fixed at 2024-06-15. Fixture: November and December at 3x the
 * activity of other months, four points per month.
 */
@DisplayName("SeasonalPatternDetector")
class SeasonalPatternDetectorTest {

    private final SeasonalPatternDetector detector = new SeasonalPatternDetector(fixedClock());
    private final SurgeDetectorConfig config = SurgeDetectorConfig.defaults();

    @Test
    @DisplayName("Year-end heavy series matches the patterns covering November and December")
    void testYearEndMatches() {
        List<SeasonalPatternMatch> matches = detector.detect(yearEndHeavySeries(), config);

        assertEquals(3, matches.size());
        // 30 / (520 / 44) = 2.538 -> (ratio - 1) / 2
        assertEquals("black-friday", matches.get(0).getPattern());
        assertEquals("year-end", matches.get(1).getPattern());
        assertEquals("q4-budget", matches.get(2).getPattern());
        assertEquals((30 / (520.0 / 44) - 1) / 2, matches.get(0).getConfidence(), 1e-9);
        // (280 / 12) / 10 = 2.333
        assertEquals((280.0 / 12 / 10 - 1) / 2, matches.get(2).getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Next occurrence is the first day of the next pattern month, in the future")
    void testNextOccurrence() {
        List<SeasonalPatternMatch> matches = detector.detect(yearEndHeavySeries(), config);

        assertEquals(LocalDate.of(2024, 11, 1), matches.get(0).getNextOccurrence());
        assertEquals(LocalDate.of(2024, 12, 1), matches.get(1).getNextOccurrence());
        assertEquals(LocalDate.of(2024, 10, 1), matches.get(2).getNextOccurrence());
        matches.forEach(match -> assertTrue(match.getNextOccurrence().isAfter(LocalDate.of(2024, 6, 15))));
    }

    @Test
    @DisplayName("Next occurrence rolls into next year when the current month is the last pattern month")
    void testNextOccurrenceRollover() {
        assertEquals(LocalDate.of(2025, 10, 1),
                SeasonalPatternDetector.nextOccurrence(SeasonalPattern.Q4_BUDGET, LocalDate.of(2024, 12, 5)));
        assertEquals(LocalDate.of(2024, 12, 1),
                SeasonalPatternDetector.nextOccurrence(SeasonalPattern.Q4_BUDGET, LocalDate.of(2024, 11, 20)));
        assertEquals(LocalDate.of(2025, 11, 1),
                SeasonalPatternDetector.nextOccurrence(SeasonalPattern.BLACK_FRIDAY, LocalDate.of(2024, 11, 2)));
    }

    @Test
    @DisplayName("Disabled pattern detection returns nothing")
    void testDisabled() {
        SurgeDetectorConfig disabled = config.toBuilder().detectRecurringPatterns(false).build();

        assertTrue(detector.detect(yearEndHeavySeries(), disabled).isEmpty());
    }

    @Test
    @DisplayName("Buckets with fewer than three points are skipped")
    void testSparseBuckets() {
        // All points fall in May: every pattern has an empty in-bucket
        TimeSeriesData sparse = series(constant(20, 10));

        assertTrue(detector.detect(sparse, config).isEmpty());
    }

    @Test
    @DisplayName("Flat activity across the year matches nothing")
    void testFlatYear() {
        TimeSeriesData flat = yearEndHeavySeries();
        flat.getDataPoints().forEach(point -> point.setCount(10));

        assertTrue(detector.detect(flat, config).isEmpty());
    }
}
