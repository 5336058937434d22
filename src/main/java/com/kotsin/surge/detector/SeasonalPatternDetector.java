package com.kotsin.surge.detector;

import com.kotsin.surge.config.SurgeDetectorConfig;
import com.kotsin.surge.model.SeasonalPattern;
import com.kotsin.surge.model.SeasonalPatternMatch;
import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.TimeSeriesData;
import com.kotsin.surge.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * SeasonalPatternDetector - Compares activity inside each pattern's months
 * against all other months.
 *
 * A pattern matches when inMean / max(otherMean, 1) >= 1.3, with
 * confidence = min(1, (ratio - 1) / 2). Patterns with fewer than 3 points
 * in either bucket are skipped. Months are read in UTC.
 */
@Slf4j
@Component
public class SeasonalPatternDetector {

    private static final int MIN_BUCKET_POINTS = 3;
    private static final double MIN_RATIO = 1.3;

    private final Clock clock;

    public SeasonalPatternDetector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Matching patterns sorted by confidence descending.
     */
    public List<SeasonalPatternMatch> detect(TimeSeriesData data, SurgeDetectorConfig config) {
        List<SeasonalPatternMatch> matches = new ArrayList<>();
        if (!config.isDetectRecurringPatterns()) {
            return matches;
        }

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);

        for (SeasonalPattern pattern : SeasonalPattern.values()) {
            double patternSum = 0, otherSum = 0;
            int patternCount = 0, otherCount = 0;

            for (SignalDataPoint point : data.getDataPoints()) {
                int month = point.getTimestamp().atZone(ZoneOffset.UTC).getMonthValue();
                if (pattern.contains(month)) {
                    patternSum += point.getCount();
                    patternCount++;
                } else {
                    otherSum += point.getCount();
                    otherCount++;
                }
            }

            if (patternCount < MIN_BUCKET_POINTS || otherCount < MIN_BUCKET_POINTS) continue;

            double patternAvg = MathUtils.safeDivide(patternSum, patternCount, 0.0);
            double otherAvg = MathUtils.safeDivide(otherSum, otherCount, 0.0);
            double ratio = patternAvg / Math.max(otherAvg, 1);

            if (ratio >= MIN_RATIO) {
                SeasonalPatternMatch match = SeasonalPatternMatch.builder()
                        .pattern(pattern.getPatternName())
                        .confidence(Math.min(1, (ratio - 1) / 2))
                        .nextOccurrence(nextOccurrence(pattern, today))
                        .build();
                log.debug("SEASONAL MATCH | pattern={} | ratio={} | confidence={} | next={}",
                        match.getPattern(), String.format("%.2f", ratio),
                        String.format("%.2f", match.getConfidence()), match.getNextOccurrence());
                matches.add(match);
            }
        }

        matches.sort(Comparator.comparingDouble(SeasonalPatternMatch::getConfidence).reversed());
        return matches;
    }

    /**
     * First day of the first pattern month strictly after the current month,
     * rolling into next year when none remain this year.
     */
    static LocalDate nextOccurrence(SeasonalPattern pattern, LocalDate today) {
        int currentMonth = today.getMonthValue();
        for (int month : pattern.getMonths()) {
            if (month > currentMonth) {
                return LocalDate.of(today.getYear(), month, 1);
            }
        }
        return LocalDate.of(today.getYear() + 1, pattern.getMonths().get(0), 1);
    }
}
