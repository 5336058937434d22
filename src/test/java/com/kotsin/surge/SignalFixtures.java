package com.kotsin.surge;

import com.kotsin.surge.model.SignalDataPoint;
import com.kotsin.surge.model.TimeGranularity;
import com.kotsin.surge.model.TimeSeriesData;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for daily signal series used across tests.
 */
public final class SignalFixtures {

    /** Mid-June: no seasonal pattern covers the current month. */
    public static final Instant NOW = Instant.parse("2024-06-15T00:00:00Z");

    /** Series start for daily fixtures. May is outside every seasonal pattern. */
    public static final Instant MAY_1 = Instant.parse("2024-05-01T00:00:00Z");

    private SignalFixtures() {}

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static Clock fixedClock(Instant now) {
        return Clock.fixed(now, ZoneOffset.UTC);
    }

    public static SignalDataPoint point(Instant timestamp, double count) {
        return SignalDataPoint.builder().timestamp(timestamp).count(count).build();
    }

    /**
     * One point per day starting at {@code start}.
     */
    public static List<SignalDataPoint> daily(Instant start, double... counts) {
        List<SignalDataPoint> points = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            points.add(point(start.plus(Duration.ofDays(i)), counts[i]));
        }
        return points;
    }

    public static TimeSeriesData series(List<SignalDataPoint> points) {
        return TimeSeriesData.builder()
                .dataPoints(points)
                .granularity(TimeGranularity.DAILY)
                .startDate(points.isEmpty() ? null : points.get(0).getTimestamp())
                .endDate(points.isEmpty() ? null : points.get(points.size() - 1).getTimestamp())
                .build();
    }

    public static TimeSeriesData series(double... counts) {
        return series(daily(MAY_1, counts));
    }

    /**
     * 20 jittered quiet days around 10, three days at 50, two quiet days.
     * Mean 14.8, population stddev ~13.02, spike ~2.70 std devs above.
     */
    public static double[] spikeCounts() {
        double[] counts = new double[25];
        double[] jitter = {9, 11, 10};
        for (int i = 0; i < 20; i++) {
            counts[i] = jitter[i % 3];
        }
        counts[20] = 50;
        counts[21] = 50;
        counts[22] = 50;
        counts[23] = 10;
        counts[24] = 10;
        return counts;
    }

    /**
     * Constant value repeated {@code n} times.
     */
    public static double[] constant(int n, double value) {
        double[] counts = new double[n];
        Arrays.fill(counts, value);
        return counts;
    }

    /**
     * Four points per month across 2023: November and December at 30, every
     * other month at 10.
     */
    public static TimeSeriesData yearEndHeavySeries() {
        List<SignalDataPoint> points = new ArrayList<>();
        for (int month = 1; month <= 12; month++) {
            double count = (month == 11 || month == 12) ? 30 : 10;
            for (int day = 1; day <= 22; day += 7) {
                points.add(point(Instant.parse(String.format("2023-%02d-%02dT00:00:00Z", month, day)), count));
            }
        }
        return series(points);
    }
}
