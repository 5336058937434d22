package com.kotsin.surge.util;

import java.util.List;

/**
 * MathUtils - Safe statistical helpers for the surge pipeline.
 *
 * Every aggregate special-cases empty input and returns 0 instead of
 * dividing by zero or indexing out of bounds.
 *
 * USAGE:
 * Instead of: double result = a / b;
 * Use: double result = MathUtils.safeDivide(a, b, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     *
     * @param numerator    The numerator
     * @param denominator  The denominator
     * @param defaultValue Value to return if division is unsafe
     * @return Result of division or defaultValue
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    /**
     * Check if a number is valid for use as a denominator
     */
    public static boolean isValidDenominator(double value) {
        return value != 0 && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Check if a number is valid (not NaN, not Infinite)
     */
    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== CLAMPING ========================

    /**
     * Clamp value to range [min, max] with NaN protection
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return (min + max) / 2; // Return midpoint for NaN
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? max : min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp confidence to [0, 1]
     */
    public static double clampConfidence(double value) {
        return clamp(value, 0.0, 1.0);
    }

    // ======================== STATISTICAL ========================

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (squared deviations divided by N, not N-1).
     */
    public static double populationStdDev(double[] values, double mean) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            sumSquaredDiff += Math.pow(v - mean, 2);
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Percentile (0-100) of an ascending array by linear interpolation
     * between the order statistics around index p/100 * (N-1).
     */
    public static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues == null || sortedValues.length == 0) {
            return 0.0;
        }
        double idx = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(idx);
        int upper = (int) Math.ceil(idx);

        if (lower == upper) {
            return sortedValues[lower];
        }
        return sortedValues[lower] + (sortedValues[upper] - sortedValues[lower]) * (idx - lower);
    }

    /**
     * Ordinary least-squares slope of y against its position index 0..N-1.
     * Returns 0 for fewer than two values.
     */
    public static double regressionSlope(double[] yValues) {
        int n = yValues == null ? 0 : yValues.length;
        if (n < 2) {
            return 0.0;
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int x = 0; x < n; x++) {
            double y = yValues[x];
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += (double) x * x;
        }
        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }

    /**
     * Share (0-100) of values strictly below the given value.
     */
    public static double percentileRank(List<Double> values, double value) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        long below = values.stream().filter(v -> v < value).count();
        return (double) below / values.size() * 100;
    }
}
