package com.kotsin.surge.util;

import com.kotsin.surge.model.SignalDataPoint;

import java.util.List;
import java.util.Objects;

/**
 * Utility class for consistent null handling and validation of signal input
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validate SignalDataPoint is not null and carries a timestamp
     */
    public static boolean isValid(SignalDataPoint point) {
        return Objects.nonNull(point) && Objects.nonNull(point.getTimestamp());
    }

    /**
     * Check that every point is valid
     */
    public static boolean allValid(List<SignalDataPoint> points) {
        if (Objects.isNull(points)) {
            return true;
        }
        for (SignalDataPoint point : points) {
            if (!isValid(point)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Check that valid points are in ascending (non-decreasing) timestamp order.
     * Equal timestamps count as ordered.
     */
    public static boolean isChronological(List<SignalDataPoint> points) {
        if (Objects.isNull(points) || points.size() < 2) {
            return true;
        }
        SignalDataPoint previous = null;
        for (SignalDataPoint point : points) {
            if (!isValid(point)) {
                continue;
            }
            if (previous != null && point.getTimestamp().isBefore(previous.getTimestamp())) {
                return false;
            }
            previous = point;
        }
        return true;
    }

    /**
     * Safe get with default value
     */
    public static <T> T getOrDefault(T value, T defaultValue) {
        return Objects.nonNull(value) ? value : defaultValue;
    }

    /**
     * Check if string is null or empty
     */
    public static boolean isNullOrEmpty(String str) {
        return Objects.isNull(str) || str.trim().isEmpty();
    }
}
