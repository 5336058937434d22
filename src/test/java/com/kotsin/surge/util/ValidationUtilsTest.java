package com.kotsin.surge.util;

import com.kotsin.surge.model.SignalDataPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.kotsin.surge.SignalFixtures.point;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationUtils")
class ValidationUtilsTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    // ========== NULL SAFETY TESTS ==========

    @Test
    @DisplayName("Should reject null point and point without timestamp")
    void testIsValid_NullPoint() {
        assertFalse(ValidationUtils.isValid(null));
        assertFalse(ValidationUtils.isValid(new SignalDataPoint()));
        assertTrue(ValidationUtils.isValid(point(T0, 0)));
    }

    @Test
    @DisplayName("Should treat null point list as valid and ordered")
    void testNullList() {
        assertTrue(ValidationUtils.allValid(null));
        assertTrue(ValidationUtils.isChronological(null));
    }

    @Test
    @DisplayName("Should detect a point without timestamp in a list")
    void testAllValid_MixedList() {
        List<SignalDataPoint> points = new ArrayList<>(List.of(point(T0, 1)));
        points.add(SignalDataPoint.builder().count(2).build());

        assertFalse(ValidationUtils.allValid(points));
    }

    // ========== ORDERING TESTS ==========

    @Test
    @DisplayName("Should accept ascending and equal timestamps")
    void testIsChronological_Ordered() {
        List<SignalDataPoint> points = Arrays.asList(
                point(T0, 1), point(T0, 2), point(T0.plusSeconds(60), 3));

        assertTrue(ValidationUtils.isChronological(points));
    }

    @Test
    @DisplayName("Should reject a timestamp going backwards")
    void testIsChronological_OutOfOrder() {
        List<SignalDataPoint> points = Arrays.asList(
                point(T0.plusSeconds(60), 1), point(T0, 2));

        assertFalse(ValidationUtils.isChronological(points));
    }

    // ========== STRING TESTS ==========

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "\t"})
    @DisplayName("Should treat null and blank strings as empty")
    void testIsNullOrEmpty_String(String value) {
        assertTrue(ValidationUtils.isNullOrEmpty(value));
    }

    @Test
    @DisplayName("getOrDefault falls back only on null")
    void testGetOrDefault() {
        assertEquals("fallback", ValidationUtils.getOrDefault(null, "fallback"));
        assertEquals("value", ValidationUtils.getOrDefault("value", "fallback"));
    }
}
