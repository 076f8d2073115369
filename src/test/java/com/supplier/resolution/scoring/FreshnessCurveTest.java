package com.supplier.resolution.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessCurveTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @Nested
    @DisplayName("Tiered curve")
    class Tiered {

        @ParameterizedTest
        @CsvSource({
                "0, 1.0",
                "365, 1.0",
                "366, 0.7",
                "730, 0.7",
                "731, 0.5",
                "1095, 0.5",
                "1096, 0.3",
                "5000, 0.3"
        })
        void tierBoundaries(long ageDays, double expected) {
            assertEquals(expected, FreshnessCurve.TIERED.score(ageDays), 0.0001);
        }
    }

    @Nested
    @DisplayName("Exponential curve")
    class Exponential {

        @Test
        void decaysFromOne() {
            assertEquals(1.0, FreshnessCurve.EXPONENTIAL.score(0), 0.0001);
            assertEquals(Math.exp(-0.0015 * 365), FreshnessCurve.EXPONENTIAL.score(365), 0.0001);
        }

        @Test
        void neverDropsBelowFloor() {
            assertEquals(0.3, FreshnessCurve.EXPONENTIAL.score(1000), 0.0001);
            assertEquals(0.3, FreshnessCurve.EXPONENTIAL.score(100_000), 0.0001);
        }
    }

    @ParameterizedTest
    @EnumSource(FreshnessCurve.class)
    @DisplayName("Every curve is non-increasing in age and within [floor, 1]")
    void monotoneAndBounded(FreshnessCurve curve) {
        double previous = curve.score(0);
        for (long days = 1; days <= 2000; days++) {
            double current = curve.score(days);
            assertTrue(current <= previous, curve + " increased at " + days + " days");
            assertTrue(current >= curve.floor() && current <= 1.0);
            previous = current;
        }
    }

    @Test
    void missingDate_scoresFloor() {
        assertEquals(0.3, FreshnessCurve.TIERED.score(null, NOW), 0.0001);
        assertEquals(0.3, FreshnessCurve.EXPONENTIAL.score(null, NOW), 0.0001);
    }

    @Test
    void futureDate_countsAsZeroDays() {
        Instant future = NOW.plus(Duration.ofDays(10));
        assertEquals(0, FreshnessCurve.ageInDays(future, NOW));
        assertEquals(1.0, FreshnessCurve.TIERED.score(future, NOW), 0.0001);
    }

    @Test
    void ageInDays_wholeDays() {
        assertEquals(3, FreshnessCurve.ageInDays(NOW.minus(Duration.ofHours(80)), NOW));
    }

    @Test
    void fromName_caseInsensitive() {
        assertEquals(FreshnessCurve.EXPONENTIAL, FreshnessCurve.fromName("Exponential"));
        assertEquals(FreshnessCurve.TIERED, FreshnessCurve.fromName(" tiered "));
        assertEquals(FreshnessCurve.TIERED, FreshnessCurve.fromName(null));
    }

    @Test
    void fromName_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(FreshnessCurve.TIERED, FreshnessCurve.fromName("tiered"));
            assertEquals(FreshnessCurve.EXPONENTIAL, FreshnessCurve.fromName("exponential"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void fromName_unknown_throws() {
        assertThrows(IllegalArgumentException.class, () -> FreshnessCurve.fromName("linear"));
    }
}
