package com.github.stormino.audioextract.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressCalculator")
class ProgressCalculatorTest {

    @Nested
    @DisplayName("fractionByTime")
    class FractionByTimeTests {

        @Test
        @DisplayName("should divide position by duration")
        void shouldDividePositionByDuration() {
            assertEquals(0.25, ProgressCalculator.fractionByTime(25.0, 100.0), 0.0001);
        }

        @Test
        @DisplayName("should clamp to one past the end")
        void shouldClampToOne() {
            assertEquals(1.0, ProgressCalculator.fractionByTime(120.0, 100.0));
        }

        @Test
        @DisplayName("should return null for unknown duration")
        void shouldReturnNullForUnknownDuration() {
            assertNull(ProgressCalculator.fractionByTime(10.0, 0.0));
            assertNull(ProgressCalculator.fractionByTime(10.0, -1.0));
        }

        @Test
        @DisplayName("should return null for negative position")
        void shouldReturnNullForNegativePosition() {
            assertNull(ProgressCalculator.fractionByTime(-1.0, 100.0));
        }
    }

    @Nested
    @DisplayName("estimateRemainingSeconds")
    class EstimateRemainingSecondsTests {

        @Test
        @DisplayName("should extrapolate from elapsed time")
        void shouldExtrapolate() {
            // 30s for 25% -> 120s total -> 90s left
            assertEquals(90L, ProgressCalculator.estimateRemainingSeconds(30.0, 0.25));
        }

        @Test
        @DisplayName("should return zero when done")
        void shouldReturnZeroWhenDone() {
            assertEquals(0L, ProgressCalculator.estimateRemainingSeconds(42.0, 1.0));
        }

        @Test
        @DisplayName("should return null without progress")
        void shouldReturnNullWithoutProgress() {
            assertNull(ProgressCalculator.estimateRemainingSeconds(10.0, 0.0));
            assertNull(ProgressCalculator.estimateRemainingSeconds(0.0, 0.5));
        }
    }
}
