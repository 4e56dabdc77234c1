package com.github.stormino.audioextract.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Nested
    @DisplayName("isValidTimestamp")
    class IsValidTimestampTests {

        @ParameterizedTest
        @ValueSource(strings = {"00:00:00", "1:02:03", "12:34:56.7", "00:01:30.500"})
        @DisplayName("should accept HH:MM:SS with optional milliseconds")
        void shouldAcceptValidTimestamps(String timestamp) {
            assertTrue(FormatUtils.isValidTimestamp(timestamp));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"1:2:3", "123:00:00", "00:00:00.1234", "00:00", "abc", "00:00:00."})
        @DisplayName("should reject malformed timestamps")
        void shouldRejectMalformedTimestamps(String timestamp) {
            assertFalse(FormatUtils.isValidTimestamp(timestamp));
        }
    }

    @Nested
    @DisplayName("timestampToSeconds")
    class TimestampToSecondsTests {

        @ParameterizedTest
        @CsvSource({
            "00:00:00, 0.0",
            "00:01:30.5, 90.5",
            "01:00:00, 3600.0",
            "2:03:04.250, 7384.25"
        })
        @DisplayName("should convert timestamps to seconds")
        void shouldConvertTimestamps(String timestamp, double expected) {
            assertEquals(expected, FormatUtils.timestampToSeconds(timestamp), 0.0001);
        }

        @Test
        @DisplayName("should throw for malformed timestamps")
        void shouldThrowForMalformed() {
            assertThrows(IllegalArgumentException.class, () -> FormatUtils.timestampToSeconds("1:2"));
            assertThrows(IllegalArgumentException.class, () -> FormatUtils.timestampToSeconds(null));
        }
    }

    @Nested
    @DisplayName("formatDuration")
    class FormatDurationTests {

        @ParameterizedTest
        @CsvSource({
            "0, 0s",
            "45, 45s",
            "125, 2m 5s",
            "3725, 1h 2m 5s",
            "-3, 0s"
        })
        @DisplayName("should format seconds for humans")
        void shouldFormatDuration(long seconds, String expected) {
            assertEquals(expected, FormatUtils.formatDuration(seconds));
        }
    }
}
