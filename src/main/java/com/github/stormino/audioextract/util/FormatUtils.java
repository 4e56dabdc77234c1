package com.github.stormino.audioextract.util;

import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for timestamps, durations and other display values.
 */
@UtilityClass
public class FormatUtils {

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2}):(\\d{2}(?:\\.\\d{1,3})?)$");

    /**
     * Check a trim timestamp of the form HH:MM:SS or HH:MM:SS.mmm.
     */
    public static boolean isValidTimestamp(String timestamp) {
        return timestamp != null && TIMESTAMP_PATTERN.matcher(timestamp).matches();
    }

    /**
     * Convert a timestamp of the form HH:MM:SS[.mmm] to seconds.
     *
     * @throws IllegalArgumentException if the timestamp is malformed
     */
    public static double timestampToSeconds(String timestamp) {
        Matcher matcher = timestamp != null ? TIMESTAMP_PATTERN.matcher(timestamp) : null;
        if (matcher == null || !matcher.matches()) {
            throw new IllegalArgumentException("Invalid time format: " + timestamp);
        }
        return toSeconds(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    /**
     * Sum hour, minute and (possibly fractional) second fields.
     */
    public static double toSeconds(String hours, String minutes, String seconds) {
        return Integer.parseInt(hours) * 3600 +
               Integer.parseInt(minutes) * 60 +
               Double.parseDouble(seconds);
    }

    /**
     * Format duration in seconds to human-readable time string.
     *
     * @param seconds Duration in seconds
     * @return Formatted string like "2h 15m 30s", "45m 12s", or "23s"
     */
    public static String formatDuration(long seconds) {
        if (seconds < 0) {
            return "0s";
        }

        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}
