package com.github.stormino.audioextract.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for progress fractions and remaining-time estimates.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Fraction of the total duration already processed, clamped to [0, 1].
     *
     * @param currentTimeSeconds Position reached by the transcoder
     * @param totalDurationSeconds Total input duration
     * @return Fraction in [0, 1], or null when the total is unknown
     */
    public static Double fractionByTime(double currentTimeSeconds, double totalDurationSeconds) {
        if (totalDurationSeconds <= 0 || currentTimeSeconds < 0) {
            return null;
        }

        if (currentTimeSeconds >= totalDurationSeconds) {
            return 1.0;
        }

        return Math.min(1.0, currentTimeSeconds / totalDurationSeconds);
    }

    /**
     * Estimate seconds remaining from elapsed time and progress fraction.
     *
     * @param elapsedSeconds Wall-clock time since the job started
     * @param progress Fraction done, in (0, 1]
     * @return Remaining seconds, or null if no estimate is possible yet
     */
    public static Long estimateRemainingSeconds(double elapsedSeconds, double progress) {
        if (progress <= 0 || elapsedSeconds <= 0) {
            return null;
        }

        double estimatedTotal = elapsedSeconds / progress;
        return Math.max(0L, Math.round(estimatedTotal - elapsedSeconds));
    }
}
