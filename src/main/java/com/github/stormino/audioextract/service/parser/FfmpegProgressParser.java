package com.github.stormino.audioextract.service.parser;

import com.github.stormino.audioextract.util.FormatUtils;
import com.github.stormino.audioextract.util.ProgressCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for FFmpeg diagnostic output.
 * Converts {@code time=} markers into a fraction of the input duration. The reported
 * fraction never moves backwards within one run.
 */
@Slf4j
public class FfmpegProgressParser implements ProgressParser {

    private static final Pattern FFMPEG_TIME_PATTERN = Pattern.compile("time=(\\d{2}):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
    private static final Pattern FFMPEG_DURATION_PATTERN = Pattern.compile("Duration:\\s*(\\d{2}):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

    private final Double probedDuration;
    private Double totalDuration;
    private double lastProgress = -1.0;

    /**
     * @param knownDuration Duration from the media probe in seconds; zero or less means unknown
     */
    public FfmpegProgressParser(double knownDuration) {
        this.probedDuration = knownDuration > 0 ? knownDuration : null;
        this.totalDuration = probedDuration;
    }

    public FfmpegProgressParser() {
        this(0.0);
    }

    @Override
    public Double parseLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }

        // Banner fallback when the probe had nothing
        if (totalDuration == null && line.contains("Duration:")) {
            extractDuration(line);
            return null;
        }

        if (totalDuration == null || !line.contains("time=")) {
            return null;
        }

        Matcher timeMatcher = FFMPEG_TIME_PATTERN.matcher(line);
        if (!timeMatcher.find()) {
            return null;
        }

        double currentTime;
        try {
            currentTime = FormatUtils.toSeconds(timeMatcher.group(1), timeMatcher.group(2), timeMatcher.group(3));
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable time marker: {}", line);
            return null;
        }

        Double progress = ProgressCalculator.fractionByTime(currentTime, totalDuration);
        if (progress == null || progress <= lastProgress) {
            return null;
        }

        lastProgress = progress;
        return progress;
    }

    @Override
    public void reset() {
        totalDuration = probedDuration;
        lastProgress = -1.0;
    }

    @Override
    public Double getTotalDuration() {
        return totalDuration;
    }

    private void extractDuration(String line) {
        Matcher durationMatcher = FFMPEG_DURATION_PATTERN.matcher(line);
        if (durationMatcher.find()) {
            double duration = FormatUtils.toSeconds(
                    durationMatcher.group(1),
                    durationMatcher.group(2),
                    durationMatcher.group(3));
            if (duration > 0) {
                totalDuration = duration;
                log.debug("Extracted total duration: {} seconds", totalDuration);
            }
        }
    }
}
