package com.github.stormino.audioextract.model;

import com.github.stormino.audioextract.util.FormatUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Map;

/**
 * Immutable audio conversion settings, copied by value into every job.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class ConversionParameters {

    private static final Map<String, String> CODEC_MAP = Map.of(
            "mp3", "libmp3lame",
            "wav", "pcm_s16le",
            "m4a", "aac",
            "flac", "flac",
            "aac", "aac",
            "ogg", "libvorbis");

    @Builder.Default
    String outputFormat = "mp3";

    /** ffmpeg encoder; blank picks the default encoder for the output format. */
    String codec;

    @Builder.Default
    String bitrate = "192k";

    @Builder.Default
    int sampleRate = 44100;

    @Builder.Default
    int channels = 2;

    /** Trim start, HH:MM:SS[.mmm]. */
    String startTime;

    /** Trim end, HH:MM:SS[.mmm]. */
    String endTime;

    /** Audio stream index within the input; null selects the first audio stream. */
    Integer streamIndex;

    boolean normalizeLoudness;

    boolean normalizePeak;

    @Builder.Default
    double peakTarget = -1.0;

    /**
     * Check the parameters before a job is admitted.
     *
     * @throws IllegalArgumentException describing the first invalid field
     */
    public void validate() {
        if (outputFormat == null || outputFormat.isBlank()) {
            throw new IllegalArgumentException("Output format must not be blank");
        }
        if (bitrate == null || bitrate.isBlank()) {
            throw new IllegalArgumentException("Bitrate must not be blank");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("Sample rate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive: " + channels);
        }
        if (streamIndex != null && streamIndex < 0) {
            throw new IllegalArgumentException("Stream index must not be negative: " + streamIndex);
        }
        if (startTime != null && !FormatUtils.isValidTimestamp(startTime)) {
            throw new IllegalArgumentException("Invalid start time: " + startTime);
        }
        if (endTime != null && !FormatUtils.isValidTimestamp(endTime)) {
            throw new IllegalArgumentException("Invalid end time: " + endTime);
        }
    }

    /**
     * Default ffmpeg encoder for an output container, libmp3lame when unknown.
     */
    public static String defaultCodecFor(String outputFormat) {
        if (outputFormat == null) {
            return "libmp3lame";
        }
        return CODEC_MAP.getOrDefault(outputFormat.toLowerCase(Locale.ROOT), "libmp3lame");
    }

    /**
     * Encoder handed to ffmpeg: the explicit codec, or the output format's default.
     */
    public String resolveCodec() {
        if (codec == null || codec.isBlank()) {
            return defaultCodecFor(outputFormat);
        }
        return codec;
    }
}
