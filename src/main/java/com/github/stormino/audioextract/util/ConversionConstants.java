package com.github.stormino.audioextract.util;

/**
 * Constants used throughout the conversion engine.
 */
public final class ConversionConstants {

    private ConversionConstants() {
        // Utility class, no instantiation
    }

    // ========== File Naming ==========

    /**
     * Replacement for characters the host filesystem rejects.
     */
    public static final String INVALID_CHAR_PLACEHOLDER = "_";

    /**
     * Fallback when sanitizing leaves nothing of a filename.
     */
    public static final String DEFAULT_FILENAME = "converted_file";

    /**
     * Longest filename accepted by common filesystems.
     */
    public static final int MAX_FILENAME_LENGTH = 255;

    /**
     * Highest counter tried when looking for a free "name (n).ext" variant.
     */
    public static final int MAX_UNIQUE_SUFFIX = 9999;

    /**
     * Numbered variant format: base name, counter, extension.
     */
    public static final String UNIQUE_FILENAME_FORMAT = "%s (%d)%s";

    // ========== FFmpeg Configuration ==========

    /**
     * Stream selector used when no audio stream index is requested.
     */
    public static final String FFMPEG_DEFAULT_AUDIO_MAP = "0:a:0";

    /**
     * EBU R128 loudness normalization filter.
     */
    public static final String FFMPEG_LOUDNORM_FILTER = "loudnorm=I=-18:LRA=7:TP=-2";

    /**
     * Encoder that gets highest-quality VBR in addition to the bitrate.
     */
    public static final String FFMPEG_MP3_CODEC = "libmp3lame";

    // ========== Process Management ==========

    /**
     * Name of the control loop thread.
     */
    public static final String SCHEDULER_THREAD_NAME = "conversion-scheduler";

    /**
     * Thread name prefix of the worker pool.
     */
    public static final String WORKER_THREAD_PREFIX = "conversion-";

    /**
     * Prefix of generated batch job ids.
     */
    public static final String BATCH_JOB_ID_PREFIX = "job_";
}
