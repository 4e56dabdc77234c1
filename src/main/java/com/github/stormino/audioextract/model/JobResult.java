package com.github.stormino.audioextract.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Terminal outcome of a conversion job, attached once when the job leaves RUNNING.
 */
@Data
@Builder
public class JobResult {

    private final boolean success;

    @Builder.Default
    private final ResultStatus status = ResultStatus.SUCCESS;

    /**
     * Human-readable outcome.
     */
    private final String message;

    /**
     * Output file that was actually written, only on success.
     */
    private final Path outputPath;

    /**
     * Machine-readable failure classification, null unless the job failed.
     */
    private final ErrorCode errorCode;

    /**
     * Transcoder exit code when the process ran to completion.
     */
    private final Integer exitCode;

    @Builder.Default
    private final Duration duration = Duration.ZERO;

    public enum ResultStatus {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    public enum ErrorCode {
        /** Transcoder exited non-zero. */
        PROCESS_FAILED,
        /** Transcoder exited zero but left no usable output. */
        OUTPUT_MISSING,
        /** Output directory could not be created. */
        OUTPUT_DIR_UNAVAILABLE,
        /** Transcoder could not be started. */
        LAUNCH_FAILED,
        /** Transcoder exceeded the process timeout. */
        TIMEOUT,
        /** Worker pool refused the job. */
        EXECUTOR_REJECTED,
        UNEXPECTED
    }

    public static JobResult success(Path outputPath, Duration duration) {
        return JobResult.builder()
                .success(true)
                .status(ResultStatus.SUCCESS)
                .message("Conversion completed successfully")
                .outputPath(outputPath)
                .exitCode(0)
                .duration(duration)
                .build();
    }

    public static JobResult failure(String message, ErrorCode errorCode, Duration duration) {
        return JobResult.builder()
                .success(false)
                .status(ResultStatus.FAILED)
                .message(message)
                .errorCode(errorCode)
                .duration(duration)
                .build();
    }

    public static JobResult processFailure(String message, int exitCode, Duration duration) {
        return JobResult.builder()
                .success(false)
                .status(ResultStatus.FAILED)
                .message(message)
                .errorCode(ErrorCode.PROCESS_FAILED)
                .exitCode(exitCode)
                .duration(duration)
                .build();
    }

    public static JobResult cancelled(String message, Duration duration) {
        return JobResult.builder()
                .success(false)
                .status(ResultStatus.CANCELLED)
                .message(message)
                .duration(duration)
                .build();
    }

    public boolean isCancelled() {
        return status == ResultStatus.CANCELLED;
    }
}
