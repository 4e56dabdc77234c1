package com.github.stormino.audioextract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.stormino.audioextract.util.ProgressCalculator;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * One source-to-target conversion request. Instances held by the queue are mutated only
 * under its lock; everything handed out is a {@link #copy()}.
 */
@Data
@Builder
public class ConversionJob {

    private String id;

    private Path inputPath;
    private Path outputPath;

    private ConversionParameters parameters;

    @Builder.Default
    private volatile JobStatus status = JobStatus.QUEUED;

    @Builder.Default
    private volatile double progress = 0.0;

    private JobResult result;

    private String errorMessage;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @JsonIgnore
    @Builder.Default
    private Set<JobEventType> emittedEvents = EnumSet.noneOf(JobEventType.class);

    /** Set on the worker's snapshot when the job is cancelled; never copied. */
    @JsonIgnore
    private volatile boolean cancelRequested;

    /**
     * Record that a lifecycle event kind was delivered for this job.
     *
     * @return false if it had already been delivered
     */
    public boolean markEmitted(JobEventType type) {
        return emittedEvents.add(type);
    }

    public boolean isActive() {
        return status == JobStatus.QUEUED || status == JobStatus.RUNNING;
    }

    public Duration getElapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        LocalDateTime end = completedAt != null ? completedAt : LocalDateTime.now();
        return Duration.between(startedAt, end);
    }

    public Long getEtaSeconds() {
        if (status != JobStatus.RUNNING) {
            return null;
        }
        return ProgressCalculator.estimateRemainingSeconds(getElapsed().toMillis() / 1000.0, progress);
    }

    public ConversionJob copy() {
        return ConversionJob.builder()
                .id(id)
                .inputPath(inputPath)
                .outputPath(outputPath)
                .parameters(parameters)
                .status(status)
                .progress(progress)
                .result(result)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .emittedEvents(emittedEvents.isEmpty()
                        ? EnumSet.noneOf(JobEventType.class)
                        : EnumSet.copyOf(emittedEvents))
                .build();
    }
}
