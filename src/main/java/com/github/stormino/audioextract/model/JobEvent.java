package com.github.stormino.audioextract.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class JobEvent {

    private JobEventType type;
    private String jobId;  // null for queue-level events
    private Double progress;
    private JobResult result;
    private String message;
    private QueueStats stats;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public static JobEvent started(String jobId) {
        return JobEvent.builder()
                .type(JobEventType.JOB_STARTED)
                .jobId(jobId)
                .progress(0.0)
                .build();
    }

    public static JobEvent progress(String jobId, double progress) {
        return JobEvent.builder()
                .type(JobEventType.JOB_PROGRESS)
                .jobId(jobId)
                .progress(progress)
                .build();
    }

    public static JobEvent completed(String jobId, JobResult result) {
        return JobEvent.builder()
                .type(JobEventType.JOB_COMPLETED)
                .jobId(jobId)
                .progress(1.0)
                .result(result)
                .message(result.getMessage())
                .build();
    }

    public static JobEvent failed(String jobId, String errorMessage) {
        return JobEvent.builder()
                .type(JobEventType.JOB_FAILED)
                .jobId(jobId)
                .message(errorMessage)
                .build();
    }

    public static JobEvent cancelled(String jobId) {
        return JobEvent.builder()
                .type(JobEventType.JOB_CANCELLED)
                .jobId(jobId)
                .message("Conversion cancelled by user")
                .build();
    }

    public static JobEvent skipped(String jobId, String reason) {
        return JobEvent.builder()
                .type(JobEventType.JOB_SKIPPED)
                .jobId(jobId)
                .message(reason)
                .build();
    }

    public static JobEvent queueUpdated() {
        return JobEvent.builder()
                .type(JobEventType.QUEUE_UPDATED)
                .build();
    }

    public static JobEvent allCompleted(QueueStats stats) {
        return JobEvent.builder()
                .type(JobEventType.ALL_COMPLETED)
                .stats(stats)
                .build();
    }

    public static JobEvent workerError(String message) {
        return JobEvent.builder()
                .type(JobEventType.WORKER_ERROR)
                .message(message)
                .build();
    }
}
