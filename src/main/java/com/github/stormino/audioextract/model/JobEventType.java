package com.github.stormino.audioextract.model;

public enum JobEventType {
    JOB_STARTED(true),
    JOB_PROGRESS(false),
    JOB_COMPLETED(true),
    JOB_FAILED(true),
    JOB_CANCELLED(true),
    JOB_SKIPPED(true),
    QUEUE_UPDATED(false),
    ALL_COMPLETED(false),
    WORKER_ERROR(false);

    private final boolean lifecycle;

    JobEventType(boolean lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Lifecycle kinds are delivered at most once per job.
     */
    public boolean isLifecycle() {
        return lifecycle;
    }
}
