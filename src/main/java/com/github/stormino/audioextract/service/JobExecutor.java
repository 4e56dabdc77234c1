package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.exception.ToolNotFoundException;
import com.github.stormino.audioextract.model.ConversionJob;
import com.github.stormino.audioextract.model.JobResult;

import java.util.function.DoubleConsumer;

/**
 * Runs a single conversion job to completion on the calling thread.
 */
public interface JobExecutor {

    /**
     * Locate and verify the transcoder.
     *
     * @param toolPath Explicit executable, or null/blank to search for one
     * @throws ToolNotFoundException if no working transcoder is found
     */
    void initialize(String toolPath);

    /**
     * Convert one job. Never throws: every fault is reported as a failed result.
     *
     * @param job Snapshot of the job to run
     * @param progressSink Receives progress fractions in [0, 1]
     * @return Terminal outcome
     */
    JobResult execute(ConversionJob job, DoubleConsumer progressSink);

    /**
     * Ask a running job to stop. Returns without waiting for the process to exit.
     */
    void cancel(String jobId);

    void cancelAll();
}
