package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.exception.ConversionException;
import com.github.stormino.audioextract.exception.PathExhaustionException;
import com.github.stormino.audioextract.exception.ToolNotFoundException;
import com.github.stormino.audioextract.model.ConversionJob;
import com.github.stormino.audioextract.model.ConversionParameters;
import com.github.stormino.audioextract.model.JobEvent;
import com.github.stormino.audioextract.model.JobEventType;
import com.github.stormino.audioextract.model.JobResult;
import com.github.stormino.audioextract.model.JobStatus;
import com.github.stormino.audioextract.model.OverwritePolicy;
import com.github.stormino.audioextract.model.QueueStats;
import com.github.stormino.audioextract.service.state.JobStateMachine;
import com.github.stormino.audioextract.util.ConversionConstants;
import com.github.stormino.audioextract.util.PathUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job registry, FIFO admission queue and bounded worker pool.
 * <p>
 * A single control loop thread reaps finished executions and admits queued jobs while
 * fewer than {@code maxConcurrentJobs} are in flight. Caller operations only take
 * {@link #lock} for short sections. Events are queued on {@link #outbox} while it is held
 * and published in that order after it is released, so a job's terminal event is never
 * followed by one of its progress events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionQueueService {

    private final AudioExtractProperties properties;
    private final JobExecutor jobExecutor;
    private final OutputPathResolver pathResolver;
    private final JobStateMachine stateMachine;
    private final JobEventBroadcastService eventBroadcast;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<String, ConversionJob> jobs = new LinkedHashMap<>();
    private final Deque<String> pendingQueue = new ArrayDeque<>();
    private final Map<String, InFlight> inFlight = new LinkedHashMap<>();
    private boolean completionSignaled = false;

    // Filled under lock, drained under publishLock
    private final Queue<JobEvent> outbox = new ConcurrentLinkedQueue<>();
    private final ReentrantLock publishLock = new ReentrantLock();

    private final AtomicLong batchSequence = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean paused = false;
    private volatile boolean converterReady = false;

    // Guarded by this
    private Thread controlThread;
    private CountDownLatch shutdownSignal;
    private ThreadPoolTaskExecutor workerPool;
    private int maxConcurrentJobs;

    // ========== Admission ==========

    /**
     * Register a job. The output path is resolved under {@code policy} first; a job whose
     * output already exists under SKIP is registered directly as SKIPPED.
     *
     * @param policy Overwrite policy, or null for the configured default
     * @return false if the job was not registered (missing input, duplicate id, invalid
     *         parameters, no free output name)
     */
    public boolean addJob(String jobId, Path inputPath, Path outputPath,
                          ConversionParameters parameters, OverwritePolicy policy) {
        if (jobId == null || jobId.isBlank()) {
            log.error("Rejected job without id");
            return false;
        }
        if (inputPath == null || !Files.exists(inputPath)) {
            log.error("Input file not found for job {}: {}", jobId, inputPath);
            return false;
        }
        if (outputPath == null) {
            log.error("No output path for job {}", jobId);
            return false;
        }

        ConversionParameters effectiveParameters = parameters != null
                ? parameters
                : properties.getConversion().toParameters();
        try {
            effectiveParameters.validate();
        } catch (IllegalArgumentException e) {
            log.error("Invalid parameters for job {}: {}", jobId, e.getMessage());
            return false;
        }

        OverwritePolicy effectivePolicy = policy != null
                ? policy
                : properties.getProcessing().getOverwritePolicy();

        OutputPathResolver.Resolution resolution;
        try {
            resolution = pathResolver.resolve(outputPath, effectivePolicy);
        } catch (PathExhaustionException e) {
            log.error("Failed to add job {}: {}", jobId, e.getMessage());
            return false;
        }

        List<JobEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (jobs.containsKey(jobId)) {
                log.error("Duplicate job id: {}", jobId);
                return false;
            }

            ConversionJob job = ConversionJob.builder()
                    .id(jobId)
                    .inputPath(inputPath)
                    .outputPath(resolution.getPath())
                    .parameters(effectiveParameters)
                    .build();
            jobs.put(jobId, job);

            if (resolution.isSkip()) {
                String reason = "File already exists: " + resolution.getPath();
                applyTransition(job, JobStatus.SKIPPED);
                job.setErrorMessage(reason);
                emit(job, JobEventType.JOB_SKIPPED, JobEvent.skipped(jobId, reason), events);
                log.info("Skipped job {}: {}", jobId, reason);
            } else {
                pendingQueue.addLast(jobId);
                completionSignaled = false;
                log.info("Added job {}: {} -> {}", jobId, inputPath, resolution.getPath());
            }
            events.add(JobEvent.queueUpdated());
        } finally {
            outbox.addAll(events);
            lock.unlock();
        }

        drainOutbox();
        return true;
    }

    /**
     * Register one job per input. Each output is {@code <stem>.<format>} in
     * {@code outputDirectory}, or beside its source when the directory is null.
     *
     * @return Admission outcome per generated job id, in input order
     */
    public Map<String, Boolean> addBatchJobs(List<Path> inputPaths, Path outputDirectory,
                                             ConversionParameters parameters, OverwritePolicy policy) {
        ConversionParameters effectiveParameters = parameters != null
                ? parameters
                : properties.getConversion().toParameters();
        long epochSeconds = Instant.now().getEpochSecond();

        Map<String, Boolean> results = new LinkedHashMap<>();
        for (Path inputPath : inputPaths) {
            String jobId = ConversionConstants.BATCH_JOB_ID_PREFIX + epochSeconds + "_" + batchSequence.getAndIncrement();
            Path outputPath = PathUtils.deriveOutputPath(inputPath, outputDirectory, effectiveParameters.getOutputFormat());
            results.put(jobId, addJob(jobId, inputPath, outputPath, effectiveParameters, policy));
        }

        log.info("Batch of {} jobs added ({} accepted)", results.size(),
                results.values().stream().filter(Boolean::booleanValue).count());
        return results;
    }

    // ========== Removal and cancellation ==========

    /**
     * Remove a job. A running job is cancelled instead and stays listed as CANCELLED.
     */
    public boolean removeJob(String jobId) {
        boolean cancelInstead = false;
        lock.lock();
        try {
            ConversionJob job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            if (job.getStatus() == JobStatus.RUNNING) {
                cancelInstead = true;
            } else {
                if (job.getStatus() == JobStatus.QUEUED) {
                    pendingQueue.remove(jobId);
                }
                jobs.remove(jobId);
                outbox.add(JobEvent.queueUpdated());
            }
        } finally {
            lock.unlock();
        }

        if (cancelInstead) {
            return cancelJob(jobId);
        }

        drainOutbox();
        log.info("Removed job {}", jobId);
        return true;
    }

    /**
     * Cancel a queued or running job. Returns immediately; a running ffmpeg process is
     * only signalled.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean cancelJob(String jobId) {
        List<JobEvent> events = new ArrayList<>();
        boolean wasRunning;
        lock.lock();
        try {
            ConversionJob job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            wasRunning = job.getStatus() == JobStatus.RUNNING;
            if (!cancelLocked(job, events)) {
                return false;
            }
            events.add(JobEvent.queueUpdated());
        } finally {
            outbox.addAll(events);
            lock.unlock();
        }

        if (wasRunning) {
            jobExecutor.cancel(jobId);
        }
        drainOutbox();
        log.info("Cancelled job {}", jobId);
        return true;
    }

    public void cancelAllJobs() {
        List<JobEvent> events = new ArrayList<>();
        List<String> runningIds = new ArrayList<>();
        lock.lock();
        try {
            for (ConversionJob job : jobs.values()) {
                boolean wasRunning = job.getStatus() == JobStatus.RUNNING;
                if (cancelLocked(job, events) && wasRunning) {
                    runningIds.add(job.getId());
                }
            }
            events.add(JobEvent.queueUpdated());
        } finally {
            outbox.addAll(events);
            lock.unlock();
        }

        runningIds.forEach(jobExecutor::cancel);
        drainOutbox();
        log.info("Cancelled all jobs ({} were running)", runningIds.size());
    }

    /**
     * Drop every terminal job from the registry.
     *
     * @return Number of jobs removed
     */
    public int clearCompletedJobs() {
        int cleared = 0;
        lock.lock();
        try {
            Iterator<ConversionJob> it = jobs.values().iterator();
            while (it.hasNext()) {
                if (stateMachine.isTerminalState(it.next().getStatus())) {
                    it.remove();
                    cleared++;
                }
            }
            outbox.add(JobEvent.queueUpdated());
        } finally {
            lock.unlock();
        }

        drainOutbox();
        log.info("Cleared {} completed jobs", cleared);
        return cleared;
    }

    // ========== Queries ==========

    public QueueStats getQueueStats() {
        lock.lock();
        try {
            return QueueStats.of(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshots of all jobs in insertion order.
     */
    public List<ConversionJob> getAllJobs() {
        lock.lock();
        try {
            List<ConversionJob> snapshot = new ArrayList<>(jobs.size());
            for (ConversionJob job : jobs.values()) {
                snapshot.add(job.copy());
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ConversionJob> getJob(String jobId) {
        lock.lock();
        try {
            ConversionJob job = jobs.get(jobId);
            return job != null ? Optional.of(job.copy()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    // ========== Lifecycle ==========

    /**
     * Locate and verify the transcoder. A failure is published as a worker error.
     */
    public boolean initializeConverter(String toolPath) {
        try {
            jobExecutor.initialize(toolPath);
            converterReady = true;
            log.info("FFmpeg converter initialized successfully");
            return true;
        } catch (ToolNotFoundException e) {
            return reportInitializationFailure("FFmpeg not found: " + e.getMessage());
        } catch (ConversionException e) {
            return reportInitializationFailure("Failed to initialize converter: " + e.getMessage());
        }
    }

    private boolean reportInitializationFailure(String message) {
        converterReady = false;
        log.error(message);
        outbox.add(JobEvent.workerError(message));
        drainOutbox();
        return false;
    }

    /**
     * Start the control loop and worker pool, initializing the transcoder first if needed.
     *
     * @return false if the transcoder could not be initialized
     */
    public synchronized boolean startProcessing() {
        if (running) {
            return true;
        }
        if (!converterReady && !initializeConverter(properties.getTools().getFfmpegPath())) {
            return false;
        }

        maxConcurrentJobs = properties.getProcessing().getMaxConcurrentJobs();
        workerPool = createWorkerPool(maxConcurrentJobs);
        shutdownSignal = new CountDownLatch(1);

        lock.lock();
        try {
            completionSignaled = false;
        } finally {
            lock.unlock();
        }

        paused = false;
        running = true;
        controlThread = new Thread(this::runControlLoop, ConversionConstants.SCHEDULER_THREAD_NAME);
        controlThread.setDaemon(true);
        controlThread.start();

        log.info("Conversion scheduler started with {} workers", maxConcurrentJobs);
        return true;
    }

    /**
     * Cancel in-flight jobs, stop the control loop and shut the pool down. Queued jobs
     * stay queued. Waits at most {@code timeout} for the loop to exit.
     */
    public synchronized void stopProcessing(Duration timeout) {
        if (!running) {
            return;
        }

        log.info("Stopping conversion scheduler...");
        running = false;

        List<JobEvent> events = new ArrayList<>();
        List<String> cancelledIds = new ArrayList<>();
        lock.lock();
        try {
            for (String jobId : inFlight.keySet()) {
                ConversionJob job = jobs.get(jobId);
                if (job != null && cancelLocked(job, events)) {
                    cancelledIds.add(jobId);
                }
            }
            inFlight.clear();
            events.add(JobEvent.queueUpdated());
        } finally {
            outbox.addAll(events);
            lock.unlock();
        }

        cancelledIds.forEach(jobExecutor::cancel);
        shutdownSignal.countDown();

        try {
            controlThread.join(timeout.toMillis());
            if (controlThread.isAlive()) {
                log.warn("Control loop did not exit within {} ms, continuing shutdown", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the control loop to exit");
        }

        workerPool.shutdown();
        workerPool = null;
        controlThread = null;

        drainOutbox();
        log.info("Conversion scheduler stopped");
    }

    public void pauseProcessing() {
        paused = true;
        log.info("Conversion scheduler paused");
    }

    public void resumeProcessing() {
        paused = false;
        log.info("Conversion scheduler resumed");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getProcessing().isAutoStart()) {
            log.info("Auto-starting conversion scheduler");
            startProcessing();
        }
    }

    @PreDestroy
    public void shutdown() {
        stopProcessing(Duration.ofSeconds(properties.getProcessing().getStopTimeoutSeconds()));
    }

    private ThreadPoolTaskExecutor createWorkerPool(int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(ConversionConstants.WORKER_THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // ========== Control loop ==========

    private void runControlLoop() {
        long pollInterval = properties.getProcessing().getPollIntervalMs();
        CountDownLatch signal = shutdownSignal;
        log.debug("Control loop started");
        try {
            while (running) {
                try {
                    tick();
                } catch (RuntimeException e) {
                    log.error("Worker loop error: {}", e.getMessage(), e);
                    outbox.add(JobEvent.workerError("Worker error: " + e.getMessage()));
                    drainOutbox();
                }
                if (signal.await(pollInterval, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Control loop exited");
    }

    /**
     * One scheduling pass: reap, admit, then check for the end of the batch.
     */
    void tick() {
        if (paused) {
            return;
        }

        List<JobEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (!running) {
                return;
            }
            reapFinished(events);
            admitQueued(events);
            checkAllCompleted(events);
        } finally {
            outbox.addAll(events);
            lock.unlock();
        }

        drainOutbox();
    }

    private void reapFinished(List<JobEvent> events) {
        boolean reaped = false;
        Iterator<Map.Entry<String, InFlight>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, InFlight> entry = it.next();
            Future<JobResult> future = entry.getValue().getFuture();
            if (!future.isDone()) {
                continue;
            }
            it.remove();
            reaped = true;

            ConversionJob job = jobs.get(entry.getKey());
            if (job == null || job != entry.getValue().getJob() || job.getStatus() != JobStatus.RUNNING) {
                // Removed or cancelled while the process was winding down
                continue;
            }

            finish(job, resultOf(entry.getKey(), future), events);
        }

        if (reaped) {
            events.add(JobEvent.queueUpdated());
        }
    }

    private JobResult resultOf(String jobId, Future<JobResult> future) {
        try {
            JobResult result = future.get();
            if (result == null) {
                return JobResult.failure("Executor returned no result", JobResult.ErrorCode.UNEXPECTED, Duration.ZERO);
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job {} failed unexpectedly: {}", jobId, cause.getMessage(), cause);
            return JobResult.failure("Unexpected error: " + cause.getMessage(),
                    JobResult.ErrorCode.UNEXPECTED, Duration.ZERO);
        } catch (CancellationException e) {
            return JobResult.cancelled("Conversion cancelled", Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobResult.failure("Interrupted while collecting result",
                    JobResult.ErrorCode.UNEXPECTED, Duration.ZERO);
        }
    }

    private void finish(ConversionJob job, JobResult result, List<JobEvent> events) {
        JobStatus target = result.isSuccess()
                ? JobStatus.COMPLETED
                : result.isCancelled() ? JobStatus.CANCELLED : JobStatus.FAILED;
        if (!applyTransition(job, target)) {
            return;
        }
        job.setResult(result);

        switch (target) {
            case COMPLETED -> {
                job.setProgress(1.0);
                emit(job, JobEventType.JOB_COMPLETED, JobEvent.completed(job.getId(), result), events);
                log.info("Job {} completed", job.getId());
            }
            case CANCELLED -> emit(job, JobEventType.JOB_CANCELLED, JobEvent.cancelled(job.getId()), events);
            default -> {
                job.setErrorMessage(result.getMessage());
                emit(job, JobEventType.JOB_FAILED, JobEvent.failed(job.getId(), result.getMessage()), events);
                log.error("Job {} failed: {}", job.getId(), result.getMessage());
            }
        }
    }

    private void admitQueued(List<JobEvent> events) {
        boolean admitted = false;
        while (inFlight.size() < maxConcurrentJobs && !pendingQueue.isEmpty()) {
            String jobId = pendingQueue.pollFirst();
            ConversionJob job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.QUEUED) {
                continue;
            }

            ConversionJob snapshot = job.copy();
            try {
                Future<JobResult> future = workerPool.submit(
                        () -> jobExecutor.execute(snapshot, fraction -> onProgress(job, fraction)));
                applyTransition(job, JobStatus.RUNNING);
                job.setStartedAt(LocalDateTime.now());
                job.setProgress(0.0);
                inFlight.put(jobId, new InFlight(job, snapshot, future));
                emit(job, JobEventType.JOB_STARTED, JobEvent.started(jobId), events);
                log.info("Started job {}: {}", jobId, job.getInputPath());
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected job {}: {}", jobId, e.getMessage());
                applyTransition(job, JobStatus.FAILED);
                JobResult result = JobResult.failure("Worker pool rejected the job",
                        JobResult.ErrorCode.EXECUTOR_REJECTED, Duration.ZERO);
                job.setResult(result);
                job.setErrorMessage(result.getMessage());
                emit(job, JobEventType.JOB_FAILED, JobEvent.failed(jobId, result.getMessage()), events);
            }
            admitted = true;
        }

        if (admitted) {
            events.add(JobEvent.queueUpdated());
        }
    }

    private void checkAllCompleted(List<JobEvent> events) {
        if (completionSignaled || !pendingQueue.isEmpty() || !inFlight.isEmpty()) {
            return;
        }

        boolean anyActive = false;
        boolean anyFinished = false;
        for (ConversionJob job : jobs.values()) {
            if (job.isActive()) {
                anyActive = true;
                break;
            }
            anyFinished = true;
        }
        if (anyActive) {
            return;
        }

        completionSignaled = true;
        // A batch emptied purely by removals has nothing to report
        if (anyFinished) {
            QueueStats stats = QueueStats.of(jobs.values());
            events.add(JobEvent.allCompleted(stats));
            log.info("All jobs completed: {}", stats.toMap());
        }
    }

    /**
     * Progress from a worker. Ignored once {@code job} has left RUNNING or was replaced
     * by a new job with the same id.
     */
    private void onProgress(ConversionJob job, double fraction) {
        lock.lock();
        try {
            if (jobs.get(job.getId()) == job && job.getStatus() == JobStatus.RUNNING && fraction > job.getProgress()) {
                double clamped = Math.min(1.0, fraction);
                job.setProgress(clamped);
                outbox.add(JobEvent.progress(job.getId(), clamped));
            }
        } finally {
            lock.unlock();
        }

        drainOutbox();
    }

    private void drainOutbox() {
        publishLock.lock();
        try {
            JobEvent event;
            while ((event = outbox.poll()) != null) {
                eventBroadcast.publish(event);
            }
        } finally {
            publishLock.unlock();
        }
    }

    // ========== Helpers (lock held) ==========

    private boolean cancelLocked(ConversionJob job, List<JobEvent> events) {
        JobStatus from = job.getStatus();
        if (!applyTransition(job, JobStatus.CANCELLED)) {
            return false;
        }
        if (from == JobStatus.QUEUED) {
            pendingQueue.remove(job.getId());
        } else {
            InFlight execution = inFlight.get(job.getId());
            if (execution != null && execution.getJob() == job) {
                // Seen by the executor even if it has not registered the run yet
                execution.getSnapshot().setCancelRequested(true);
            }
        }
        job.setResult(JobResult.cancelled("Conversion cancelled by user", job.getElapsed()));
        emit(job, JobEventType.JOB_CANCELLED, JobEvent.cancelled(job.getId()), events);
        return true;
    }

    /**
     * Apply a transition if the state machine allows it. Entering a terminal state stamps
     * the completion time, which can therefore happen only once.
     */
    private boolean applyTransition(ConversionJob job, JobStatus target) {
        if (!stateMachine.transition(job.getId(), job.getStatus(), target)) {
            return false;
        }
        job.setStatus(target);
        if (stateMachine.isTerminalState(target)) {
            job.setCompletedAt(LocalDateTime.now());
        }
        return true;
    }

    private static void emit(ConversionJob job, JobEventType type, JobEvent event, List<JobEvent> events) {
        if (!type.isLifecycle() || job.markEmitted(type)) {
            events.add(event);
        }
    }

    /**
     * A submitted execution: the registry entry it belongs to and the snapshot handed to
     * the worker.
     */
    @Value
    private static class InFlight {
        ConversionJob job;
        ConversionJob snapshot;
        Future<JobResult> future;
    }
}
