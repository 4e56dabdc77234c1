package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.exception.MediaProbeException;
import com.github.stormino.audioextract.model.ConversionJob;
import com.github.stormino.audioextract.model.JobResult;
import com.github.stormino.audioextract.service.command.FfmpegCommandBuilder;
import com.github.stormino.audioextract.service.parser.FfmpegProgressParser;
import com.github.stormino.audioextract.util.FormatUtils;
import com.github.stormino.audioextract.util.PathUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleConsumer;

/**
 * {@link JobExecutor} backed by an ffmpeg child process per job.
 */
@Slf4j
@Service
public class ConversionExecutorService implements JobExecutor {

    private final AudioExtractProperties properties;
    private final FfmpegCommandBuilder commandBuilder;
    private final FfmpegToolService toolService;
    private final MediaProbeService mediaProbeService;
    private final RetryTemplate launchRetryTemplate;

    // Live executions per job id; an entry exists only between the start and the end of execute()
    private final ConcurrentHashMap<String, Execution> executions = new ConcurrentHashMap<>();

    public ConversionExecutorService(AudioExtractProperties properties,
                                     FfmpegCommandBuilder commandBuilder,
                                     FfmpegToolService toolService,
                                     MediaProbeService mediaProbeService) {
        this.properties = properties;
        this.commandBuilder = commandBuilder;
        this.toolService = toolService;
        this.mediaProbeService = mediaProbeService;
        this.launchRetryTemplate = createLaunchRetryTemplate(properties.getProcessing());
    }

    private static RetryTemplate createLaunchRetryTemplate(AudioExtractProperties.Processing processing) {
        long initialDelay = processing.getRetryDelayMs();
        return RetryTemplate.builder()
                .maxAttempts(processing.getRetryAttempts() + 1)
                .exponentialBackoff(initialDelay, 2.0, initialDelay * 8)
                .retryOn(IOException.class)
                .build();
    }

    @Override
    public void initialize(String toolPath) {
        toolService.initialize(toolPath);
    }

    @Override
    public JobResult execute(@NonNull ConversionJob job, @NonNull DoubleConsumer progressSink) {
        String jobId = job.getId();
        long startNanos = System.nanoTime();
        Execution execution = new Execution(job);
        executions.put(jobId, execution);
        Process process = null;

        try {
            Path outputPath = job.getOutputPath();
            try {
                Path parent = outputPath.toAbsolutePath().getParent();
                if (parent != null) {
                    PathUtils.createDirectoryStructure(parent);
                }
            } catch (IOException e) {
                log.error("Cannot create output directory for job {}: {}", jobId, e.getMessage());
                return JobResult.failure("Cannot create output directory: " + e.getMessage(),
                        JobResult.ErrorCode.OUTPUT_DIR_UNAVAILABLE, elapsedSince(startNanos));
            }

            double totalDuration = probeDuration(job);

            if (execution.isCancelled()) {
                return JobResult.cancelled("Conversion cancelled before start", elapsedSince(startNanos));
            }

            List<String> command = commandBuilder.buildConversionCommand(
                    resolveFfmpegPath(), job.getInputPath(), outputPath, job.getParameters());
            log.debug("Executing conversion for job {}: {}", jobId, String.join(" ", command));

            try {
                process = launchRetryTemplate.execute(context -> {
                    if (context.getRetryCount() > 0) {
                        log.warn("Retrying launch of job {} (attempt {})", jobId, context.getRetryCount() + 1);
                    }
                    return new ProcessBuilder(command)
                            .redirectErrorStream(true)
                            .start();
                });
            } catch (IOException e) {
                log.error("Failed to launch ffmpeg for job {}: {}", jobId, e.getMessage());
                return JobResult.failure("Failed to start conversion: " + e.getMessage(),
                        JobResult.ErrorCode.LAUNCH_FAILED, elapsedSince(startNanos));
            }

            execution.process = process;
            if (execution.isCancelled()) {
                // cancel() raced with the launch
                destroyProcessTree(process);
            }

            AtomicBoolean timedOut = new AtomicBoolean(false);
            long timeoutMinutes = properties.getProcessing().getProcessTimeoutMinutes();
            Process watched = process;
            process.onExit()
                    .orTimeout(timeoutMinutes, TimeUnit.MINUTES)
                    .whenComplete((p, ex) -> {
                        if (ex instanceof TimeoutException) {
                            timedOut.set(true);
                            log.warn("Job {} exceeded {} minutes, killing ffmpeg", jobId, timeoutMinutes);
                            destroyProcessTree(watched);
                        }
                    });

            Deque<String> tail = readOutput(process, jobId, totalDuration, progressSink);

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES) || timedOut.get()) {
                destroyProcessTree(process);
                return JobResult.failure("Conversion timeout exceeded",
                        JobResult.ErrorCode.TIMEOUT, elapsedSince(startNanos));
            }

            int exitCode = process.exitValue();

            if (execution.isCancelled()) {
                deletePartialOutput(outputPath);
                return JobResult.cancelled("Conversion cancelled by user", elapsedSince(startNanos));
            }

            if (exitCode != 0) {
                String message = "FFmpeg conversion failed: " + String.join("\n", tail);
                log.error("FFmpeg exited with code {} for job {}", exitCode, jobId);
                log.error("Command was: {}", String.join(" ", command));
                return JobResult.processFailure(message, exitCode, elapsedSince(startNanos));
            }

            if (!Files.isRegularFile(outputPath) || Files.size(outputPath) == 0) {
                log.error("FFmpeg reported success for job {} but {} is missing or empty", jobId, outputPath);
                return JobResult.failure("Output file missing or empty: " + outputPath,
                        JobResult.ErrorCode.OUTPUT_MISSING, elapsedSince(startNanos));
            }

            Duration took = elapsedSince(startNanos);
            log.info("Job {} converted in {}: {}", jobId, FormatUtils.formatDuration(took.toSeconds()), outputPath);
            return JobResult.success(outputPath, took);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyProcessTree(process);
            }
            if (execution.isCancelled()) {
                return JobResult.cancelled("Conversion cancelled by user", elapsedSince(startNanos));
            }
            return JobResult.failure("Conversion interrupted", JobResult.ErrorCode.UNEXPECTED, elapsedSince(startNanos));
        } catch (Exception e) {
            log.error("Error executing conversion for job {}: {}", jobId, e.getMessage(), e);
            if (process != null) {
                destroyProcessTree(process);
            }
            return JobResult.failure("Error executing conversion: " + e.getMessage(),
                    JobResult.ErrorCode.UNEXPECTED, elapsedSince(startNanos));
        } finally {
            executions.remove(jobId, execution);
        }
    }

    /**
     * Cancel the live execution of {@code jobId}. A no-op when none is running, so a later
     * job reusing the id is unaffected.
     */
    @Override
    public void cancel(@NonNull String jobId) {
        Execution execution = executions.get(jobId);
        if (execution == null) {
            log.debug("No live execution to cancel for job {}", jobId);
            return;
        }
        execution.cancelled = true;
        Process process = execution.process;
        if (process != null && process.isAlive()) {
            log.debug("Killing ffmpeg process and descendants for job {}", jobId);
            destroyProcessTree(process);
        }
    }

    @Override
    public void cancelAll() {
        executions.keySet().forEach(this::cancel);
    }

    public int getRunningProcessCount() {
        return (int) executions.values().stream()
                .filter(execution -> execution.process != null)
                .count();
    }

    private String resolveFfmpegPath() {
        String ffmpeg = toolService.getFfmpegPath();
        return ffmpeg != null ? ffmpeg : toolService.locate(properties.getTools().getFfmpegPath());
    }

    private double probeDuration(ConversionJob job) {
        try {
            return mediaProbeService.getDuration(job.getInputPath());
        } catch (MediaProbeException e) {
            log.warn("Could not probe {} for job {}, progress will rely on ffmpeg output: {}",
                    job.getInputPath(), job.getId(), e.getMessage());
            return 0.0;
        }
    }

    private Deque<String> readOutput(Process process, String jobId, double totalDuration,
                                     DoubleConsumer progressSink) throws IOException {
        int tailSize = properties.getProcessing().getErrorTailLines();
        Deque<String> tail = new ArrayDeque<>(tailSize);
        FfmpegProgressParser parser = new FfmpegProgressParser(totalDuration);

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("FFmpeg output [{}]: {}", jobId, line);
                if (tail.size() == tailSize) {
                    tail.removeFirst();
                }
                tail.addLast(line.strip());

                Double progress = parser.parseLine(line);
                if (progress != null) {
                    progressSink.accept(progress);
                }
            }
        }
        return tail;
    }

    private static void destroyProcessTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void deletePartialOutput(Path outputPath) {
        try {
            if (Files.deleteIfExists(outputPath)) {
                log.debug("Deleted partial output {}", outputPath);
            }
        } catch (IOException e) {
            log.warn("Could not delete partial output {}: {}", outputPath, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class Execution {

        private final ConversionJob job;
        private volatile Process process;
        private volatile boolean cancelled;

        private Execution(ConversionJob job) {
            this.job = job;
        }

        boolean isCancelled() {
            return cancelled || job.isCancelRequested();
        }
    }
}
