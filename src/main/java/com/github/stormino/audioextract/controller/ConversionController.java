package com.github.stormino.audioextract.controller;

import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.exception.ConfigurationException;
import com.github.stormino.audioextract.model.ConversionJob;
import com.github.stormino.audioextract.model.OverwritePolicy;
import com.github.stormino.audioextract.service.ConversionQueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionQueueService queueService;
    private final AudioExtractProperties properties;

    /**
     * Add a single conversion job
     */
    @PostMapping("/jobs")
    public ResponseEntity<ConversionJob> addJob(@Valid @RequestBody AddJobRequest request) {
        log.info("Adding job {}: {}", request.getId(), request.getInputPath());

        boolean added = queueService.addJob(
                request.getId(),
                Path.of(request.getInputPath()),
                Path.of(request.getOutputPath()),
                request.getParameters(),
                parsePolicy(request.getOverwritePolicy()));

        if (!added) {
            return ResponseEntity.unprocessableEntity().build();
        }
        return queueService.getJob(request.getId())
                .map(job -> ResponseEntity.status(HttpStatus.CREATED).body(job))
                .orElse(ResponseEntity.unprocessableEntity().build());
    }

    /**
     * Add one job per input file
     */
    @PostMapping("/jobs/batch")
    public ResponseEntity<Map<String, Boolean>> addBatch(@Valid @RequestBody BatchJobRequest request) {
        log.info("Adding batch of {} jobs", request.getInputPaths().size());

        Path outputDirectory = null;
        if (request.getOutputDirectory() != null && !request.getOutputDirectory().isBlank()) {
            outputDirectory = Path.of(request.getOutputDirectory());
        } else if (properties.getPaths().hasDefaultOutputDir()) {
            outputDirectory = Path.of(properties.getPaths().getDefaultOutputDir());
        }

        Map<String, Boolean> results = queueService.addBatchJobs(
                request.getInputPaths().stream().map(Path::of).toList(),
                outputDirectory,
                request.getParameters(),
                parsePolicy(request.getOverwritePolicy()));

        return ResponseEntity.ok(results);
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<ConversionJob>> getAllJobs() {
        return ResponseEntity.ok(queueService.getAllJobs());
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<ConversionJob> getJob(@PathVariable String id) {
        return queueService.getJob(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Remove a job (a running job is cancelled instead)
     */
    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<Void> removeJob(@PathVariable String id) {
        boolean removed = queueService.removeJob(id);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/jobs/{id}/cancel")
    public ResponseEntity<Void> cancelJob(@PathVariable String id) {
        boolean cancelled = queueService.cancelJob(id);
        return cancelled ? ResponseEntity.ok().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/jobs/cancel")
    public ResponseEntity<Void> cancelAll() {
        queueService.cancelAllJobs();
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/jobs/finished")
    public ResponseEntity<Map<String, Integer>> clearFinished() {
        int cleared = queueService.clearCompletedJobs();
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }

    @GetMapping("/queue/stats")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(queueService.getQueueStats().toMap());
    }

    @PostMapping("/queue/start")
    public ResponseEntity<Map<String, Boolean>> start() {
        boolean started = queueService.startProcessing();
        return ResponseEntity.status(started ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("running", queueService.isRunning()));
    }

    @PostMapping("/queue/stop")
    public ResponseEntity<Map<String, Boolean>> stop() {
        queueService.stopProcessing(Duration.ofSeconds(properties.getProcessing().getStopTimeoutSeconds()));
        return ResponseEntity.ok(Map.of("running", queueService.isRunning()));
    }

    @PostMapping("/queue/pause")
    public ResponseEntity<Map<String, Boolean>> pause() {
        queueService.pauseProcessing();
        return ResponseEntity.ok(Map.of("paused", queueService.isPaused()));
    }

    @PostMapping("/queue/resume")
    public ResponseEntity<Map<String, Boolean>> resume() {
        queueService.resumeProcessing();
        return ResponseEntity.ok(Map.of("paused", queueService.isPaused()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfigurationException(ConfigurationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static OverwritePolicy parsePolicy(String value) {
        return value == null || value.isBlank() ? null : OverwritePolicy.fromValue(value);
    }
}
