package com.github.stormino.audioextract.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConversionJob")
class ConversionJobTest {

    private ConversionJob newJob() {
        return ConversionJob.builder()
                .id("job-1")
                .inputPath(Path.of("in.mp4"))
                .outputPath(Path.of("out.mp3"))
                .parameters(ConversionParameters.builder().build())
                .build();
    }

    @Test
    @DisplayName("should start queued with zero progress")
    void shouldStartQueued() {
        ConversionJob job = newJob();

        assertEquals(JobStatus.QUEUED, job.getStatus());
        assertEquals(0.0, job.getProgress());
        assertTrue(job.isActive());
        assertEquals(Duration.ZERO, job.getElapsed());
        assertNull(job.getEtaSeconds());
    }

    @Nested
    @DisplayName("emitted events")
    class EmittedEventsTests {

        @Test
        @DisplayName("should report each kind as new only once")
        void shouldMarkOnce() {
            ConversionJob job = newJob();

            assertTrue(job.markEmitted(JobEventType.JOB_STARTED));
            assertFalse(job.markEmitted(JobEventType.JOB_STARTED));
            assertTrue(job.markEmitted(JobEventType.JOB_COMPLETED));
        }

        @ParameterizedTest
        @EnumSource(value = JobEventType.class, names = {"JOB_PROGRESS", "QUEUE_UPDATED", "ALL_COMPLETED", "WORKER_ERROR"})
        @DisplayName("repeatable and queue-level kinds should not be lifecycle kinds")
        void repeatableKindsShouldNotBeLifecycle(JobEventType type) {
            assertFalse(type.isLifecycle());
        }
    }

    @Nested
    @DisplayName("copy")
    class CopyTests {

        @Test
        @DisplayName("should not share mutable state with the original")
        void shouldBeIndependent() {
            ConversionJob job = newJob();
            job.markEmitted(JobEventType.JOB_STARTED);

            ConversionJob snapshot = job.copy();
            snapshot.setStatus(JobStatus.FAILED);
            snapshot.setProgress(0.9);
            snapshot.markEmitted(JobEventType.JOB_FAILED);

            assertEquals(JobStatus.QUEUED, job.getStatus());
            assertEquals(0.0, job.getProgress());
            assertTrue(job.markEmitted(JobEventType.JOB_FAILED));
            assertFalse(snapshot.markEmitted(JobEventType.JOB_STARTED));
            assertEquals(job.getId(), snapshot.getId());
            assertEquals(job.getCreatedAt(), snapshot.getCreatedAt());
        }
    }

    @Nested
    @DisplayName("timing")
    class TimingTests {

        @Test
        @DisplayName("should freeze elapsed time at completion")
        void shouldFreezeElapsedAtCompletion() {
            ConversionJob job = newJob();
            LocalDateTime start = LocalDateTime.of(2024, 1, 1, 12, 0, 0);
            job.setStartedAt(start);
            job.setCompletedAt(start.plusSeconds(42));
            job.setStatus(JobStatus.COMPLETED);

            assertEquals(Duration.ofSeconds(42), job.getElapsed());
            assertNull(job.getEtaSeconds());
            assertFalse(job.isActive());
        }

        @Test
        @DisplayName("should estimate remaining time while running")
        void shouldEstimateRemainingTime() {
            ConversionJob job = newJob();
            job.setStatus(JobStatus.RUNNING);
            job.setStartedAt(LocalDateTime.now().minusSeconds(30));
            job.setProgress(0.5);

            Long eta = job.getEtaSeconds();

            assertNotNull(eta);
            assertTrue(eta >= 28 && eta <= 32, "eta was " + eta);
        }
    }
}
