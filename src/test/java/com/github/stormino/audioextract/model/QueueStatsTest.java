package com.github.stormino.audioextract.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueueStats")
class QueueStatsTest {

    private static ConversionJob jobIn(JobStatus status) {
        return ConversionJob.builder().id(status.name()).status(status).build();
    }

    @Test
    @DisplayName("should count jobs per status")
    void shouldCountPerStatus() {
        QueueStats stats = QueueStats.of(List.of(
                jobIn(JobStatus.QUEUED),
                jobIn(JobStatus.QUEUED),
                jobIn(JobStatus.RUNNING),
                jobIn(JobStatus.COMPLETED),
                jobIn(JobStatus.FAILED),
                jobIn(JobStatus.CANCELLED),
                jobIn(JobStatus.SKIPPED)));

        assertEquals(7, stats.getTotal());
        assertEquals(2, stats.getQueued());
        assertEquals(1, stats.getRunning());
        assertEquals(1, stats.getSkipped());
        assertTrue(stats.hasActiveJobs());
    }

    @Test
    @DisplayName("should expose the map form in a stable order")
    void shouldExposeMapForm() {
        Map<String, Integer> map = QueueStats.of(List.of(jobIn(JobStatus.COMPLETED))).toMap();

        assertEquals(List.of("total", "queued", "running", "completed", "failed", "cancelled", "skipped"),
                List.copyOf(map.keySet()));
        assertEquals(1, map.get("total"));
        assertEquals(1, map.get("completed"));
        assertEquals(0, map.get("queued"));
    }

    @Test
    @DisplayName("should report no active jobs for an empty registry")
    void shouldHandleEmptyRegistry() {
        QueueStats stats = QueueStats.of(List.of());

        assertEquals(0, stats.getTotal());
        assertFalse(stats.hasActiveJobs());
    }
}
