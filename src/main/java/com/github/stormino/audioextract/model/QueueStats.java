package com.github.stormino.audioextract.model;

import lombok.Builder;
import lombok.Data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job counts per status at one instant.
 */
@Data
@Builder
public class QueueStats {

    private final int total;
    private final int queued;
    private final int running;
    private final int completed;
    private final int failed;
    private final int cancelled;
    private final int skipped;

    public static QueueStats of(Collection<ConversionJob> jobs) {
        int queued = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        int skipped = 0;

        for (ConversionJob job : jobs) {
            switch (job.getStatus()) {
                case QUEUED -> queued++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                case SKIPPED -> skipped++;
            }
        }

        return QueueStats.builder()
                .total(jobs.size())
                .queued(queued)
                .running(running)
                .completed(completed)
                .failed(failed)
                .cancelled(cancelled)
                .skipped(skipped)
                .build();
    }

    public boolean hasActiveJobs() {
        return queued > 0 || running > 0;
    }

    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("queued", queued);
        map.put("running", running);
        map.put("completed", completed);
        map.put("failed", failed);
        map.put("cancelled", cancelled);
        map.put("skipped", skipped);
        return map;
    }
}
