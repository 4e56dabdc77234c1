package com.github.stormino.audioextract.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Inspection report for an input file.
 */
@Data
@Builder
public class MediaInfo {

    /**
     * Total duration in seconds, 0 when the container does not report one.
     */
    private double duration;

    @Builder.Default
    private List<StreamInfo> streams = List.of();

    @Builder.Default
    private Map<String, String> formatInfo = Map.of();

    @Builder.Default
    private Map<String, String> metadata = Map.of();

    public boolean hasDuration() {
        return duration > 0;
    }

    public List<StreamInfo> getAudioStreams() {
        return streams.stream()
                .filter(StreamInfo::isAudio)
                .toList();
    }
}
