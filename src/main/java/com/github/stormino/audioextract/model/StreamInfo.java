package com.github.stormino.audioextract.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StreamInfo {

    private int index;
    private String codecType;  // audio, video, subtitle, data
    private String codecName;
    private Integer sampleRate;
    private Integer channels;
    private String language;

    public boolean isAudio() {
        return "audio".equalsIgnoreCase(codecType);
    }
}
