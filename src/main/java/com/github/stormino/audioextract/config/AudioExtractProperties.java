package com.github.stormino.audioextract.config;

import com.github.stormino.audioextract.model.ConversionParameters;
import com.github.stormino.audioextract.model.OverwritePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "audioextract")
public class AudioExtractProperties {

    private Tools tools = new Tools();
    private Processing processing = new Processing();
    private Conversion conversion = new Conversion();
    private Paths paths = new Paths();

    @Data
    public static class Tools {
        /**
         * Explicit ffmpeg executable. Blank means search PATH and the usual install locations.
         */
        private String ffmpegPath = "";

        /**
         * Explicit ffprobe executable. Blank means derive it from the ffmpeg path.
         */
        private String ffprobePath = "";

        @Min(1)
        private int versionCheckTimeoutSeconds = 10;

        @Min(1)
        private int probeTimeoutSeconds = 30;
    }

    @Data
    public static class Processing {
        @Min(1)
        private int maxConcurrentJobs = 4;

        @Min(10)
        private long pollIntervalMs = 100;

        @Min(0)
        private int retryAttempts = 3;

        @Min(10)
        private long retryDelayMs = 500;

        @Min(1)
        private long processTimeoutMinutes = 120;

        @Min(1)
        private int errorTailLines = 10;

        @Min(1)
        private long stopTimeoutSeconds = 30;

        @NotNull
        private OverwritePolicy overwritePolicy = OverwritePolicy.UNIQUE;

        private boolean autoStart = false;
    }

    @Data
    public static class Conversion {
        @NotBlank
        private String outputFormat = "mp3";

        /** Blank picks the output format's default encoder. */
        private String codec;

        @NotBlank
        private String bitrate = "192k";

        @Min(1)
        private int sampleRate = 44100;

        @Min(1)
        private int channels = 2;

        private boolean normalizeLoudness = false;

        private boolean normalizePeak = false;

        private double peakTarget = 0.0;

        public ConversionParameters toParameters() {
            return ConversionParameters.builder()
                    .outputFormat(outputFormat)
                    .codec(codec)
                    .bitrate(bitrate)
                    .sampleRate(sampleRate)
                    .channels(channels)
                    .normalizeLoudness(normalizeLoudness)
                    .normalizePeak(normalizePeak)
                    .peakTarget(peakTarget)
                    .build();
        }
    }

    @Data
    public static class Paths {
        /**
         * Shared output directory for batch jobs. Blank means write beside each source file.
         */
        private String defaultOutputDir = "";

        public boolean hasDefaultOutputDir() {
            return defaultOutputDir != null && !defaultOutputDir.isBlank();
        }
    }
}
