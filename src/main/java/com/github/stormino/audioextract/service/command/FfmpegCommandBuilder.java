package com.github.stormino.audioextract.service.command;

import com.github.stormino.audioextract.model.ConversionParameters;
import com.github.stormino.audioextract.util.ConversionConstants;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for constructing ffmpeg and ffprobe command-line arguments.
 * Centralizes all command construction logic for consistency and testability.
 */
@Component
@Slf4j
public class FfmpegCommandBuilder {

    /**
     * Build ffmpeg command extracting one audio stream of {@code inputFile} into {@code outputFile}.
     *
     * @param ffmpegPath ffmpeg executable
     * @param inputFile Source media file
     * @param outputFile Target audio file, overwritten if present
     * @param parameters Encoding settings
     * @return ffmpeg command arguments
     */
    public List<String> buildConversionCommand(@NonNull String ffmpegPath,
                                               @NonNull Path inputFile,
                                               @NonNull Path outputFile,
                                               @NonNull ConversionParameters parameters) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        command.add("-i");
        command.add(inputFile.toString());

        // Trimming
        if (hasText(parameters.getStartTime())) {
            command.add("-ss");
            command.add(parameters.getStartTime());
        }
        if (hasText(parameters.getEndTime())) {
            command.add("-to");
            command.add(parameters.getEndTime());
        }

        command.add("-map");
        command.add(parameters.getStreamIndex() != null
                ? "0:a:" + parameters.getStreamIndex()
                : ConversionConstants.FFMPEG_DEFAULT_AUDIO_MAP);

        command.add("-c:a");
        String codec = parameters.resolveCodec();
        command.add(codec);
        if (ConversionConstants.FFMPEG_MP3_CODEC.equals(codec)) {
            command.add("-q:a");
            command.add("0");  // highest VBR quality
        }
        command.add("-b:a");
        command.add(parameters.getBitrate());
        command.add("-ar");
        command.add(String.valueOf(parameters.getSampleRate()));
        command.add("-ac");
        command.add(String.valueOf(parameters.getChannels()));

        // Loudness normalization wins over peak normalization
        if (parameters.isNormalizeLoudness()) {
            command.add("-af");
            command.add(ConversionConstants.FFMPEG_LOUDNORM_FILTER);
        } else if (parameters.isNormalizePeak()) {
            command.add("-af");
            command.add("volume=" + parameters.getPeakTarget() + "dB");
        }

        command.add("-map_metadata");
        command.add("0");
        command.add(outputFile.toString());

        log.debug("Built conversion command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffprobe command printing format and stream information as JSON.
     *
     * @param ffprobePath ffprobe executable
     * @param inputFile File to inspect
     * @return ffprobe command arguments
     */
    public List<String> buildProbeCommand(@NonNull String ffprobePath, @NonNull Path inputFile) {
        List<String> command = new ArrayList<>();
        command.add(ffprobePath);
        command.add("-v");
        command.add("quiet");
        command.add("-print_format");
        command.add("json");
        command.add("-show_format");
        command.add("-show_streams");
        command.add(inputFile.toString());

        log.debug("Built probe command: {}", String.join(" ", command));
        return command;
    }

    public List<String> buildVersionCommand(@NonNull String toolPath) {
        return List.of(toolPath, "-version");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
