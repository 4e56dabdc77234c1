package com.github.stormino.audioextract.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.exception.MediaProbeException;
import com.github.stormino.audioextract.model.MediaInfo;
import com.github.stormino.audioextract.model.StreamInfo;
import com.github.stormino.audioextract.service.command.FfmpegCommandBuilder;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads duration, streams and container tags of a media file through ffprobe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaProbeService {

    private static final Map<String, String> METADATA_KEY_MAP = createMetadataKeyMap();

    private final AudioExtractProperties properties;
    private final FfmpegCommandBuilder commandBuilder;
    private final FfmpegToolService toolService;
    private final ObjectMapper objectMapper;

    /**
     * Inspect a media file.
     *
     * @throws MediaProbeException if ffprobe fails or prints something unparsable
     */
    public MediaInfo probe(@NonNull Path inputFile) {
        List<String> command = commandBuilder.buildProbeCommand(toolService.getFfprobePath(), inputFile);
        int timeout = properties.getTools().getProbeTimeoutSeconds();
        Process process = null;

        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            // Killing the process tree closes stdout, which unblocks the read below
            AtomicBoolean timedOut = new AtomicBoolean(false);
            Process watched = process;
            process.onExit()
                    .orTimeout(timeout, TimeUnit.SECONDS)
                    .whenComplete((p, ex) -> {
                        if (ex instanceof TimeoutException) {
                            timedOut.set(true);
                            watched.descendants().forEach(ProcessHandle::destroyForcibly);
                            watched.destroyForcibly();
                        }
                    });

            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }

            if (timedOut.get() || !process.waitFor(timeout, TimeUnit.SECONDS)) {
                throw new MediaProbeException("Media probe timed out after " + timeout + "s", inputFile.toString());
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new MediaProbeException("Failed to get media info", inputFile.toString(), exitCode);
            }

            return parse(output, inputFile);

        } catch (IOException e) {
            throw new MediaProbeException("Failed to analyze media file: " + e.getMessage(), e, inputFile.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaProbeException("Interrupted while probing media file", e, inputFile.toString());
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    public double getDuration(@NonNull Path inputFile) {
        return probe(inputFile).getDuration();
    }

    public List<StreamInfo> getAudioStreams(@NonNull Path inputFile) {
        return probe(inputFile).getAudioStreams();
    }

    /**
     * Container tags that can be carried over to an audio file, under their audio tag names.
     */
    public Map<String, String> extractMetadata(@NonNull Path inputFile) {
        Map<String, String> source = probe(inputFile).getMetadata();
        Map<String, String> audioMetadata = new LinkedHashMap<>();
        METADATA_KEY_MAP.forEach((sourceKey, audioKey) -> {
            String value = source.get(sourceKey);
            if (value != null) {
                audioMetadata.put(audioKey, value);
            }
        });
        return audioMetadata;
    }

    MediaInfo parse(String json, Path inputFile) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new MediaProbeException("Unreadable probe output: " + e.getMessage(), e, inputFile.toString());
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new MediaProbeException("Empty probe output", inputFile.toString());
        }

        JsonNode format = root.path("format");
        double duration = 0.0;
        if (format.hasNonNull("duration")) {
            try {
                duration = Double.parseDouble(format.get("duration").asText());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric duration for {}: {}", inputFile, format.get("duration"));
            }
        }

        List<StreamInfo> streams = new ArrayList<>();
        for (JsonNode stream : root.path("streams")) {
            streams.add(StreamInfo.builder()
                    .index(stream.path("index").asInt())
                    .codecType(textOrNull(stream, "codec_type"))
                    .codecName(textOrNull(stream, "codec_name"))
                    .sampleRate(stream.hasNonNull("sample_rate") ? stream.get("sample_rate").asInt() : null)
                    .channels(stream.hasNonNull("channels") ? stream.get("channels").asInt() : null)
                    .language(stream.path("tags").hasNonNull("language")
                            ? stream.path("tags").get("language").asText()
                            : null)
                    .build());
        }

        return MediaInfo.builder()
                .duration(duration)
                .streams(streams)
                .formatInfo(scalarFields(format))
                .metadata(scalarFields(format.path("tags")))
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static Map<String, String> scalarFields(JsonNode node) {
        Map<String, String> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isValueNode()) {
                fields.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return fields;
    }

    private static Map<String, String> createMetadataKeyMap() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("title", "title");
        keys.put("artist", "artist");
        keys.put("album", "album");
        keys.put("date", "date");
        keys.put("genre", "genre");
        keys.put("track", "track");
        keys.put("albumartist", "album_artist");
        keys.put("composer", "composer");
        keys.put("comment", "comment");
        return keys;
    }
}
