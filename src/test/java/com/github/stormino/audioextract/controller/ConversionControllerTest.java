package com.github.stormino.audioextract.controller;

import com.github.stormino.audioextract.config.AudioExtractProperties;
import com.github.stormino.audioextract.model.ConversionJob;
import com.github.stormino.audioextract.model.OverwritePolicy;
import com.github.stormino.audioextract.model.QueueStats;
import com.github.stormino.audioextract.service.ConversionQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversionController")
class ConversionControllerTest {

    @Mock
    private ConversionQueueService queueService;

    private AudioExtractProperties properties;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        properties = new AudioExtractProperties();
        mockMvc = MockMvcBuilders.standaloneSetup(new ConversionController(queueService, properties)).build();
    }

    private static ConversionJob job(String id) {
        return ConversionJob.builder()
                .id(id)
                .inputPath(Path.of("/media/in/" + id + ".mkv"))
                .outputPath(Path.of("/media/out/" + id + ".mp3"))
                .build();
    }

    @Nested
    @DisplayName("POST /api/jobs")
    class AddJobTests {

        @Test
        @DisplayName("should return the registered job")
        void shouldReturnCreatedJob() throws Exception {
            when(queueService.addJob(eq("a"), eq(Path.of("/media/in/a.mkv")), eq(Path.of("/media/out/a.mp3")),
                    isNull(), eq(OverwritePolicy.SKIP))).thenReturn(true);
            when(queueService.getJob("a")).thenReturn(Optional.of(job("a")));

            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"a\", \"inputPath\": \"/media/in/a.mkv\","
                                    + " \"outputPath\": \"/media/out/a.mp3\", \"overwritePolicy\": \"Skip\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("a"))
                    .andExpect(jsonPath("$.status").value("QUEUED"));
        }

        @Test
        @DisplayName("should report a refused job as unprocessable")
        void shouldReportRefusedJob() throws Exception {
            when(queueService.addJob(eq("a"), any(), any(), any(), any())).thenReturn(false);

            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"a\", \"inputPath\": \"/x.mkv\", \"outputPath\": \"/x.mp3\"}"))
                    .andExpect(status().isUnprocessableEntity());
        }

        @Test
        @DisplayName("should reject an unknown overwrite policy")
        void shouldRejectUnknownPolicy() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"a\", \"inputPath\": \"/x.mkv\", \"outputPath\": \"/x.mp3\","
                                    + " \"overwritePolicy\": \"merge\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").exists());

            verifyNoInteractions(queueService);
        }

        @Test
        @DisplayName("should reject a request without an id")
        void shouldRejectMissingId() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputPath\": \"/x.mkv\", \"outputPath\": \"/x.mp3\"}"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(queueService);
        }
    }

    @Nested
    @DisplayName("POST /api/jobs/batch")
    class BatchTests {

        @Test
        @DisplayName("should fall back to the configured output directory")
        void shouldUseConfiguredOutputDirectory() throws Exception {
            properties.getPaths().setDefaultOutputDir("/media/out");
            Map<String, Boolean> results = new LinkedHashMap<>();
            results.put("job_1_0", true);
            results.put("job_1_1", false);
            when(queueService.addBatchJobs(eq(List.of(Path.of("/a.mkv"), Path.of("/b.mkv"))),
                    eq(Path.of("/media/out")), isNull(), isNull())).thenReturn(results);

            mockMvc.perform(post("/api/jobs/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputPaths\": [\"/a.mkv\", \"/b.mkv\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.job_1_0").value(true))
                    .andExpect(jsonPath("$.job_1_1").value(false));
        }

        @Test
        @DisplayName("should reject an empty batch")
        void shouldRejectEmptyBatch() throws Exception {
            mockMvc.perform(post("/api/jobs/batch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"inputPaths\": []}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("job endpoints")
    class JobEndpointTests {

        @Test
        @DisplayName("should list jobs")
        void shouldListJobs() throws Exception {
            when(queueService.getAllJobs()).thenReturn(List.of(job("a"), job("b")));

            mockMvc.perform(get("/api/jobs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[1].id").value("b"));
        }

        @Test
        @DisplayName("should return 404 for an unknown job")
        void shouldReturnNotFoundForUnknownJob() throws Exception {
            when(queueService.getJob("missing")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/jobs/missing"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("should map removal and cancellation outcomes")
        void shouldMapRemovalAndCancellation() throws Exception {
            when(queueService.removeJob("a")).thenReturn(true);
            when(queueService.removeJob("b")).thenReturn(false);
            when(queueService.cancelJob("a")).thenReturn(true);
            when(queueService.cancelJob("b")).thenReturn(false);

            mockMvc.perform(delete("/api/jobs/a")).andExpect(status().isNoContent());
            mockMvc.perform(delete("/api/jobs/b")).andExpect(status().isNotFound());
            mockMvc.perform(post("/api/jobs/a/cancel")).andExpect(status().isOk());
            mockMvc.perform(post("/api/jobs/b/cancel")).andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("should report how many finished jobs were cleared")
        void shouldReportClearedCount() throws Exception {
            when(queueService.clearCompletedJobs()).thenReturn(3);

            mockMvc.perform(delete("/api/jobs/finished"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.cleared").value(3));

            verify(queueService, never()).removeJob(any());
        }
    }

    @Nested
    @DisplayName("queue endpoints")
    class QueueEndpointTests {

        @Test
        @DisplayName("should expose queue statistics")
        void shouldExposeStats() throws Exception {
            when(queueService.getQueueStats()).thenReturn(QueueStats.builder()
                    .total(4).queued(1).running(1).completed(1).skipped(1).build());

            mockMvc.perform(get("/api/queue/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(4))
                    .andExpect(jsonPath("$.running").value(1))
                    .andExpect(jsonPath("$.failed").value(0))
                    .andExpect(jsonPath("$.skipped").value(1));
        }

        @Test
        @DisplayName("should report an unavailable transcoder on start")
        void shouldReportFailedStart() throws Exception {
            when(queueService.startProcessing()).thenReturn(false);
            when(queueService.isRunning()).thenReturn(false);

            mockMvc.perform(post("/api/queue/start"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.running").value(false));
        }

        @Test
        @DisplayName("should stop with the configured timeout")
        void shouldStopWithConfiguredTimeout() throws Exception {
            properties.getProcessing().setStopTimeoutSeconds(7);

            mockMvc.perform(post("/api/queue/stop"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.running").value(false));

            verify(queueService).stopProcessing(Duration.ofSeconds(7));
        }

        @Test
        @DisplayName("should pause and resume")
        void shouldPauseAndResume() throws Exception {
            when(queueService.isPaused()).thenReturn(true, false);

            mockMvc.perform(post("/api/queue/pause"))
                    .andExpect(jsonPath("$.paused").value(true));
            mockMvc.perform(post("/api/queue/resume"))
                    .andExpect(jsonPath("$.paused").value(false));

            verify(queueService).pauseProcessing();
            verify(queueService).resumeProcessing();
        }
    }
}
