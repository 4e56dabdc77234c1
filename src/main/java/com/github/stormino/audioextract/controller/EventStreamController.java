package com.github.stormino.audioextract.controller;

import com.github.stormino.audioextract.service.JobEventBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventStreamController {

    private final JobEventBroadcastService eventBroadcastService;

    /**
     * SSE endpoint for job lifecycle and progress events
     */
    @GetMapping("/stream")
    public SseEmitter streamEvents() {
        log.info("New SSE connection established");
        return eventBroadcastService.createEmitter();
    }
}
