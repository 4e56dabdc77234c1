package com.github.stormino.audioextract.service;

import com.github.stormino.audioextract.model.JobEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans job events out to in-process listeners and Server-Sent Events clients.
 */
@Slf4j
@Service
public class JobEventBroadcastService {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    private final CopyOnWriteArrayList<Consumer<JobEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Register a new SSE emitter
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());
        return emitter;
    }

    public void registerListener(Consumer<JobEvent> listener) {
        listeners.add(listener);
        log.debug("Event listener registered. Total: {}", listeners.size());
    }

    public void unregisterListener(Consumer<JobEvent> listener) {
        listeners.remove(listener);
        log.debug("Event listener unregistered. Remaining: {}", listeners.size());
    }

    /**
     * Deliver an event to every listener and SSE client. Listener failures are logged
     * and do not stop delivery to the others.
     */
    public void publish(JobEvent event) {
        log.debug("Publishing {} for job {}", event.getType(), event.getJobId());

        for (Consumer<JobEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error in event listener: {}", e.getMessage(), e);
            }
        }

        broadcastToSSE(event);
    }

    private void broadcastToSSE(JobEvent event) {
        if (emitters.isEmpty()) {
            return;
        }

        String name = event.getType().name().toLowerCase(Locale.ROOT);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(name)
                        .data(event));
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }

    public int getActiveConnections() {
        return emitters.size();
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
