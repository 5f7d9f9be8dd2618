package com.callinsight.processing.adapter;

import com.callinsight.processing.queue.StatusBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class SseStatusBroadcaster implements StatusBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SseStatusBroadcaster.class);

    private static final long SSE_TIMEOUT_MS = 30 * 60 * 1000L;

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));
        log.debug("SSE subscriber connected, {} active", emitters.size());
        return emitter;
    }

    @Override
    public void broadcast(String eventType, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventType).data(payload, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException ex) {
                log.debug("Dropping SSE subscriber: {}", ex.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(ex);
            }
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }
}
