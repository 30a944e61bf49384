package com.starscape.bracketflow.features.trackprogress.api;

import com.starscape.bracketflow.features.trackprogress.domain.EventSink;
import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes job events as server-sent events: {@code id} is the sequence, {@code event} the type.
 */
class SseEventSink implements EventSink {
    
    private final SseEmitter emitter;
    private final AtomicBoolean completed = new AtomicBoolean();
    
    SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }
    
    @Override
    public void send(JobEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .id(String.valueOf(event.getSequence()))
                .name(event.getEventType())
                .data(event.getPayload(), MediaType.APPLICATION_JSON));
    }
    
    @Override
    public void heartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("heartbeat"));
    }
    
    @Override
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }
    
    @Override
    public void onDisconnect(Runnable callback) {
        emitter.onCompletion(callback);
        emitter.onTimeout(callback);
        emitter.onError(error -> callback.run());
    }
}
