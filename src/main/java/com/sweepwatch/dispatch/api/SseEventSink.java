package com.sweepwatch.dispatch.api;

import com.sweepwatch.core.events.StreamEvent;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes events to an {@link SseEmitter}, using the event's wire name as the SSE event name.
 */
public class SseEventSink implements EventSink {

    private final SseEmitter emitter;

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.type().wireName())
                .data(event.payload(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
