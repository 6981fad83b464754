package io.pulse4j.web;

import io.pulse4j.hub.ConnectionHandle;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes pre-formatted event-stream frames to a servlet async response.
 *
 * <p>{@link org.springframework.web.servlet.mvc.method.annotation.SseEmitter} is not used because
 * it writes {@code data:} without the trailing space clients expect.
 */
public class ResponseBodyEmitterConnectionHandle implements ConnectionHandle {

    static final MediaType EVENT_STREAM = new MediaType("text", "event-stream", StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;

    public ResponseBodyEmitterConnectionHandle(ResponseBodyEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
    }

    @Override
    public void send(String frame) throws IOException {
        emitter.send(frame, EVENT_STREAM);
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
