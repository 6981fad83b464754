package io.pulse4j.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.hub.ConnectionRegistry;
import io.pulse4j.hub.SseFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Opens one live event stream per request and registers it with the {@link ConnectionRegistry}.
 */
@RestController
@RequestMapping("/pulse/events")
public class LiveEventController {
    private static final Logger log = LoggerFactory.getLogger(LiveEventController.class);

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Duration emitterTimeout;

    public LiveEventController(ConnectionRegistry registry, ObjectMapper objectMapper, Duration emitterTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.emitterTimeout = emitterTimeout == null ? Duration.ZERO : emitterTimeout;
    }

    @GetMapping("/{subscriberId}")
    public ResponseEntity<ResponseBodyEmitter> subscribe(@PathVariable String subscriberId) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(emitterTimeout.toMillis());
        ResponseBodyEmitterConnectionHandle handle = new ResponseBodyEmitterConnectionHandle(emitter);
        try {
            // Buffered by the emitter until the response is committed, so it always arrives first.
            handle.send(SseFrames.data(objectMapper.writeValueAsString(
                    Map.of("type", "connected", "subscriberId", subscriberId))));
        } catch (IOException e) {
            emitter.completeWithError(e);
            return ResponseEntity.internalServerError().build();
        }

        String connectionId = registry.add(subscriberId, handle);
        emitter.onCompletion(() -> registry.remove(subscriberId, connectionId));
        emitter.onTimeout(() -> registry.remove(subscriberId, connectionId));
        emitter.onError(ex -> registry.remove(subscriberId, connectionId));
        log.info("Live stream opened subscriberId={} connectionId={}", subscriberId, connectionId);

        return ResponseEntity.ok()
                .contentType(ResponseBodyEmitterConnectionHandle.EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
