package io.pulse4j.hub;

import java.time.Instant;
import java.util.Objects;

/**
 * Envelope for server-generated events. The payload is opaque to the hub.
 */
public record LiveEvent(
        String type,
        Object payload,
        Instant emittedAt
) {
    public LiveEvent {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static LiveEvent of(String type, Object payload) {
        return new LiveEvent(type, payload, Instant.now());
    }
}
