package io.pulse4j.pipeline;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One remote trigger inside a pipeline.
 *
 * @param target     HTTP endpoint that receives the trigger
 * @param payload    extra fields merged into the trigger body
 * @param timeout    how long the runner waits for a response
 * @param delayAfter pause after a successful response, before the next step starts
 */
public record PipelineStep(
        String name,
        URI target,
        Map<String, Object> payload,
        Duration timeout,
        Duration delayAfter
) {
    public PipelineStep {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("step name must not be blank");
        }
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration for step: " + name);
        }
        delayAfter = delayAfter == null ? Duration.ZERO : delayAfter;
        if (delayAfter.isNegative()) {
            throw new IllegalArgumentException("delayAfter must not be negative for step: " + name);
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static PipelineStep of(String name, String target, Duration timeout, Duration delayAfter) {
        return new PipelineStep(name, URI.create(target), Map.of(), timeout, delayAfter);
    }
}
