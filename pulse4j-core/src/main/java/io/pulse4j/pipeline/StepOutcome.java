package io.pulse4j.pipeline;

import java.time.Instant;

/**
 * A step that completed successfully.
 */
public record StepOutcome(
        String stepName,
        int status,
        Instant startedAt,
        Instant respondedAt
) {
}
