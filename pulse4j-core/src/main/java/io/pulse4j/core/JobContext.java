package io.pulse4j.core;

import java.time.Instant;

/**
 * What a job body knows about the run it is executing.
 *
 * @param fireAt the scheduled fire time for {@link RunTrigger#SCHEDULED} runs, otherwise the request time
 */
public record JobContext(
        String jobName,
        RunTrigger trigger,
        Instant fireAt,
        Instant startedAt
) {
}
