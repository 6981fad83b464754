package io.pulse4j;

import io.pulse4j.core.JobContext;
import io.pulse4j.core.JobResult;

@FunctionalInterface
public interface JobHandler {

    /**
     * Idempotency check run before {@link #execute(JobContext)}. Returning {@code false}
     * seals the run as skipped.
     */
    default boolean shouldRun(JobContext context) throws Exception {
        return true;
    }

    JobResult execute(JobContext context) throws Exception;
}
