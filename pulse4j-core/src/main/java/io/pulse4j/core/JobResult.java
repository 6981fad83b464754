package io.pulse4j.core;

import java.util.Objects;

/**
 * Status report returned by a job body.
 */
public record JobResult(
        JobOutcome outcome,
        String detail
) {
    public JobResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static JobResult success() {
        return new JobResult(JobOutcome.SUCCESS, null);
    }

    public static JobResult success(String detail) {
        return new JobResult(JobOutcome.SUCCESS, detail);
    }

    public static JobResult partial(String detail) {
        return new JobResult(JobOutcome.PARTIAL, detail);
    }

    public static JobResult failure(String detail) {
        return new JobResult(JobOutcome.FAILURE, detail);
    }
}
