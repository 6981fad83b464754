package io.pulse4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One sealed execution of a job. Runs are append-only.
 */
public record JobRun(
        String jobName,
        RunTrigger trigger,
        Instant startedAt,
        Instant finishedAt,
        JobOutcome outcome,
        String errorDetail
) {
    public JobRun {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean succeeded() {
        return outcome == JobOutcome.SUCCESS || outcome == JobOutcome.SKIPPED;
    }
}
