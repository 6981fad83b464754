package io.pulse4j.core;

public enum JobOutcome {
    SUCCESS,
    FAILURE,
    PARTIAL,
    /**
     * The idempotency check found nothing to do.
     */
    SKIPPED;

    public boolean isFailure() {
        return this == FAILURE;
    }
}
