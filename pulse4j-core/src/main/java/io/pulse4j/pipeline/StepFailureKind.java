package io.pulse4j.pipeline;

public enum StepFailureKind {
    /**
     * No response within the step timeout.
     */
    TIMEOUT,
    /**
     * The target answered with a non-2xx status.
     */
    ERROR_STATUS,
    /**
     * The call could not be made or the connection broke.
     */
    TRANSPORT,
    /**
     * The runner thread was interrupted while waiting.
     */
    INTERRUPTED
}
