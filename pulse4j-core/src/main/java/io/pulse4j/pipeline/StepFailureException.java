package io.pulse4j.pipeline;

/**
 * A pipeline step failed; the remaining steps of the run are abandoned.
 */
public class StepFailureException extends Exception {

    private final String stepName;
    private final StepFailureKind kind;

    public StepFailureException(String stepName, StepFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
        this.kind = kind;
    }

    public String getStepName() {
        return stepName;
    }

    public StepFailureKind getKind() {
        return kind;
    }
}
