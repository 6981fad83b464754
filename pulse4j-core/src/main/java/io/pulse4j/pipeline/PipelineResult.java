package io.pulse4j.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one pipeline run. A pipeline either completes every step or fails at exactly one.
 *
 * @param failedStep     name of the step that failed; null on success
 * @param failureKind    why the step failed; null on success
 */
public record PipelineResult(
        String pipelineName,
        boolean success,
        List<StepOutcome> completedSteps,
        String failedStep,
        StepFailureKind failureKind,
        String failureMessage,
        Instant startedAt,
        Instant finishedAt
) {
    public PipelineResult {
        completedSteps = List.copyOf(completedSteps);
    }

    public static PipelineResult succeeded(String pipelineName, List<StepOutcome> steps, Instant startedAt, Instant finishedAt) {
        return new PipelineResult(pipelineName, true, steps, null, null, null, startedAt, finishedAt);
    }

    public static PipelineResult failed(String pipelineName, List<StepOutcome> completed, StepFailureException failure,
                                        Instant startedAt, Instant finishedAt) {
        return new PipelineResult(pipelineName, false, completed, failure.getStepName(), failure.getKind(),
                failure.getMessage(), startedAt, finishedAt);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public String describeFailure() {
        if (success) {
            return null;
        }
        return "step '" + failedStep + "' failed (" + failureKind + "): " + failureMessage;
    }
}
