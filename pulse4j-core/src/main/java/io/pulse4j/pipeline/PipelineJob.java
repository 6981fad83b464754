package io.pulse4j.pipeline;

import io.pulse4j.JobHandler;
import io.pulse4j.core.JobContext;
import io.pulse4j.core.JobResult;

import java.util.Objects;

/**
 * Runs a pipeline as the body of a scheduled job. A pipeline is all-or-nothing, so a failed
 * step always seals the run as a failure.
 */
public class PipelineJob implements JobHandler {

    private final PipelineRunner runner;
    private final PipelineSpec spec;

    public PipelineJob(PipelineRunner runner, PipelineSpec spec) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    @Override
    public JobResult execute(JobContext context) {
        PipelineResult result = runner.run(spec);
        if (result.success()) {
            return JobResult.success(result.completedSteps().size() + " steps in " + result.elapsed().toMillis() + "ms");
        }
        return JobResult.failure(result.describeFailure());
    }

    public PipelineSpec spec() {
        return spec;
    }
}
