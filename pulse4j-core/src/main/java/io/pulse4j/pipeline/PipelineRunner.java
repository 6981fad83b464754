package io.pulse4j.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a {@link PipelineSpec} step by step.
 *
 * <p>Each step is dispatched, awaited up to its own timeout and, on success, followed by its
 * configured pause so the upstream system can settle before the next step reads its output.
 * The first failure aborts the run; nothing is retried within a run.
 */
public class PipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final RemoteTrigger trigger;
    private final Clock clock;

    public PipelineRunner(RemoteTrigger trigger, Clock clock) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public PipelineRunner(RemoteTrigger trigger) {
        this(trigger, Clock.systemUTC());
    }

    public PipelineResult run(PipelineSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        Instant startedAt = clock.instant();
        List<StepOutcome> completed = new ArrayList<>();
        log.info("Pipeline started name={} steps={}", spec.name(), spec.steps().size());

        List<PipelineStep> steps = spec.steps();
        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            try {
                Instant stepStartedAt = clock.instant();
                TriggerResponse response = await(spec, step);
                completed.add(new StepOutcome(step.name(), response.status(), stepStartedAt, clock.instant()));
                log.info("Pipeline step succeeded pipeline={} step={} status={} delayAfter={}",
                        spec.name(), step.name(), response.status(), step.delayAfter());

                pause(step);
            } catch (StepFailureException e) {
                log.warn("Pipeline aborted pipeline={} step={} kind={} msg={} remainingSteps={}",
                        spec.name(), e.getStepName(), e.getKind(), e.getMessage(),
                        steps.size() - i - 1);
                return PipelineResult.failed(spec.name(), completed, e, startedAt, clock.instant());
            }
        }

        PipelineResult result = PipelineResult.succeeded(spec.name(), completed, startedAt, clock.instant());
        log.info("Pipeline finished name={} elapsedMs={}", spec.name(), result.elapsed().toMillis());
        return result;
    }

    private TriggerResponse await(PipelineSpec spec, PipelineStep step) throws StepFailureException {
        CompletableFuture<TriggerResponse> future;
        try {
            future = trigger.dispatch(spec, step);
        } catch (RuntimeException e) {
            throw new StepFailureException(step.name(), StepFailureKind.TRANSPORT,
                    "dispatch failed: " + e.getMessage(), e);
        }

        TriggerResponse response;
        try {
            response = future.get(step.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new StepFailureException(step.name(), StepFailureKind.TIMEOUT,
                    "no response within " + step.timeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepFailureException(step.name(), StepFailureKind.TRANSPORT,
                    String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepFailureException(step.name(), StepFailureKind.INTERRUPTED,
                    "interrupted while waiting for response", e);
        }

        if (response == null) {
            throw new StepFailureException(step.name(), StepFailureKind.TRANSPORT, "empty response", null);
        }
        if (!response.isSuccessful()) {
            throw new StepFailureException(step.name(), StepFailureKind.ERROR_STATUS,
                    "HTTP " + response.status(), null);
        }
        return response;
    }

    private void pause(PipelineStep step) throws StepFailureException {
        Duration delay = step.delayAfter();
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepFailureException(step.name(), StepFailureKind.INTERRUPTED,
                    "interrupted during post-step delay", e);
        }
    }
}
