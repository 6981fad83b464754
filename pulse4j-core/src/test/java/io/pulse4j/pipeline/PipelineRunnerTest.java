package io.pulse4j.pipeline;

import io.pulse4j.core.JobContext;
import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.JobResult;
import io.pulse4j.core.RunTrigger;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRunnerTest {

    private final List<String> dispatched = new CopyOnWriteArrayList<>();

    @Test
    void errorStatusShouldAbortRemainingSteps() {
        PipelineRunner runner = new PipelineRunner(respondWith(Map.of("ingest", 200, "predict", 500, "publish", 200)));

        PipelineResult result = runner.run(threeSteps(Duration.ofSeconds(1), Duration.ZERO));

        assertFalse(result.success());
        assertEquals("predict", result.failedStep());
        assertEquals(StepFailureKind.ERROR_STATUS, result.failureKind());
        assertEquals(List.of("ingest", "predict"), dispatched);
        assertEquals(1, result.completedSteps().size());
        assertEquals("ingest", result.completedSteps().get(0).stepName());
    }

    @Test
    void timeoutShouldAbortRemainingSteps() {
        RemoteTrigger trigger = (pipeline, step) -> {
            dispatched.add(step.name());
            if (step.name().equals("predict")) {
                return new CompletableFuture<>();
            }
            return CompletableFuture.completedFuture(new TriggerResponse(200, "{}"));
        };

        PipelineResult result = new PipelineRunner(trigger).run(threeSteps(Duration.ofMillis(150), Duration.ZERO));

        assertFalse(result.success());
        assertEquals("predict", result.failedStep());
        assertEquals(StepFailureKind.TIMEOUT, result.failureKind());
        assertEquals(List.of("ingest", "predict"), dispatched);
    }

    @Test
    void transportErrorShouldBeReportedAsTransportFailure() {
        RemoteTrigger trigger = (pipeline, step) -> {
            dispatched.add(step.name());
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        };

        PipelineResult result = new PipelineRunner(trigger).run(threeSteps(Duration.ofSeconds(1), Duration.ZERO));

        assertEquals("ingest", result.failedStep());
        assertEquals(StepFailureKind.TRANSPORT, result.failureKind());
        assertTrue(result.failureMessage().contains("connection refused"));
        assertEquals(List.of("ingest"), dispatched);
    }

    @Test
    void interruptDuringPostStepDelayShouldFailTheStepThatWasPausing() {
        PipelineRunner runner = new PipelineRunner(respondWith(Map.of("ingest", 200, "predict", 200, "publish", 200)));

        Thread.currentThread().interrupt();
        PipelineResult result = runner.run(threeSteps(Duration.ofSeconds(1), Duration.ofSeconds(5)));
        boolean interruptRestored = Thread.interrupted();

        assertTrue(interruptRestored);
        assertFalse(result.success());
        assertEquals("ingest", result.failedStep());
        assertEquals(StepFailureKind.INTERRUPTED, result.failureKind());
        assertEquals(List.of("ingest"), dispatched);
        assertEquals(1, result.completedSteps().size());
    }

    @Test
    void successShouldWaitForEveryPostStepDelay() {
        PipelineRunner runner = new PipelineRunner(respondWith(Map.of("ingest", 200, "predict", 201, "publish", 204)));
        Duration delay = Duration.ofMillis(120);

        long started = System.nanoTime();
        PipelineResult result = runner.run(threeSteps(Duration.ofSeconds(1), delay));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(result.success());
        assertNull(result.failedStep());
        assertNull(result.describeFailure());
        assertEquals(List.of("ingest", "predict", "publish"), dispatched);
        assertTrue(elapsedMs >= delay.toMillis() * 3, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void pipelineJobShouldMapFailureIntoJobResult() throws Exception {
        PipelineRunner runner = new PipelineRunner(respondWith(Map.of("ingest", 200, "predict", 503, "publish", 200)));
        PipelineJob job = new PipelineJob(runner, threeSteps(Duration.ofSeconds(1), Duration.ZERO));

        JobResult result = job.execute(new JobContext("daily-pipeline", RunTrigger.SCHEDULED, Instant.now(), Instant.now()));

        assertEquals(JobOutcome.FAILURE, result.outcome());
        assertEquals("step 'predict' failed (ERROR_STATUS): HTTP 503", result.detail());
    }

    @Test
    void specShouldRejectEmptyOrDuplicateSteps() {
        assertThrows(IllegalArgumentException.class, () -> PipelineSpec.of("empty", List.of()));
        PipelineStep step = PipelineStep.of("ingest", "http://localhost/ingest", Duration.ofSeconds(1), Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> PipelineSpec.of("dup", List.of(step, step)));
    }

    private RemoteTrigger respondWith(Map<String, Integer> statusByStep) {
        return (pipeline, step) -> {
            dispatched.add(step.name());
            return CompletableFuture.completedFuture(new TriggerResponse(statusByStep.get(step.name()), "{}"));
        };
    }

    private static PipelineSpec threeSteps(Duration timeout, Duration delay) {
        return new PipelineSpec("daily-pipeline", "scheduler", List.of(
                PipelineStep.of("ingest", "http://ml.local/ingest", timeout, delay),
                PipelineStep.of("predict", "http://ml.local/predict", timeout, delay),
                PipelineStep.of("publish", "http://ml.local/publish", timeout, delay)
        ));
    }
}
