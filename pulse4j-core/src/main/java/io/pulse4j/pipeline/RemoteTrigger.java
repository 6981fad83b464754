package io.pulse4j.pipeline;

import java.util.concurrent.CompletableFuture;

/**
 * Dispatches one pipeline step to its remote target.
 *
 * <p>The returned future completes with the response (whatever its status) or exceptionally
 * on transport errors. Callers may stop waiting at any time; the remote work is not cancelled.
 */
@FunctionalInterface
public interface RemoteTrigger {
    CompletableFuture<TriggerResponse> dispatch(PipelineSpec pipeline, PipelineStep step);
}
