package io.pulse4j.hub;

import io.pulse4j.JobRunListener;
import io.pulse4j.core.JobRun;

import java.util.Objects;

/**
 * Pushes every sealed job run to all connected subscribers as a {@code job-run} event.
 */
public class JobRunBroadcaster implements JobRunListener {

    public static final String EVENT_TYPE = "job-run";

    private final BroadcastHub hub;

    public JobRunBroadcaster(BroadcastHub hub) {
        this.hub = Objects.requireNonNull(hub, "hub must not be null");
    }

    @Override
    public void onRunCompleted(JobRun run) {
        hub.publishAll(LiveEvent.of(EVENT_TYPE, run));
    }
}
