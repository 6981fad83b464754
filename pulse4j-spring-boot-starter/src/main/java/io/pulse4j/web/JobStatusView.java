package io.pulse4j.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.pulse4j.core.JobRun;
import io.pulse4j.core.SchedulerState;

import java.time.Instant;

public record JobStatusView(
        String name,
        @JsonProperty("isRunning") boolean running,
        boolean inFlight,
        Instant nextExecution,
        JobRun lastRun
) {
    public static JobStatusView from(SchedulerState state) {
        return new JobStatusView(state.jobName(), state.running(), state.inFlight(),
                state.nextExecution(), state.lastRun());
    }
}
