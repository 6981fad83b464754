package io.pulse4j.core;

import java.time.Instant;

/**
 * Point-in-time view of one job inside the scheduler.
 *
 * @param running        the schedule is active
 * @param inFlight       a run is executing right now
 * @param nextExecution  next computed fire time; null while the schedule is stopped
 * @param lastRun        most recent sealed run; null before the first run
 */
public record SchedulerState(
        String jobName,
        boolean running,
        boolean inFlight,
        Instant nextExecution,
        JobRun lastRun
) {
}
