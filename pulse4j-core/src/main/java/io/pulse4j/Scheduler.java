package io.pulse4j;

import io.pulse4j.core.JobDescriptor;
import io.pulse4j.core.JobRun;
import io.pulse4j.core.SchedulerState;

import java.util.List;
import java.util.Set;

/**
 * Main scheduler API.
 *
 * <p>Each registered job is driven by its own cron schedule and never has more than one
 * run in flight. A tick that fires while the previous run is still executing is dropped,
 * not queued.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.register(JobDescriptor.of("expiry-sweep", "0 * * * *"), ctx -> sweep());
 * scheduler.start("expiry-sweep");
 *
 * SchedulerState state = scheduler.status("expiry-sweep");
 * JobRun manual = scheduler.runNow("expiry-sweep");
 *
 * scheduler.shutdown();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Associate a descriptor with a job body.
     *
     * @throws io.pulse4j.core.DuplicateJobException if the name is already registered
     * @throws IllegalArgumentException              if the schedule cannot be parsed
     */
    void register(JobDescriptor descriptor, JobHandler handler);

    /**
     * Activate the schedule of a job and trigger one immediate out-of-band run.
     *
     * @return {@code false} when the job was already running or is disabled
     */
    boolean start(String name);

    /**
     * Start every enabled job that is not running yet.
     */
    void startAll();

    /**
     * Deactivate the schedule of a job. An in-flight run is left to finish.
     *
     * @return {@code false} when the job was not running
     */
    boolean stop(String name);

    /**
     * Execute the job on the calling thread and wait for the sealed run.
     *
     * @throws io.pulse4j.core.AlreadyRunningException if a run of the job is in flight
     */
    JobRun runNow(String name);

    SchedulerState status(String name);

    Set<String> jobNames();

    /**
     * Recent runs of a job, newest first.
     */
    List<JobRun> history(String name, int limit);

    void addListener(JobRunListener listener);

    /**
     * Stop every job and release the timer and worker threads. Idempotent.
     */
    void shutdown();
}
