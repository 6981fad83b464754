package io.pulse4j;

import io.pulse4j.core.JobRun;

/**
 * Receives every sealed run. Called on the thread that executed the run.
 */
@FunctionalInterface
public interface JobRunListener {
    void onRunCompleted(JobRun run);
}
