package io.pulse4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of sealed runs, queried for status and observability.
 */
public interface JobRunStore {

    void append(JobRun run);

    /**
     * Most recent runs of a job, newest first.
     */
    List<JobRun> recent(String jobName, int limit);

    default Optional<JobRun> last(String jobName) {
        List<JobRun> runs = recent(jobName, 1);
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
    }
}
