package io.pulse4j.internal;

import io.pulse4j.core.JobRun;
import io.pulse4j.core.JobRunStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the most recent runs of each job in process memory.
 */
public class InMemoryJobRunStore implements JobRunStore {

    private final int retainPerJob;
    private final ConcurrentHashMap<String, Deque<JobRun>> runsByJob = new ConcurrentHashMap<>();

    public InMemoryJobRunStore(int retainPerJob) {
        if (retainPerJob <= 0) {
            throw new IllegalArgumentException("retainPerJob must be positive");
        }
        this.retainPerJob = retainPerJob;
    }

    @Override
    public void append(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        runsByJob.compute(run.jobName(), (name, runs) -> {
            Deque<JobRun> deque = runs == null ? new ArrayDeque<>() : runs;
            deque.addFirst(run);
            while (deque.size() > retainPerJob) {
                deque.removeLast();
            }
            return deque;
        });
    }

    @Override
    public List<JobRun> recent(String jobName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        List<JobRun> result = new ArrayList<>();
        runsByJob.computeIfPresent(jobName, (name, runs) -> {
            Iterator<JobRun> it = runs.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return runs;
        });
        return result;
    }
}
