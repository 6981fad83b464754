package io.pulse4j.core;

/**
 * A manual run was requested while another run of the same job is in flight.
 */
public class AlreadyRunningException extends IllegalStateException {

    private final String jobName;

    public AlreadyRunningException(String jobName) {
        super("Job is already running: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
