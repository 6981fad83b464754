package io.pulse4j.core;

/**
 * A job name was registered twice. Thrown at startup and meant to abort initialization.
 */
public class DuplicateJobException extends IllegalStateException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super("Duplicate job name: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
