package io.pulse4j.core;

public class UnknownJobException extends IllegalArgumentException {

    private final String jobName;

    public UnknownJobException(String jobName) {
        super("No job registered for name: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
