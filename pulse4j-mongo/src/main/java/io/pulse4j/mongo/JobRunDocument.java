package io.pulse4j.mongo;

import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.RunTrigger;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for sealed job runs.
 */
@Document(collection = "job_runs")
public class JobRunDocument {

    @Id
    private String id;

    private String jobName;
    private RunTrigger trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private JobOutcome outcome;
    private String errorDetail;
    private long durationMs;

    public JobRunDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public RunTrigger getTrigger() {
        return trigger;
    }

    public void setTrigger(RunTrigger trigger) {
        this.trigger = trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public JobOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(JobOutcome outcome) {
        this.outcome = outcome;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }
}
