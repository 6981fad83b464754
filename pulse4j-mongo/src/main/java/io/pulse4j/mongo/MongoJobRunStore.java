package io.pulse4j.mongo;

import io.pulse4j.core.JobRun;
import io.pulse4j.core.JobRunStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB persistence layer for run history.
 *
 * <p>Runs are inserted once and never updated. Queries rely on the
 * {@link JobRunIndexConfig#IDX_JOB_STARTED} index.
 */
public class MongoJobRunStore implements JobRunStore {

    private final MongoTemplate mongoTemplate;

    public MongoJobRunStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void append(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        mongoTemplate.insert(toDocument(run));
    }

    @Override
    public List<JobRun> recent(String jobName, int limit) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        Query q = new Query(Criteria.where("jobName").is(jobName));
        q.with(Sort.by(Sort.Order.desc("startedAt"), Sort.Order.desc("_id")));
        q.limit(limit);

        List<JobRunDocument> docs = mongoTemplate.find(q, JobRunDocument.class);
        List<JobRun> runs = new ArrayList<>(docs.size());
        for (JobRunDocument doc : docs) {
            runs.add(toRun(doc));
        }
        return runs;
    }

    private static JobRunDocument toDocument(JobRun run) {
        JobRunDocument doc = new JobRunDocument();
        doc.setJobName(run.jobName());
        doc.setTrigger(run.trigger());
        doc.setStartedAt(run.startedAt());
        doc.setFinishedAt(run.finishedAt());
        doc.setOutcome(run.outcome());
        doc.setErrorDetail(run.errorDetail());
        doc.setDurationMs(run.duration().toMillis());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobRun)}.
     */
    static JobRun toRun(JobRunDocument doc) {
        return new JobRun(
                doc.getJobName(),
                doc.getTrigger(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getOutcome(),
                doc.getErrorDetail()
        );
    }
}
