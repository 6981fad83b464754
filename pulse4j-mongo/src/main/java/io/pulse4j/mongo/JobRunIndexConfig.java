package io.pulse4j.mongo;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Duration;
import java.util.Objects;

/**
 * MongoDB index definitions for the run history.
 *
 * <p>Indexes are not created at application startup unless {@code pulse.history.ensure-indexes}
 * is enabled. In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code job_runs})</h3>
 * <ul>
 *   <li><b>idx_job_started</b>: { jobName: 1, startedAt: -1 }
 *       <br/>Used by status and history lookups (newest runs of one job).</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_runs.createIndex({ jobName: 1, startedAt: -1 }, { name: "idx_job_started" });
 * db.job_runs.createIndex({ finishedAt: 1 }, { name: "ttl_finished", expireAfterSeconds: 2592000 });
 * </pre>
 */
public class JobRunIndexConfig {

    public static final String IDX_JOB_STARTED = "idx_job_started";
    public static final String TTL_FINISHED = "ttl_finished";

    private final MongoTemplate mongoTemplate;
    private final Duration retention;

    /**
     * @param retention TTL for finished runs; null keeps runs forever
     */
    public JobRunIndexConfig(MongoTemplate mongoTemplate, Duration retention) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.retention = retention;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(jobStartedIndex());
        if (retention != null) {
            mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(finishedTtlIndex(retention));
        }
    }

    /**
     * Keys: jobName ASC, startedAt DESC
     */
    public static Index jobStartedIndex() {
        return new Index()
                .on("jobName", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }

    /**
     * TTL on finishedAt.
     */
    public static Index finishedTtlIndex(Duration retention) {
        Objects.requireNonNull(retention, "retention must not be null");
        if (retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be a positive duration");
        }
        return new Index()
                .on("finishedAt", Sort.Direction.ASC)
                .expire(retention)
                .named(TTL_FINISHED);
    }
}
