package io.scheduler4j.config;

import io.scheduler4j.internal.mongo.JobRunDocument;
import io.scheduler4j.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for scheduler4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code scheduler4j.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_active_next_run</b> on {@code scheduled_jobs}: { active: 1, nextRunAt: 1 }
 *       <br/>Used by every poll to list active jobs in due order.</li>
 *   <li><b>idx_job_runs</b> on {@code job_runs}: { jobId: 1, startTime: 1 }
 *       <br/>Used by run history lookups.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ active: 1, nextRunAt: 1 }, { name: "idx_active_next_run" });
 * db.job_runs.createIndex({ jobId: 1, startTime: 1 }, { name: "idx_job_runs" });
 * </pre>
 */
public class SchedulerMongoIndexConfig {

    public static final String IDX_ACTIVE_NEXT_RUN = "idx_active_next_run";
    public static final String IDX_JOB_RUNS = "idx_job_runs";

    private final MongoTemplate mongoTemplate;

    public SchedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Ensure required indexes. Not annotated with {@code @PostConstruct}; call it explicitly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(activeNextRunIndex());
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(jobRunsIndex());
    }

    public static Index activeNextRunIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_ACTIVE_NEXT_RUN);
    }

    public static Index jobRunsIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.ASC)
                .named(IDX_JOB_RUNS);
    }
}
