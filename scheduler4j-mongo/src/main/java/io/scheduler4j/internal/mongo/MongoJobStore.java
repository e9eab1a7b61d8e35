package io.scheduler4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.PersistResult;
import io.scheduler4j.core.PersistenceFailureException;
import io.scheduler4j.core.RunRecord;
import io.scheduler4j.core.RunStatus;
import io.scheduler4j.core.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for jobs, runs and scheduler configuration.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code scheduled_jobs}: one document per job, keyed by job id; removal only flips {@code active}</li>
 *   <li>{@code job_runs}: append-only run history</li>
 *   <li>{@code scheduler_config}: global key/value settings</li>
 * </ul>
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void initialize(Map<String, String> configDefaults) {
        if (configDefaults == null || configDefaults.isEmpty()) {
            return;
        }
        execute("initialize config", () -> {
            for (Map.Entry<String, String> e : configDefaults.entrySet()) {
                Query q = new Query(Criteria.where("_id").is(e.getKey()));
                Update u = new Update().setOnInsert("value", e.getValue());
                mongoTemplate.upsert(q, u, ConfigEntryDocument.class);
            }
            return null;
        });
    }

    /**
     * Upsert a job by id.
     *
     * <p>Returns a created result when no document had this id, an updated result otherwise.
     */
    @Override
    public PersistResult save(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job id must not be null");

        Query query = new Query(Criteria.where("_id").is(job.id()));
        Update update = buildUpsertUpdate(job);

        UpdateResult result = execute("save job " + job.id(),
                () -> mongoTemplate.upsert(query, update, ScheduledJobDocument.class));
        return result.getUpsertedId() != null
                ? PersistResult.createdResult(job.id())
                : PersistResult.updatedResult(job.id());
    }

    private Update buildUpsertUpdate(ScheduledJob job) {
        Instant now = clock.instant();

        Update u = new Update();
        u.set("name", job.name());
        u.set("script", job.script());
        setOrUnset(u, "pythonExec", job.pythonExec());
        setOrUnset(u, "venv", job.venv());
        setOrUnset(u, "workingDir", job.workingDir());
        u.set("startTime", job.startTime());
        u.set("repeatInterval", job.repeatInterval());
        u.set("nextRunAt", job.nextRun());
        setOrUnset(u, "logRetentionDays", job.logRetentionDays());
        setOrUnset(u, "logPath", job.logPath());
        u.set("active", job.active());
        u.set("updatedAt", now);
        u.setOnInsert("createdAt", job.createdAt() != null ? job.createdAt() : now);
        return u;
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }

    @Override
    public Optional<ScheduledJob> getActive(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("active").is(true));
        ScheduledJobDocument doc = execute("get job " + id,
                () -> mongoTemplate.findOne(q, ScheduledJobDocument.class));
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public Optional<ScheduledJob> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduledJobDocument doc = execute("find job " + id,
                () -> mongoTemplate.findById(id, ScheduledJobDocument.class));
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    /**
     * Conditional {@code nextRunAt} write. Definition fields and {@code active} are never touched, so a job
     * deactivated or redefined in the meantime keeps that state.
     */
    @Override
    public boolean updateNextRun(String id, Instant expectedNextRun, Instant nextRun) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(nextRun, "nextRun must not be null");

        Criteria c = Criteria.where("_id").is(id).and("active").is(true);
        if (expectedNextRun != null) {
            c = c.and("nextRunAt").is(expectedNextRun);
        }
        Query q = new Query(c);
        Update u = new Update()
                .set("nextRunAt", nextRun)
                .set("updatedAt", clock.instant());

        UpdateResult r = execute("update next run of job " + id,
                () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getMatchedCount() > 0;
    }

    @Override
    public List<ScheduledJob> listActive() {
        Query q = new Query(Criteria.where("active").is(true));
        q.with(Sort.by(Sort.Order.asc("nextRunAt"), Sort.Order.asc("_id")));

        List<ScheduledJobDocument> docs = execute("list active jobs",
                () -> mongoTemplate.find(q, ScheduledJobDocument.class));
        List<ScheduledJob> jobs = new ArrayList<>(docs.size());
        for (ScheduledJobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    /**
     * Soft delete: the document and its run history stay in place.
     */
    @Override
    public boolean deactivate(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("active").is(true));
        Update u = new Update()
                .set("active", false)
                .set("updatedAt", clock.instant());

        UpdateResult r = execute("deactivate job " + id,
                () -> mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class));
        return r.getModifiedCount() > 0;
    }

    @Override
    public String recordRunStart(String jobId, String logFile) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        JobRunDocument doc = new JobRunDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setJobId(jobId);
        doc.setStartTime(clock.instant());
        doc.setStatus(RunStatus.RUNNING);
        doc.setLogFile(logFile);

        execute("record run start for job " + jobId, () -> mongoTemplate.insert(doc));
        return doc.getId();
    }

    @Override
    public void recordRunEnd(String runId, RunStatus status) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("run can only end in a terminal status: " + status);
        }

        Query q = new Query(Criteria.where("_id").is(runId).and("status").is(RunStatus.RUNNING));
        Update u = new Update()
                .set("status", status)
                .set("endTime", clock.instant());

        UpdateResult r = execute("record run end " + runId,
                () -> mongoTemplate.updateFirst(q, u, JobRunDocument.class));
        if (r.getModifiedCount() == 0) {
            log.warn("scheduler4j run not found or already finished runId={} status={}", runId, status);
        }
    }

    @Override
    public List<RunRecord> listRuns(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("jobId").is(jobId));
        q.with(Sort.by(Sort.Order.asc("startTime")));

        List<JobRunDocument> docs = execute("list runs of job " + jobId,
                () -> mongoTemplate.find(q, JobRunDocument.class));
        List<RunRecord> runs = new ArrayList<>(docs.size());
        for (JobRunDocument d : docs) {
            runs.add(new RunRecord(d.getId(), d.getJobId(), d.getStartTime(), d.getEndTime(), d.getStatus(), d.getLogFile()));
        }
        return runs;
    }

    @Override
    public String getConfig(String key, String defaultValue) {
        Objects.requireNonNull(key, "key must not be null");
        ConfigEntryDocument doc = execute("get config " + key,
                () -> mongoTemplate.findById(key, ConfigEntryDocument.class));
        return doc == null || doc.getValue() == null ? defaultValue : doc.getValue();
    }

    @Override
    public void setConfig(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Query q = new Query(Criteria.where("_id").is(key));
        Update u = new Update().set("value", value);
        execute("set config " + key, () -> mongoTemplate.upsert(q, u, ConfigEntryDocument.class));
    }

    /**
     * Converts a persisted {@link ScheduledJobDocument} back into a {@link ScheduledJob}.
     */
    static ScheduledJob toJob(ScheduledJobDocument doc) {
        return new ScheduledJob(
                doc.getId(),
                doc.getName(),
                doc.getScript(),
                doc.getPythonExec(),
                doc.getVenv(),
                doc.getWorkingDir(),
                doc.getStartTime(),
                doc.getRepeatInterval(),
                doc.getNextRunAt(),
                doc.getLogRetentionDays(),
                doc.getLogPath(),
                doc.isActive(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static <T> T execute(String action, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not " + action + ": " + e.getMessage(), e);
        }
    }
}
