package io.scheduler4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for jobs, their run history and the global key/value configuration.
 *
 * <p>Every method is a single atomic write or read; jobs are scheduled and fired independently, so no
 * multi-job transactions are needed. Storage errors surface as {@link PersistenceFailureException}.
 */
public interface JobStore {

    /**
     * Global configuration key: default log retention in days.
     */
    String LOG_RETENTION = "logRetention";

    /**
     * Global configuration key: root directory of job logs.
     */
    String LOG_DIR = "logDir";

    /**
     * Prepare storage and seed configuration defaults. Safe to call on every startup:
     * existing configuration values are never overwritten.
     */
    void initialize(Map<String, String> configDefaults);

    /**
     * Upsert by id. Sets {@code updatedAt}; sets {@code createdAt} on insert.
     */
    PersistResult save(ScheduledJob job);

    Optional<ScheduledJob> getActive(String id);

    /**
     * Look up a job whether it is active or deactivated.
     */
    Optional<ScheduledJob> find(String id);

    /**
     * Move only the next run of a job, leaving its definition alone. Nothing is written unless the job is still
     * active and, when {@code expectedNextRun} is not null, its stored next run equals it.
     *
     * @return true if the next run was written
     */
    boolean updateNextRun(String id, Instant expectedNextRun, Instant nextRun);

    /**
     * Active jobs ordered by next run, earliest first.
     */
    List<ScheduledJob> listActive();

    /**
     * @return true if an active job was deactivated
     */
    boolean deactivate(String id);

    /**
     * Append a {@link RunStatus#RUNNING} record.
     *
     * @return the new run id
     */
    String recordRunStart(String jobId, String logFile);

    /**
     * Move a running record to its terminal status. Records that already finished are left untouched.
     */
    void recordRunEnd(String runId, RunStatus status);

    /**
     * Run history of a job, active or not, oldest first.
     */
    List<RunRecord> listRuns(String jobId);

    String getConfig(String key, String defaultValue);

    void setConfig(String key, String value);
}
