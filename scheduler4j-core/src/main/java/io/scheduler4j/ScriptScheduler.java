package io.scheduler4j;

import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.RunRecord;
import io.scheduler4j.core.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs launch an external script at a fixed time-of-day and then repeat on a fixed interval
 * ("1h", "30m", "45s"). Job definitions and run history are persisted, so a restarted scheduler
 * picks up where it left off without replaying missed runs.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.create("nightly-export")
 *          .script("/opt/jobs/export.py")
 *          .startAt("02:00:00")
 *          .repeatEvery("24h")
 *          .save();
 *
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public interface ScriptScheduler {

    /**
     * Initialize the store, recover persisted jobs and start polling. Idempotent.
     */
    void start();

    /**
     * Stop polling and flush the in-memory schedule. Idempotent.
     */
    void stop();

    JobBuilder create(String name);

    /**
     * Validate, schedule and persist a new job. A missing id is generated.
     *
     * @throws IllegalStateException if the id belongs to a removed job
     */
    ScheduledJob addJob(JobSpec spec);

    /**
     * Overwrite an active job's definition and recompute its next run.
     * The job keeps its log location and creation time.
     */
    ScheduledJob modifyJob(String id, JobSpec spec);

    List<ScheduledJob> listJobs();

    ScheduledJob getJob(String id);

    Optional<ScheduledJob> findJob(String id);

    /**
     * @return true if a job with this id exists but was deactivated; such ids cannot be scheduled again
     */
    boolean isRemoved(String id);

    /**
     * Deactivate a job. Its run history is kept.
     *
     * @return false if no active job had this id
     */
    boolean removeJob(String id);

    List<RunRecord> runHistory(String jobId);

    /**
     * Earliest next run among scheduled jobs, for status reporting.
     */
    Optional<Instant> nextDue();

    /**
     * Delete expired job logs now, or only if the daily sweep is due when {@code force} is false.
     *
     * @return number of deleted files
     */
    int sweepLogs(boolean force);
}
