package io.scheduler4j.internal;

import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.Interval;
import io.scheduler4j.core.InvalidScriptPathException;
import io.scheduler4j.core.JobNotFoundException;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.ScheduledJob;
import io.scheduler4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Computes run times and drives each job through its two states, {@link JobState#SCHEDULED} and
 * {@link JobState#FIRING}.
 *
 * <p>The {@link JobStore} is the source of truth: every {@link #tick(Instant)} reads the active jobs from it
 * and every state change is written back before the next job is looked at. The in-memory map only mirrors
 * the last known schedule for {@link #nextDue()} and {@link #flush()}.
 *
 * <p>Missed runs are never replayed. A due job fires once per tick and its next run is moved forward by whole
 * intervals until it is in the future, so it stays aligned with its start time.
 */
public class SchedulingCore {
    private static final Logger log = LoggerFactory.getLogger(SchedulingCore.class);

    public enum JobState {
        SCHEDULED,
        FIRING
    }

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final ExecutionRecorder recorder;
    private final RetentionSweeper sweeper;
    private final Clock clock;

    private final ConcurrentHashMap<String, ScheduledJob> scheduled = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, JobState> states = new ConcurrentHashMap<>();

    public SchedulingCore(SchedulerProperties props, JobStore jobStore, ExecutionRecorder recorder,
                          RetentionSweeper sweeper, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Validate, schedule and persist a job definition. An existing active job with the same id is
     * overwritten but keeps its log path and creation time. The id of a deactivated job is never reused.
     *
     * <p>All validation happens before anything is written.
     *
     * @throws IllegalStateException if the id belongs to a deactivated job
     */
    public ScheduledJob scheduleJob(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        if (spec.logRetentionDays() != null && spec.logRetentionDays() <= 0) {
            throw new IllegalArgumentException("logRetentionDays must be positive: " + spec.logRetentionDays());
        }
        LocalTime startTime = IntervalParser.parseTimeOfDay(spec.startTime());
        Interval interval = IntervalParser.parse(spec.repeatInterval());
        recorder.validate(spec);

        String id = (spec.id() == null || spec.id().isBlank()) ? UUID.randomUUID().toString() : spec.id();
        Optional<ScheduledJob> existing = spec.id() == null ? Optional.empty() : jobStore.find(id);
        if (existing.isPresent() && !existing.get().active()) {
            throw new IllegalStateException("job " + id + " was removed and its id cannot be reused");
        }

        Instant now = clock.instant();
        Instant nextRun = IntervalParser.firstRunAfter(startTime, interval.toDuration(), now, props.zone());
        String logPath = existing.map(ScheduledJob::logPath)
                .orElseGet(() -> resolveLogPath(spec.name(), id));
        Instant createdAt = existing.map(ScheduledJob::createdAt).orElse(now);

        ScheduledJob job = new ScheduledJob(
                id,
                spec.name(),
                spec.script(),
                spec.pythonExec(),
                spec.venv(),
                spec.workingDir(),
                IntervalParser.normalizeTimeOfDay(spec.startTime()),
                interval.toString(),
                nextRun,
                spec.logRetentionDays(),
                logPath,
                true,
                createdAt,
                now
        );

        applyRetentionOverride(job);
        jobStore.save(job);
        scheduled.put(id, job);
        states.put(id, JobState.SCHEDULED);

        log.info("scheduler4j job scheduled name={} id={} startTime={} every={} nextRun={}",
                job.name(), id, job.startTime(), job.repeatInterval(), nextRun);
        return job;
    }

    /**
     * Overwrite an active job's definition; its next run is recomputed from the new start time.
     *
     * @throws JobNotFoundException if no active job has this id
     */
    public ScheduledJob rescheduleJob(String id, JobSpec spec) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        if (jobStore.getActive(id).isEmpty()) {
            throw new JobNotFoundException(id);
        }
        return scheduleJob(spec.withId(id));
    }

    /**
     * Deactivate a job. It will not be loaded or fired again; its run history stays in the store.
     */
    public boolean unscheduleJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        boolean deactivated = jobStore.deactivate(id);
        scheduled.remove(id);
        states.remove(id);
        if (deactivated) {
            log.info("scheduler4j job deactivated id={}", id);
        }
        return deactivated;
    }

    /**
     * Fire every active job whose next run is at or before {@code now}, earliest first.
     *
     * @return number of jobs fired
     */
    public int tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        List<ScheduledJob> active = jobStore.listActive();
        scheduled.keySet().retainAll(active.stream().map(ScheduledJob::id).collect(Collectors.toSet()));
        for (ScheduledJob job : active) {
            scheduled.put(job.id(), job);
            states.putIfAbsent(job.id(), JobState.SCHEDULED);
        }

        int fired = 0;
        for (ScheduledJob job : active) {
            if (job.nextRun() == null || job.nextRun().isAfter(now)) {
                continue;
            }
            // removed or redefined while an earlier job of this tick was running
            if (!job.equals(scheduled.get(job.id()))) {
                continue;
            }
            if (fire(job, now)) {
                fired++;
            }
        }
        return fired;
    }

    /**
     * Reload active jobs after a restart and move stale next runs past now. Never executes anything.
     * A job that cannot be restored is logged and skipped.
     *
     * @return number of restored jobs
     */
    public int recoverFromStore() {
        Instant now = clock.instant();
        List<ScheduledJob> active = jobStore.listActive();

        scheduled.clear();
        states.clear();

        int restored = 0;
        for (ScheduledJob job : active) {
            try {
                ScheduledJob recovered = recover(job, now);
                scheduled.put(recovered.id(), recovered);
                states.put(recovered.id(), JobState.SCHEDULED);
                restored++;
            } catch (RuntimeException e) {
                log.error("scheduler4j could not restore job name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        }
        log.info("scheduler4j restored jobs count={} of={}", restored, active.size());
        return restored;
    }

    /**
     * Earliest next run among scheduled jobs.
     */
    public Optional<Instant> nextDue() {
        return scheduled.values().stream()
                .map(ScheduledJob::nextRun)
                .filter(Objects::nonNull)
                .min(Instant::compareTo);
    }

    public Optional<JobState> state(String id) {
        return Optional.ofNullable(states.get(id));
    }

    /**
     * Best-effort write of the in-memory next runs, used on shutdown. Jobs deactivated in the store are
     * dropped instead of written.
     *
     * @return number of jobs written
     */
    public int flush() {
        int saved = 0;
        for (ScheduledJob job : scheduled.values()) {
            if (job.nextRun() == null) {
                continue;
            }
            try {
                if (jobStore.updateNextRun(job.id(), null, job.nextRun())) {
                    saved++;
                } else {
                    scheduled.remove(job.id(), job);
                    states.remove(job.id());
                }
            } catch (RuntimeException e) {
                log.error("scheduler4j could not persist job on flush name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        }
        log.info("scheduler4j flushed schedule jobs={}", saved);
        return saved;
    }

    private boolean fire(ScheduledJob job, Instant now) {
        Duration interval;
        try {
            interval = job.interval().toDuration();
        } catch (IllegalArgumentException e) {
            log.error("scheduler4j job has an unusable interval, deactivating it name={} id={} interval={}",
                    job.name(), job.id(), job.repeatInterval());
            unscheduleJob(job.id());
            return false;
        }

        states.put(job.id(), JobState.FIRING);
        log.debug("scheduler4j job firing name={} id={} nextRun={}", job.name(), job.id(), job.nextRun());
        try {
            recorder.run(job);
        } catch (InvalidScriptPathException e) {
            log.error("scheduler4j job script rejected, run skipped name={} id={} msg={}", job.name(), job.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("scheduler4j job run failed name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
        } finally {
            Instant next = job.nextRun().plus(interval);
            if (!next.isAfter(now)) {
                long skipped = IntervalParser.intervalsBehind(next, interval, now);
                next = IntervalParser.advancePast(next, interval, now);
                log.warn("scheduler4j job fell behind, skipping missed runs name={} id={} skipped={} nextRun={}",
                        job.name(), job.id(), skipped, next);
            }

            // only the next run is written; a removal or redefinition made during the run wins
            ScheduledJob updated = job.withNextRun(next);
            try {
                if (jobStore.updateNextRun(job.id(), job.nextRun(), next)) {
                    scheduled.replace(job.id(), job, updated);
                } else {
                    log.info("scheduler4j job was removed or modified while running, keeping that change name={} id={}",
                            job.name(), job.id());
                }
            } catch (RuntimeException e) {
                scheduled.replace(job.id(), job, updated);
                log.error("scheduler4j could not persist next run name={} id={} nextRun={} msg={}",
                        job.name(), job.id(), next, e.getMessage(), e);
            }
            states.replace(job.id(), JobState.FIRING, JobState.SCHEDULED);
        }
        return true;
    }

    private ScheduledJob recover(ScheduledJob job, Instant now) {
        Duration interval = job.interval().toDuration();
        ScheduledJob recovered = job;

        if (recovered.nextRun() == null) {
            LocalTime startTime = IntervalParser.parseTimeOfDay(job.startTime());
            recovered = recovered.withNextRun(IntervalParser.firstRunAfter(startTime, interval, now, props.zone()));
        } else if (!recovered.nextRun().isAfter(now)) {
            long skipped = IntervalParser.intervalsBehind(recovered.nextRun(), interval, now);
            recovered = recovered.withNextRun(IntervalParser.advancePast(recovered.nextRun(), interval, now));
            log.info("scheduler4j job was due during downtime, skipping missed runs name={} id={} skipped={}",
                    job.name(), job.id(), skipped);
        }
        if (recovered.logPath() == null) {
            recovered = recovered.withLogPath(resolveLogPath(job.name(), job.id()));
        }

        if (recovered != job) {
            jobStore.save(recovered);
        }
        log.info("scheduler4j job restored name={} id={} nextRun={}", job.name(), job.id(), recovered.nextRun());
        return recovered;
    }

    private String resolveLogPath(String name, String id) {
        String root = jobStore.getConfig(JobStore.LOG_DIR, props.getLogDir());
        String safeName = name.replaceAll("[^A-Za-z0-9._-]", "_");
        String safeId = id.replaceAll("[^A-Za-z0-9_-]", "");
        if (safeId.length() > 8) {
            safeId = safeId.substring(0, 8);
        }
        return Path.of(root).resolve(safeId.isEmpty() ? safeName : safeName + "-" + safeId).toString();
    }

    private void applyRetentionOverride(ScheduledJob job) {
        Path dir = Path.of(job.logPath());
        try {
            if (job.logRetentionDays() != null) {
                sweeper.writeRetentionOverride(dir, job.logRetentionDays());
            } else {
                Files.deleteIfExists(dir.resolve(props.getRetentionFileName()));
            }
        } catch (IOException e) {
            log.warn("scheduler4j could not update log retention name={} id={} path={} msg={}",
                    job.name(), job.id(), dir, e.getMessage());
        }
    }
}
