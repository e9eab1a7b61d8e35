package io.scheduler4j.internal;

import io.scheduler4j.JobBuilder;
import io.scheduler4j.ProcessRunner;
import io.scheduler4j.ScriptScheduler;
import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.JobNotFoundException;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.RunRecord;
import io.scheduler4j.core.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded script scheduler.
 *
 * <p>One poller thread repeatedly ticks the {@link SchedulingCore}, runs the daily {@link RetentionSweeper}
 * check and sleeps for {@code processEvery}. Jobs run on the poller thread itself, one at a time, so a long
 * running script delays every other job until it finishes.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ScriptScheduler scheduler = new DefaultScriptScheduler(props, jobStore, new LocalProcessRunner());
 * scheduler.create("report").script("/opt/report.py").startAt("06:00:00").repeatEvery("12h").save();
 * scheduler.start();
 * }</pre>
 */
public class DefaultScriptScheduler implements ScriptScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScriptScheduler.class);

    private static final int MAX_CONSECUTIVE_FAILURES = 30;

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final SchedulingCore core;
    private final RetentionSweeper sweeper;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultScriptScheduler(SchedulerProperties props, JobStore jobStore, ProcessRunner processRunner) {
        this(props, jobStore, processRunner, Clock.systemDefaultZone());
    }

    public DefaultScriptScheduler(SchedulerProperties props, JobStore jobStore, ProcessRunner processRunner, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sweeper = new RetentionSweeper(props, jobStore, clock);
        ExecutionRecorder recorder = new ExecutionRecorder(props, jobStore, processRunner, clock);
        this.core = new SchedulingCore(props, jobStore, recorder, sweeper, clock);
    }

    /**
     * Initialize the store, recover persisted jobs and start the poller thread. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "scheduler4j.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("scheduler4j.processEvery must be a positive duration");
        }

        log.info("scheduler4j starting with processEvery={}, sweepEvery={}, logDir={}, logRetentionDays={}, zone={}",
                props.getProcessEvery(),
                props.getSweepEvery(),
                props.getLogDir(),
                props.getLogRetentionDays(),
                props.zone());

        try {
            initialize();
            core.recoverFromStore();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("scheduler4j.poller");
        pollerThread.start();
        log.info("scheduler4j started successfully.");
    }

    /**
     * Stop polling, wait for a running job up to {@code shutdownTimeout}, then persist the in-memory schedule.
     * Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("scheduler4j stopping...");

        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null) {
            poller.interrupt();
            try {
                poller.join(props.getShutdownTimeout().toMillis());
                if (poller.isAlive()) {
                    log.warn("scheduler4j poller did not stop within {}", props.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        core.flush();
        log.info("scheduler4j stopped successfully.");
    }

    /**
     * One poll cycle: fire due jobs, sweep logs if a day has passed, report the next due run.
     */
    public void runOnce(Instant now) {
        int fired = core.tick(now);
        sweeper.sweep(false);
        if (fired > 0 || log.isDebugEnabled()) {
            core.nextDue().ifPresent(next -> log.debug("scheduler4j next script runs at {}", next));
        }
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public JobBuilder create(String name) {
        return new DefaultJobBuilder(name, this::addJob);
    }

    @Override
    public ScheduledJob addJob(JobSpec spec) {
        initialize();
        return core.scheduleJob(spec);
    }

    @Override
    public ScheduledJob modifyJob(String id, JobSpec spec) {
        initialize();
        return core.rescheduleJob(id, spec);
    }

    @Override
    public List<ScheduledJob> listJobs() {
        return jobStore.listActive();
    }

    @Override
    public ScheduledJob getJob(String id) {
        return findJob(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public Optional<ScheduledJob> findJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.getActive(id);
    }

    @Override
    public boolean isRemoved(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.find(id).filter(job -> !job.active()).isPresent();
    }

    @Override
    public boolean removeJob(String id) {
        return core.unscheduleJob(id);
    }

    @Override
    public List<RunRecord> runHistory(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return jobStore.listRuns(jobId);
    }

    @Override
    public Optional<Instant> nextDue() {
        return core.nextDue();
    }

    @Override
    public int sweepLogs(boolean force) {
        return sweeper.sweep(force);
    }

    public boolean isRunning() {
        return started.get();
    }

    private void initialize() {
        if (initialized.get()) {
            return;
        }
        jobStore.initialize(Map.of(
                JobStore.LOG_RETENTION, Integer.toString(props.getLogRetentionDays()),
                JobStore.LOG_DIR, props.getLogDir()
        ));
        initialized.set(true);
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                runOnce(clock.instant());
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("scheduler4j poll failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("scheduler4j poller stopped due to repeated system failures...");
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get() || Thread.currentThread().isInterrupted()) {
                break;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
