package io.scheduler4j.internal;

import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.InvalidIntervalFormatException;
import io.scheduler4j.core.InvalidScriptPathException;
import io.scheduler4j.core.InvalidTimeFormatException;
import io.scheduler4j.core.JobNotFoundException;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.ProcessResult;
import io.scheduler4j.core.RunRecord;
import io.scheduler4j.core.RunStatus;
import io.scheduler4j.core.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulingCoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:05:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemoryJobStore store;
    private RecordingProcessRunner runner;
    private SchedulerProperties props;
    private SchedulingCore core;
    private String script;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(T0);
        store = new InMemoryJobStore(clock);
        runner = new RecordingProcessRunner();

        props = new SchedulerProperties();
        props.setTimezone("UTC");
        props.setLogDir(tempDir.resolve("logs").toString());

        RetentionSweeper sweeper = new RetentionSweeper(props, store, clock);
        ExecutionRecorder recorder = new ExecutionRecorder(props, store, runner, clock);
        core = new SchedulingCore(props, store, recorder, sweeper, clock);

        script = Files.writeString(tempDir.resolve("report.py"), "print('hi')\n").toString();
    }

    @Test
    void scheduleShouldPickFirstRunAfterNowInPhaseWithStartTime() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), job.nextRun());
        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), store.getActive(job.id()).orElseThrow().nextRun());
        assertEquals(0, runner.launches());
    }

    @Test
    void tickShouldFireDueJobOnceAndMoveOneIntervalAhead() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        assertEquals(0, core.tick(Instant.parse("2026-01-01T10:59:59Z")));
        assertEquals(0, runner.launches());

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        assertEquals(1, core.tick(due));

        assertEquals(1, runner.launches());
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), store.getActive(job.id()).orElseThrow().nextRun());
        assertEquals(SchedulingCore.JobState.SCHEDULED, core.state(job.id()).orElseThrow());

        List<RunRecord> runs = store.listRuns(job.id());
        assertEquals(1, runs.size());
        assertEquals(RunStatus.SUCCESS, runs.get(0).status());
    }

    @Test
    void midnightAliasShouldScheduleLikeZeroHour() {
        ScheduledJob a = core.scheduleJob(spec("a", "24:00:00", "6h"));
        ScheduledJob b = core.scheduleJob(spec("b", "00:00:00", "6h"));

        assertEquals(b.nextRun(), a.nextRun());
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), a.nextRun());
        assertEquals("00:00:00", a.startTime());
    }

    @Test
    void tickAfterLongGapShouldFireOnceAndSkipMissedRuns() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        Instant late = Instant.parse("2026-01-01T15:30:00Z");
        clock.set(late);
        assertEquals(1, core.tick(late));
        assertEquals(0, core.tick(late));

        assertEquals(1, runner.launches());
        assertEquals(Instant.parse("2026-01-01T16:00:00Z"), store.getActive(job.id()).orElseThrow().nextRun());
    }

    @Test
    void failedRunShouldStillAdvanceNextRun() {
        runner.result = new ProcessResult(3, "", "boom\n");
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        core.tick(due);

        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), store.getActive(job.id()).orElseThrow().nextRun());
        assertEquals(RunStatus.ERROR, store.listRuns(job.id()).get(0).status());
    }

    @Test
    void scriptRemovedAfterSchedulingShouldSkipRunButKeepSchedule() throws IOException {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));
        Files.delete(Path.of(script));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        assertEquals(1, core.tick(due));

        assertEquals(0, runner.launches());
        assertTrue(store.listRuns(job.id()).isEmpty());
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), store.getActive(job.id()).orElseThrow().nextRun());
    }

    @Test
    void recoverShouldNeverExecuteAndShouldSkipDowntime() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "15m"));

        Instant restartedAt = Instant.parse("2026-01-03T09:59:30Z");
        clock.set(restartedAt);
        assertEquals(1, core.recoverFromStore());

        assertEquals(0, runner.launches());
        Instant next = store.getActive(job.id()).orElseThrow().nextRun();
        assertEquals(Instant.parse("2026-01-03T10:00:00Z"), next);
        assertEquals(next, core.nextDue().orElseThrow());
    }

    @Test
    void recoverShouldLeaveFutureRunsAlone() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));
        int savesBefore = store.saveCount;

        core.recoverFromStore();

        assertEquals(savesBefore, store.saveCount);
        assertEquals(job.nextRun(), core.nextDue().orElseThrow());
    }

    @Test
    void invalidDefinitionsShouldNotBePersisted() {
        assertThrows(InvalidIntervalFormatException.class, () -> core.scheduleJob(spec("bad", "10:00:00", "2d")));
        assertThrows(InvalidTimeFormatException.class, () -> core.scheduleJob(spec("bad", "10:00", "1h")));
        assertThrows(InvalidScriptPathException.class, () -> core.scheduleJob(
                new JobSpec(null, "bad", script + ";rm -rf", null, null, null, "10:00:00", "1h", null)));
        assertThrows(InvalidScriptPathException.class, () -> core.scheduleJob(
                new JobSpec(null, "bad", tempDir.resolve("missing.py").toString(), null, null, null, "10:00:00", "1h", null)));
        assertThrows(IllegalArgumentException.class, () -> core.scheduleJob(
                new JobSpec(null, "bad", script, null, null, null, "10:00:00", "1h", 0)));

        assertTrue(store.listActive().isEmpty());
        assertEquals(0, store.saveCount);
    }

    @Test
    void perJobRetentionShouldBeWrittenAndClearedWithTheDefinition() throws IOException {
        ScheduledJob job = core.scheduleJob(new JobSpec("job-1", "report", script, null, null, null, "10:00:00", "1h", 7));
        Path retention = Path.of(job.logPath()).resolve(".retention");
        assertEquals("7", Files.readString(retention, StandardCharsets.UTF_8));

        ScheduledJob modified = core.rescheduleJob("job-1", spec("report", "10:00:00", "2h"));

        assertEquals(job.logPath(), modified.logPath());
        assertEquals(job.createdAt(), modified.createdAt());
        assertFalse(Files.exists(retention));
    }

    @Test
    void logPathShouldKeepJobsWithSameNameApart() {
        ScheduledJob a = core.scheduleJob(new JobSpec("aaaaaaaa-1", "report", script, null, null, null, "10:00:00", "1h", null));
        ScheduledJob b = core.scheduleJob(new JobSpec("bbbbbbbb-1", "report", script, null, null, null, "10:00:00", "1h", null));

        assertFalse(a.logPath().equals(b.logPath()));
        assertTrue(a.logPath().startsWith(props.getLogDir()));
    }

    @Test
    void rescheduleShouldRejectUnknownJobs() {
        JobNotFoundException e = assertThrows(JobNotFoundException.class,
                () -> core.rescheduleJob("nope", spec("report", "10:00:00", "1h")));
        assertEquals("nope", e.getJobId());
    }

    @Test
    void unscheduledJobShouldNotFireAgain() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        assertTrue(core.unscheduleJob(job.id()));
        assertFalse(core.unscheduleJob(job.id()));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        assertEquals(0, core.tick(due));
        assertTrue(core.nextDue().isEmpty());
        assertTrue(store.stored(job.id()).isPresent());
    }

    @Test
    void storeOutageDuringFireShouldKeepScheduleInMemoryUntilFlush() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        store.failSaves = true;
        assertEquals(1, core.tick(due));
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), core.nextDue().orElseThrow());
        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), store.stored(job.id()).orElseThrow().nextRun());

        store.failSaves = false;
        assertEquals(1, core.flush());
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), store.stored(job.id()).orElseThrow().nextRun());
    }

    @Test
    void dueJobsShouldFireEarliestFirst() {
        core.scheduleJob(new JobSpec("late", "late", script, "python3", null, null, "10:30:00", "1h", null));
        core.scheduleJob(new JobSpec("early", "early", script, "python", null, null, "10:10:00", "1h", null));

        clock.advance(Duration.ofHours(1));
        assertEquals(2, core.tick(clock.instant()));

        assertEquals("python", runner.commands.get(0).get(0));
        assertEquals("python3", runner.commands.get(1).get(0));
    }

    @Test
    void jobRemovedWhileRunningShouldStayRemoved() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));
        runner.duringRun = onOtherThread(() -> assertTrue(core.unscheduleJob(job.id())));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        assertEquals(1, core.tick(due));

        assertFalse(store.stored(job.id()).orElseThrow().active());
        assertTrue(store.listActive().isEmpty());
        assertTrue(core.nextDue().isEmpty());
        assertTrue(core.state(job.id()).isEmpty());
        assertEquals(RunStatus.SUCCESS, store.listRuns(job.id()).get(0).status());

        runner.duringRun = null;
        Instant later = Instant.parse("2026-01-01T12:00:00Z");
        clock.set(later);
        assertEquals(0, core.tick(later));
        assertEquals(0, core.flush());
        assertFalse(store.stored(job.id()).orElseThrow().active());
        assertEquals(1, runner.launches());
    }

    @Test
    void jobModifiedWhileRunningShouldKeepNewDefinition() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));
        runner.duringRun = onOtherThread(() -> core.rescheduleJob(job.id(), spec("report-v2", "10:00:00", "6h")));

        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        clock.set(due);
        assertEquals(1, core.tick(due));

        ScheduledJob stored = store.getActive(job.id()).orElseThrow();
        assertEquals("report-v2", stored.name());
        assertEquals("6h", stored.repeatInterval());
        assertEquals(Instant.parse("2026-01-01T16:00:00Z"), stored.nextRun());
        assertEquals(Instant.parse("2026-01-01T16:00:00Z"), core.nextDue().orElseThrow());
        assertEquals(SchedulingCore.JobState.SCHEDULED, core.state(job.id()).orElseThrow());
    }

    @Test
    void jobRemovedByAnEarlierJobOfTheSameTickShouldNotFire() {
        core.scheduleJob(new JobSpec("early", "early", script, "python", null, null, "10:10:00", "1h", null));
        core.scheduleJob(new JobSpec("late", "late", script, "python3", null, null, "10:30:00", "1h", null));
        runner.duringRun = () -> core.unscheduleJob("late");

        clock.advance(Duration.ofHours(1));
        assertEquals(1, core.tick(clock.instant()));

        assertEquals(1, runner.launches());
        assertEquals("python", runner.commands.get(0).get(0));
    }

    @Test
    void removedJobIdShouldNotBeReused() {
        ScheduledJob job = core.scheduleJob(new JobSpec("job-1", "report", script, null, null, null, "10:00:00", "1h", null));
        core.unscheduleJob(job.id());

        assertThrows(IllegalStateException.class, () -> core.scheduleJob(
                new JobSpec("job-1", "report", script, null, null, null, "10:00:00", "1h", null)));
        assertFalse(store.stored("job-1").orElseThrow().active());
    }

    @Test
    void flushShouldNotReviveJobDeactivatedInTheStore() {
        ScheduledJob job = core.scheduleJob(spec("report", "10:00:00", "1h"));
        store.deactivate(job.id());

        assertEquals(0, core.flush());

        assertFalse(store.stored(job.id()).orElseThrow().active());
        assertTrue(core.nextDue().isEmpty());
    }

    @Test
    void jobWithUnusableIntervalShouldBeDeactivatedInsteadOfStayingDue() {
        Instant due = Instant.parse("2026-01-01T11:00:00Z");
        store.save(new ScheduledJob("legacy", "legacy", script, null, null, null, "10:00:00", "1w", due,
                null, tempDir.resolve("logs").resolve("legacy").toString(), true, T0, T0));

        clock.set(due);
        assertEquals(0, core.tick(due));
        assertEquals(0, core.tick(due.plusSeconds(1)));

        assertEquals(0, runner.launches());
        assertFalse(store.stored("legacy").orElseThrow().active());
        assertTrue(core.nextDue().isEmpty());
    }

    private static Runnable onOtherThread(Runnable action) {
        return () -> {
            AtomicReference<Throwable> failure = new AtomicReference<>();
            Thread t = new Thread(() -> {
                try {
                    action.run();
                } catch (Throwable e) {
                    failure.set(e);
                }
            });
            t.start();
            try {
                t.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            if (failure.get() != null) {
                throw new IllegalStateException(failure.get());
            }
        };
    }

    private JobSpec spec(String name, String startTime, String interval) {
        return new JobSpec(null, name, script, null, null, null, startTime, interval, null);
    }
}
