package io.scheduler4j.core;

import io.scheduler4j.utils.IntervalParser;

import java.time.Instant;

/**
 * A job as persisted by a {@link JobStore}.
 *
 * <p>{@code startTime} is the normalized "HH:mm:ss" time-of-day and {@code repeatInterval} the interval text
 * the job was defined with. {@code nextRun} only ever moves forward by whole intervals.
 */
public record ScheduledJob(
        String id,
        String name,
        String script,
        String pythonExec,
        String venv,
        String workingDir,
        String startTime,
        String repeatInterval,
        Instant nextRun,
        Integer logRetentionDays,
        String logPath,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {

    public Interval interval() {
        return IntervalParser.parse(repeatInterval);
    }

    public ScheduledJob withNextRun(Instant nextRun) {
        return new ScheduledJob(id, name, script, pythonExec, venv, workingDir, startTime, repeatInterval,
                nextRun, logRetentionDays, logPath, active, createdAt, updatedAt);
    }

    public ScheduledJob withLogPath(String logPath) {
        return new ScheduledJob(id, name, script, pythonExec, venv, workingDir, startTime, repeatInterval,
                nextRun, logRetentionDays, logPath, active, createdAt, updatedAt);
    }
}
