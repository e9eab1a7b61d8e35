package io.scheduler4j.internal;

import io.scheduler4j.JobBuilder;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.ScheduledJob;
import io.scheduler4j.utils.IntervalParser;

import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by the scheduler.
 */
public class DefaultJobBuilder implements JobBuilder {

    private final String name;
    private final Function<JobSpec, ScheduledJob> persister;

    private String id;
    private String script;
    private String pythonExec;
    private String venv;
    private String workingDir;
    private String startTime;
    private String repeatInterval;
    private Integer logRetentionDays;

    public DefaultJobBuilder(String name, Function<JobSpec, ScheduledJob> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder id(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        this.id = id;
        return this;
    }

    @Override
    public JobBuilder script(String script) {
        this.script = Objects.requireNonNull(script, "script must not be null");
        return this;
    }

    @Override
    public JobBuilder pythonExec(String pythonExec) {
        this.pythonExec = Objects.requireNonNull(pythonExec, "pythonExec must not be null");
        return this;
    }

    @Override
    public JobBuilder venv(String venv) {
        this.venv = venv;
        return this;
    }

    @Override
    public JobBuilder workingDir(String workingDir) {
        this.workingDir = workingDir;
        return this;
    }

    @Override
    public JobBuilder startAt(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        this.startTime = IntervalParser.normalizeTimeOfDay(timeOfDay);
        return this;
    }

    @Override
    public JobBuilder repeatEvery(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        this.repeatInterval = IntervalParser.parse(interval).toString();
        return this;
    }

    @Override
    public JobBuilder logRetentionDays(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("logRetentionDays must be positive");
        }
        this.logRetentionDays = days;
        return this;
    }

    @Override
    public JobSpec build() {
        if (script == null) throw new IllegalStateException("script is required");
        if (startTime == null) throw new IllegalStateException("start time is required");
        if (repeatInterval == null) throw new IllegalStateException("repeat interval is required");

        return new JobSpec(
                id,
                name,
                script,
                pythonExec,
                venv,
                workingDir,
                startTime,
                repeatInterval,
                logRetentionDays
        );
    }

    @Override
    public ScheduledJob save() {
        return persister.apply(build());
    }
}
