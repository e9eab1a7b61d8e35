package io.scheduler4j;

import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.ScheduledJob;

/**
 * Fluent builder for configuring a job before scheduling it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns a validated, in-memory job spec</li>
 *   <li>save(): build() + schedule and persist</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Use a caller-chosen id instead of a generated one.
     */
    JobBuilder id(String id);

    /**
     * Path of the script to launch. Validated when the job is scheduled.
     */
    JobBuilder script(String script);

    /**
     * Interpreter executable name or path. Ignored when a venv is set.
     */
    JobBuilder pythonExec(String pythonExec);

    /**
     * Virtual environment whose interpreter is used instead of {@link #pythonExec(String)}.
     */
    JobBuilder venv(String venv);

    JobBuilder workingDir(String workingDir);

    /**
     * First run time-of-day, "HH:mm:ss". "24:00:00" means midnight.
     */
    JobBuilder startAt(String timeOfDay);

    /**
     * Repeat interval, e.g. "1h", "15m", "30s".
     */
    JobBuilder repeatEvery(String interval);

    /**
     * Days to keep this job's logs. Without it the global retention applies.
     */
    JobBuilder logRetentionDays(int days);

    JobSpec build();

    ScheduledJob save();
}
