package io.scheduler4j.core;

/**
 * Immutable job definition produced by JobBuilder.build() or read from a job file.
 * This is a pure data object with no persistence logic.
 */
public record JobSpec(

        // identity, null means "generate one"
        String id,
        String name,

        // invocation
        String script,
        String pythonExec,
        String venv,
        String workingDir,

        // scheduling
        String startTime,
        String repeatInterval,

        // logs, null means global default
        Integer logRetentionDays
) {
    public JobSpec withId(String id) {
        return new JobSpec(id, name, script, pythonExec, venv, workingDir, startTime, repeatInterval, logRetentionDays);
    }
}
