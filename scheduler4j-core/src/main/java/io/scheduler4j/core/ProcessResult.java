package io.scheduler4j.core;

/**
 * Outcome of a finished external process.
 */
public record ProcessResult(
        int exitCode,
        String stdout,
        String stderr
) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
