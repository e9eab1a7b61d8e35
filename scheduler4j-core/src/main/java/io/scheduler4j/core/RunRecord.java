package io.scheduler4j.core;

import java.time.Instant;

/**
 * One execution attempt of a job. {@code endTime} stays null while the run is {@link RunStatus#RUNNING}.
 */
public record RunRecord(
        String id,
        String jobId,
        Instant startTime,
        Instant endTime,
        RunStatus status,
        String logFile
) {
}
