package io.scheduler4j;

import io.scheduler4j.core.ProcessResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion and captures its output.
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * @param command          executable followed by its arguments
     * @param workingDirectory directory to run in; null inherits the scheduler's
     * @throws IOException if the process could not be launched
     */
    ProcessResult run(List<String> command, Path workingDirectory) throws IOException, InterruptedException;
}
