package io.scheduler4j.internal;

import io.scheduler4j.ProcessRunner;
import io.scheduler4j.core.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output goes to temporary files that are read once the process has exited.
 */
public class LocalProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(LocalProcessRunner.class);

    @Override
    public ProcessResult run(List<String> command, Path workingDirectory) throws IOException, InterruptedException {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        Path stdout = Files.createTempFile("scheduler4j-", ".out");
        Path stderr = Files.createTempFile("scheduler4j-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }

            Process process = pb.start();
            log.debug("scheduler4j process started pid={} command={}", process.pid(), command);
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                process.destroy();
                throw e;
            }

            return new ProcessResult(
                    exitCode,
                    new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8),
                    new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8)
            );
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("scheduler4j could not delete temp file path={} msg={}", file, e.getMessage());
        }
    }
}
