package io.scheduler4j.internal;

import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.PersistenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Deletes job log files older than their retention window.
 *
 * <p>The window of a file is read from a retention file (default {@code .retention}, holding a number of
 * days) in the file's own directory; without one, the global {@link JobStore#LOG_RETENTION} applies.
 * Per-job retention is implemented by writing such a file into the job's log directory.
 */
public class RetentionSweeper {
    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final Clock clock;

    private Instant lastSweep;

    public RetentionSweeper(SchedulerProperties props, JobStore jobStore, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Sweep the log root, at most once per {@code sweepEvery} unless forced.
     * The first call always sweeps.
     *
     * @return number of deleted files
     */
    public synchronized int sweep(boolean force) {
        Instant now = clock.instant();
        if (!force && lastSweep != null && Duration.between(lastSweep, now).compareTo(props.getSweepEvery()) < 0) {
            return 0;
        }
        lastSweep = now;

        int defaultDays;
        Path root;
        try {
            defaultDays = globalRetentionDays();
            root = Path.of(jobStore.getConfig(JobStore.LOG_DIR, props.getLogDir()));
        } catch (PersistenceFailureException e) {
            log.error("scheduler4j log sweep skipped, config unavailable msg={}", e.getMessage(), e);
            return 0;
        }

        if (!Files.isDirectory(root)) {
            log.debug("scheduler4j log sweep skipped, no log directory root={}", root);
            return 0;
        }

        log.info("scheduler4j checking old log files root={} retentionDays={}", root, defaultDays);
        LogVisitor visitor = new LogVisitor(now, defaultDays);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException e) {
            log.error("scheduler4j log sweep failed root={} msg={}", root, e.getMessage(), e);
        }
        return visitor.deleted;
    }

    /**
     * Pin the retention window of one log directory.
     */
    public void writeRetentionOverride(Path directory, int days) throws IOException {
        if (days <= 0) {
            throw new IllegalArgumentException("retention days must be positive: " + days);
        }
        Files.createDirectories(directory);
        Files.writeString(directory.resolve(props.getRetentionFileName()), Integer.toString(days), StandardCharsets.UTF_8);
    }

    private int globalRetentionDays() {
        String fallback = Integer.toString(props.getLogRetentionDays());
        String configured = jobStore.getConfig(JobStore.LOG_RETENTION, fallback);
        try {
            int days = Integer.parseInt(configured.trim());
            if (days > 0) {
                return days;
            }
        } catch (NumberFormatException ignored) {
            // fall through
        }
        log.warn("scheduler4j invalid global log retention value={}, using {}", configured, fallback);
        return props.getLogRetentionDays();
    }

    private OptionalInt readOverride(Path directory) {
        Path file = directory.resolve(props.getRetentionFileName());
        if (!Files.isRegularFile(file)) {
            return OptionalInt.empty();
        }
        try {
            int days = Integer.parseInt(Files.readString(file, StandardCharsets.UTF_8).trim());
            if (days > 0) {
                return OptionalInt.of(days);
            }
            log.warn("scheduler4j ignoring non-positive retention override path={}", file);
        } catch (IOException | NumberFormatException e) {
            log.warn("scheduler4j ignoring unreadable retention override path={} msg={}", file, e.getMessage());
        }
        return OptionalInt.empty();
    }

    private final class LogVisitor extends SimpleFileVisitor<Path> {
        private final Instant now;
        private final int defaultDays;
        private final Map<Path, Integer> retentionByDir = new HashMap<>();
        private int deleted;

        private LogVisitor(Instant now, int defaultDays) {
            this.now = now;
            this.defaultDays = defaultDays;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            retentionByDir.put(dir, readOverride(dir).orElse(defaultDays));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile() || file.getFileName().toString().equals(props.getRetentionFileName())) {
                return FileVisitResult.CONTINUE;
            }

            int days = retentionByDir.getOrDefault(file.getParent(), defaultDays);
            Instant cutoff = now.minus(Duration.ofDays(days));
            if (!attrs.creationTime().toInstant().isBefore(cutoff)) {
                return FileVisitResult.CONTINUE;
            }

            try {
                Files.delete(file);
                deleted++;
                log.info("scheduler4j deleted log file path={} retentionDays={}", file, days);
            } catch (IOException e) {
                log.warn("scheduler4j could not delete log file path={} msg={}", file, e.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("scheduler4j could not inspect log file path={} msg={}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
