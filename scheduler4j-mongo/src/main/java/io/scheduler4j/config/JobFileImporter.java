package io.scheduler4j.config;

import io.scheduler4j.ScriptScheduler;
import io.scheduler4j.core.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Schedules the jobs of configured job files on startup.
 *
 * <p>Jobs already active in the store keep their persisted schedule and removed jobs stay removed; only
 * unknown jobs are added. A job without an explicit id gets one derived from its name and script, so
 * importing the same file again after a restart does not create a duplicate.
 */
public class JobFileImporter {
    private static final Logger log = LoggerFactory.getLogger(JobFileImporter.class);

    private final ScriptScheduler scheduler;
    private final JobConfigLoader loader;

    public JobFileImporter(ScriptScheduler scheduler, JobConfigLoader loader) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    /**
     * @return number of newly scheduled jobs
     */
    public int importFiles(List<String> files) {
        if (files == null || files.isEmpty()) {
            return 0;
        }

        int added = 0;
        for (String file : files) {
            for (JobSpec spec : loader.load(Path.of(file))) {
                JobSpec withId = spec.id() != null ? spec : spec.withId(derivedId(spec));
                if (scheduler.isRemoved(withId.id())) {
                    log.info("scheduler4j job from file was removed, not restoring it name={} id={} file={}",
                            withId.name(), withId.id(), file);
                    continue;
                }
                if (scheduler.findJob(withId.id()).isPresent()) {
                    log.info("scheduler4j job from file already scheduled, keeping its state name={} id={} file={}",
                            withId.name(), withId.id(), file);
                    continue;
                }
                scheduler.addJob(withId);
                added++;
            }
        }
        log.info("scheduler4j imported job files files={} added={}", files.size(), added);
        return added;
    }

    static String derivedId(JobSpec spec) {
        String key = spec.name() + "|" + spec.script();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
