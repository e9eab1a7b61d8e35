package io.scheduler4j.config;

import io.scheduler4j.ScriptScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle. Configured job files are imported
 * right before the scheduler starts.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final ScriptScheduler scheduler;
    private final SchedulerProperties props;
    private final JobFileImporter importer;
    private volatile boolean running = false;

    public SchedulerLifecycle(ScriptScheduler scheduler, SchedulerProperties props, JobFileImporter importer) {
        this.scheduler = scheduler;
        this.props = props;
        this.importer = importer;
    }

    @Override
    public void start() {
        importer.importFiles(props.getJobFiles());
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
