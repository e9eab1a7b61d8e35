package io.scheduler4j.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "scheduler4j")
public class SchedulerProperties {
    private boolean enabled = true; // read by the starter's auto-configuration condition
    private Duration processEvery = Duration.ofSeconds(1); // poll loop sleep
    private Duration sweepEvery = Duration.ofHours(24);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String logDir = "logs"; // seeded into global config
    private int logRetentionDays = 30; // seeded into global config
    private String pythonExec = "python";
    private String scriptExtension = ".py";
    private String retentionFileName = ".retention";
    private String timezone; // null means system default
    private List<String> jobFiles = new ArrayList<>();
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getSweepEvery() {
        return sweepEvery;
    }

    public void setSweepEvery(Duration sweepEvery) {
        this.sweepEvery = sweepEvery;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getLogDir() {
        return logDir;
    }

    public void setLogDir(String logDir) {
        this.logDir = logDir;
    }

    public int getLogRetentionDays() {
        return logRetentionDays;
    }

    public void setLogRetentionDays(int logRetentionDays) {
        this.logRetentionDays = logRetentionDays;
    }

    public String getPythonExec() {
        return pythonExec;
    }

    public void setPythonExec(String pythonExec) {
        this.pythonExec = pythonExec;
    }

    public String getScriptExtension() {
        return scriptExtension;
    }

    public void setScriptExtension(String scriptExtension) {
        this.scriptExtension = scriptExtension;
    }

    public String getRetentionFileName() {
        return retentionFileName;
    }

    public void setRetentionFileName(String retentionFileName) {
        this.retentionFileName = retentionFileName;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<String> getJobFiles() {
        return jobFiles;
    }

    public void setJobFiles(List<String> jobFiles) {
        this.jobFiles = jobFiles;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Zone that job start times are expressed in.
     */
    public ZoneId zone() {
        try {
            return timezone != null ? ZoneId.of(timezone) : ZoneId.systemDefault();
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }
}
