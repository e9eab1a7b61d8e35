package io.scheduler4j.internal;

import io.scheduler4j.ProcessRunner;
import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.ExecutionFailureException;
import io.scheduler4j.core.InvalidScriptPathException;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.ProcessResult;
import io.scheduler4j.core.RunStatus;
import io.scheduler4j.core.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Launches a job's script through a {@link ProcessRunner} and records the run.
 *
 * <p>Each run:
 * <ol>
 *   <li>validates the script and interpreter paths (nothing is recorded if this fails)</li>
 *   <li>appends a RUNNING record to the store</li>
 *   <li>runs the script synchronously and appends its output to the job's daily log file</li>
 *   <li>moves the record to SUCCESS or ERROR</li>
 * </ol>
 */
public class ExecutionRecorder {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    private static final String SHELL_METACHARACTERS = "|&;$><`";
    private static final DateTimeFormatter LOG_FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter LOG_LINE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final ProcessRunner processRunner;
    private final Clock clock;
    private final boolean windows;

    public ExecutionRecorder(SchedulerProperties props, JobStore jobStore, ProcessRunner processRunner, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    public boolean run(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.logPath() == null) {
            throw new IllegalStateException("job has no log path: " + job.id());
        }
        return run(job.id(), job.name(), job.script(), job.pythonExec(), job.venv(), job.workingDir(),
                Path.of(job.logPath()));
    }

    /**
     * Run a script once and record the outcome.
     *
     * @return true if the script exited with status 0
     * @throws InvalidScriptPathException if the script or interpreter path is rejected
     */
    public boolean run(String jobId, String jobName, String script, String pythonExec, String venv,
                       String workingDir, Path logDirectory) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(logDirectory, "logDirectory must not be null");

        Path scriptPath = validateScript(script);
        String interpreter = resolveInterpreter(pythonExec, venv);
        List<String> command = List.of(interpreter, scriptPath.toString());
        Path workDir = (workingDir == null || workingDir.isBlank()) ? null : Path.of(workingDir);

        ZonedDateTime startedAt = ZonedDateTime.now(clock.withZone(props.zone()));
        Path logFile = logDirectory.resolve(logFileName(scriptPath, startedAt));

        String runId = jobStore.recordRunStart(jobId, logFile.toString());
        log.info("scheduler4j job started name={} id={} runId={} script={}", jobName, jobId, runId, scriptPath);

        RunStatus status = RunStatus.ERROR;
        try {
            status = execute(jobName, jobId, command, workDir, logFile, startedAt);
        } finally {
            jobStore.recordRunEnd(runId, status);
        }
        return status == RunStatus.SUCCESS;
    }

    /**
     * Checks everything {@link #run} would check before recording anything.
     */
    public void validate(JobSpec spec) {
        validateScript(spec.script());
        resolveInterpreter(spec.pythonExec(), spec.venv());
    }

    /**
     * @return the absolute, normalized script path
     * @throws InvalidScriptPathException if the path holds shell metacharacters, has the wrong extension
     *                                    or is not an existing regular file
     */
    public Path validateScript(String script) {
        if (script == null || script.isBlank()) {
            throw new InvalidScriptPathException(script, "Script path must not be blank");
        }
        checkMetacharacters(script);
        if (!script.endsWith(props.getScriptExtension())) {
            throw new InvalidScriptPathException(script, "Script must be a " + props.getScriptExtension() + " file");
        }

        Path path;
        try {
            path = Path.of(script);
        } catch (InvalidPathException e) {
            throw new InvalidScriptPathException(script, "Malformed script path");
        }
        if (!Files.isRegularFile(path)) {
            throw new InvalidScriptPathException(script, "Script does not exist or is not a regular file");
        }
        return path.toAbsolutePath().normalize();
    }

    /**
     * The venv's interpreter when a venv is given, otherwise the configured executable.
     */
    public String resolveInterpreter(String pythonExec, String venv) {
        if (venv != null && !venv.isBlank()) {
            checkMetacharacters(venv);
            Path interpreter = windows
                    ? Path.of(venv, "Scripts", "python.exe")
                    : Path.of(venv, "bin", "python");
            return interpreter.toString();
        }

        String exec = (pythonExec == null || pythonExec.isBlank()) ? props.getPythonExec() : pythonExec;
        checkMetacharacters(exec);
        return exec;
    }

    private RunStatus execute(String jobName, String jobId, List<String> command, Path workDir, Path logFile,
                              ZonedDateTime startedAt) {
        String script = command.get(1);
        appendLog(logFile, "[" + LOG_LINE_TIME.format(startedAt) + "] Launching script " + script + "...\n");

        try {
            ProcessResult result = launch(command, workDir);
            appendLog(logFile, result.stdout());
            appendLog(logFile, result.stderr());

            if (!result.succeeded()) {
                appendLog(logFile, "Script " + script + " exited with code " + result.exitCode() + "\n");
                log.error("scheduler4j job failed name={} id={} exitCode={} stderr={}",
                        jobName, jobId, result.exitCode(), result.stderr());
                return RunStatus.ERROR;
            }

            log.info("scheduler4j job succeeded name={} id={}", jobName, jobId);
            log.debug("scheduler4j job output name={} stdout={}", jobName, result.stdout());
            if (!result.stderr().isBlank()) {
                log.warn("scheduler4j job wrote to stderr name={} id={} stderr={}", jobName, jobId, result.stderr());
            }
            return RunStatus.SUCCESS;
        } catch (ExecutionFailureException e) {
            appendLog(logFile, e.getMessage() + "\n");
            log.error("scheduler4j job could not run name={} id={} msg={}", jobName, jobId, e.getMessage(), e);
            return RunStatus.ERROR;
        }
    }

    private ProcessResult launch(List<String> command, Path workDir) {
        try {
            return processRunner.run(command, workDir);
        } catch (IOException e) {
            throw new ExecutionFailureException("Could not launch " + String.join(" ", command) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailureException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    private void appendLog(Path logFile, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        try {
            Path parent = logFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("scheduler4j could not write job log path={} msg={}", logFile, e.getMessage());
        }
    }

    private String logFileName(Path script, ZonedDateTime at) {
        String base = script.getFileName().toString();
        String ext = props.getScriptExtension();
        if (base.endsWith(ext)) {
            base = base.substring(0, base.length() - ext.length());
        }
        return base + "_" + LOG_FILE_DATE.format(at) + ".log";
    }

    private static void checkMetacharacters(String path) {
        for (int i = 0; i < path.length(); i++) {
            if (SHELL_METACHARACTERS.indexOf(path.charAt(i)) >= 0) {
                throw new InvalidScriptPathException(path, "Path contains forbidden character '" + path.charAt(i) + "'");
            }
        }
    }
}
