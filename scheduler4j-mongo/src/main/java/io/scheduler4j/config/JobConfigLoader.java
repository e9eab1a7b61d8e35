package io.scheduler4j.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.core.JobSpec;
import io.scheduler4j.utils.IntervalParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads job definitions from JSON files.
 *
 * <p>A file holds one job object or an array of them:
 * <pre>
 * {
 *   "name": "export",
 *   "script": "/opt/jobs/export.py",
 *   "startTime": "02:00:00",
 *   "repeatInterval": "24h",
 *   "logRetention": 14,
 *   "venv": "/opt/jobs/.venv"
 * }
 * </pre>
 * {@code id}, {@code pythonExec}, {@code venv} and {@code workingDir} are optional. Snake-case keys
 * ({@code start_time}, {@code repeat_time}, {@code log_retention}, ...) are accepted as well.
 */
public class JobConfigLoader {

    private final ObjectMapper objectMapper;

    public JobConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws IllegalArgumentException if the file cannot be read, is not valid JSON, or a job lacks a required key
     */
    public List<JobSpec> load(Path file) {
        Objects.requireNonNull(file, "file must not be null");

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in job file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read job file " + file + ": " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("Job file is empty: " + file);
        }

        List<JobSpec> specs = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                specs.add(toSpec(node, file));
            }
        } else if (root.isObject()) {
            specs.add(toSpec(root, file));
        } else {
            throw new IllegalArgumentException("Job file must hold a job object or an array of jobs: " + file);
        }
        return specs;
    }

    private JobSpec toSpec(JsonNode node, Path file) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Job entries must be objects in " + file);
        }

        JobFileEntry entry;
        try {
            entry = objectMapper.treeToValue(node, JobFileEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid job entry in " + file + ": " + e.getOriginalMessage(), e);
        }

        List<String> missing = new ArrayList<>();
        if (isBlank(entry.startTime())) missing.add("startTime");
        if (isBlank(entry.script())) missing.add("script");
        if (isBlank(entry.repeatInterval())) missing.add("repeatInterval");
        if (entry.logRetention() == null) missing.add("logRetention");
        if (isBlank(entry.name())) missing.add("name");
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required field(s) " + missing + " in job file " + file);
        }
        if (entry.logRetention() <= 0) {
            throw new IllegalArgumentException("logRetention must be a positive number of days in job file " + file);
        }

        return new JobSpec(
                isBlank(entry.id()) ? null : entry.id(),
                entry.name(),
                entry.script(),
                isBlank(entry.pythonExec()) ? null : entry.pythonExec(),
                isBlank(entry.venv()) ? null : entry.venv(),
                isBlank(entry.workingDir()) ? null : entry.workingDir(),
                IntervalParser.normalizeTimeOfDay(entry.startTime()),
                IntervalParser.parse(entry.repeatInterval()).toString(),
                entry.logRetention()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobFileEntry(
            String id,
            String name,
            String script,
            @JsonAlias("python_exec") String pythonExec,
            String venv,
            @JsonAlias("working_dir") String workingDir,
            @JsonAlias("start_time") String startTime,
            @JsonAlias({"repeat_time", "repeat_interval"}) String repeatInterval,
            @JsonAlias("log_retention") Integer logRetention
    ) {
    }
}
