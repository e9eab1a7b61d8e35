package io.scheduler4j.internal.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.scheduler4j.core.JobStore;
import io.scheduler4j.core.PersistResult;
import io.scheduler4j.core.RunRecord;
import io.scheduler4j.core.RunStatus;
import io.scheduler4j.core.ScheduledJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoClient client;
    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "scheduler4j_test");
        dropAll();
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
        client.close();
    }

    @Test
    void saveShouldInsertThenUpdateById() {
        ScheduledJob job = job("job-1", "export", Instant.parse("2026-01-01T11:00:00Z"));

        PersistResult first = jobStore.save(job);
        PersistResult second = jobStore.save(job.withNextRun(Instant.parse("2026-01-01T12:00:00Z")));

        assertTrue(first.created());
        assertTrue(second.updated());
        assertEquals("job-1", second.id());

        ScheduledJob loaded = jobStore.getActive("job-1").orElseThrow();
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), loaded.nextRun());
        assertEquals("export", loaded.name());
        assertEquals("1h", loaded.repeatInterval());
        assertEquals(7, loaded.logRetentionDays());
        assertEquals(job.createdAt(), loaded.createdAt());
        assertNotNull(loaded.updatedAt());
        assertEquals(1, mongoTemplate.count(new Query(), ScheduledJobDocument.class));
    }

    @Test
    void optionalFieldsShouldBeClearedOnUpdate() {
        ScheduledJob job = job("job-1", "export", Instant.parse("2026-01-01T11:00:00Z"));
        jobStore.save(job);

        jobStore.save(new ScheduledJob(job.id(), job.name(), job.script(), null, null, null, job.startTime(),
                job.repeatInterval(), job.nextRun(), null, job.logPath(), true, job.createdAt(), job.updatedAt()));

        ScheduledJob loaded = jobStore.getActive("job-1").orElseThrow();
        assertNull(loaded.venv());
        assertNull(loaded.logRetentionDays());
    }

    @Test
    void listActiveShouldOrderByNextRunAndSkipDeactivated() {
        jobStore.save(job("late", "late", Instant.parse("2026-01-01T13:00:00Z")));
        jobStore.save(job("early", "early", Instant.parse("2026-01-01T11:00:00Z")));
        jobStore.save(job("gone", "gone", Instant.parse("2026-01-01T10:00:00Z")));

        assertTrue(jobStore.deactivate("gone"));
        assertFalse(jobStore.deactivate("gone"));
        assertFalse(jobStore.deactivate("never-existed"));

        List<ScheduledJob> active = jobStore.listActive();
        assertEquals(List.of("early", "late"), active.stream().map(ScheduledJob::id).toList());
        assertEquals(Optional.empty(), jobStore.getActive("gone"));

        ScheduledJobDocument gone = mongoTemplate.findById("gone", ScheduledJobDocument.class);
        assertNotNull(gone);
        assertFalse(gone.isActive());
    }

    @Test
    void updateNextRunShouldOnlyTouchActiveJobWithExpectedNextRun() {
        Instant at11 = Instant.parse("2026-01-01T11:00:00Z");
        Instant at12 = Instant.parse("2026-01-01T12:00:00Z");
        jobStore.save(job("job-1", "export", at11));

        assertFalse(jobStore.updateNextRun("job-1", at12, Instant.parse("2026-01-01T13:00:00Z")));
        assertTrue(jobStore.updateNextRun("job-1", at11, at12));
        assertEquals(at12, jobStore.getActive("job-1").orElseThrow().nextRun());

        jobStore.deactivate("job-1");
        assertFalse(jobStore.updateNextRun("job-1", null, Instant.parse("2026-01-01T14:00:00Z")));

        ScheduledJob stored = jobStore.find("job-1").orElseThrow();
        assertFalse(stored.active());
        assertEquals(at12, stored.nextRun());
        assertEquals("export", stored.name());
        assertEquals(Optional.empty(), jobStore.find("never-existed"));
    }

    @Test
    void runHistoryShouldMoveFromRunningToTerminalOnce() {
        jobStore.save(job("job-1", "export", Instant.parse("2026-01-01T11:00:00Z")));

        String first = jobStore.recordRunStart("job-1", "/logs/export/export_2026-01-01.log");
        String second = jobStore.recordRunStart("job-1", "/logs/export/export_2026-01-01.log");
        jobStore.recordRunEnd(first, RunStatus.SUCCESS);
        jobStore.recordRunEnd(first, RunStatus.ERROR);

        List<RunRecord> runs = jobStore.listRuns("job-1");
        assertEquals(2, runs.size());
        RunRecord finished = runs.stream().filter(r -> r.id().equals(first)).findFirst().orElseThrow();
        RunRecord running = runs.stream().filter(r -> r.id().equals(second)).findFirst().orElseThrow();
        assertEquals(RunStatus.SUCCESS, finished.status());
        assertNotNull(finished.endTime());
        assertEquals(RunStatus.RUNNING, running.status());
        assertNull(running.endTime());

        assertThrows(IllegalArgumentException.class, () -> jobStore.recordRunEnd(second, RunStatus.RUNNING));
    }

    @Test
    void runHistoryShouldSurviveDeactivation() {
        jobStore.save(job("job-1", "export", Instant.parse("2026-01-01T11:00:00Z")));
        String runId = jobStore.recordRunStart("job-1", null);
        jobStore.recordRunEnd(runId, RunStatus.ERROR);

        jobStore.deactivate("job-1");

        assertEquals(1, jobStore.listRuns("job-1").size());
    }

    @Test
    void initializeShouldSeedDefaultsWithoutOverwriting() {
        jobStore.setConfig(JobStore.LOG_DIR, "/var/log/jobs");

        jobStore.initialize(Map.of(JobStore.LOG_DIR, "logs", JobStore.LOG_RETENTION, "30"));
        jobStore.initialize(Map.of(JobStore.LOG_RETENTION, "90"));

        assertEquals("/var/log/jobs", jobStore.getConfig(JobStore.LOG_DIR, null));
        assertEquals("30", jobStore.getConfig(JobStore.LOG_RETENTION, null));
        assertEquals("fallback", jobStore.getConfig("unknown", "fallback"));

        jobStore.setConfig(JobStore.LOG_RETENTION, "10");
        assertEquals("10", jobStore.getConfig(JobStore.LOG_RETENTION, null));
    }

    private void dropAll() {
        mongoTemplate.dropCollection(ScheduledJobDocument.class);
        mongoTemplate.dropCollection(JobRunDocument.class);
        mongoTemplate.dropCollection(ConfigEntryDocument.class);
    }

    private static ScheduledJob job(String id, String name, Instant nextRun) {
        Instant created = Instant.parse("2026-01-01T10:05:00Z").truncatedTo(ChronoUnit.MILLIS);
        return new ScheduledJob(id, name, "/opt/jobs/" + name + ".py", null, "/opt/jobs/.venv", null,
                "10:00:00", "1h", nextRun, 7, "logs/" + name, true, created, created);
    }
}
