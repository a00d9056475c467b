package gpuhub.coordinator.store;

import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.TransitionResult;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcJobRepository against in-memory H2.
 */
class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job job(String id, String user, int priority, Instant createdAt) {
        return Job.builder()
                .id(id)
                .userId(user)
                .title("title " + id)
                .jobType("training")
                .priority(priority)
                .config(Map.of("epochs", 3, "files", List.of("a.csv")))
                .createdAt(createdAt)
                .build();
    }

    @Test
    void saveAndFindRoundTripsAllFields() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        repo.save(job("job-a", "alice", 3, created));

        Job found = repo.findById("job-a").orElseThrow();
        assertEquals("alice", found.userId());
        assertEquals("title job-a", found.title());
        assertEquals("training", found.jobType());
        assertEquals(3, found.priority());
        assertEquals(3, found.config().get("epochs"));
        assertEquals(List.of("a.csv"), found.config().get("files"));
        assertEquals(JobStatus.PENDING, found.status());
        assertEquals(created, found.createdAt());
        assertNull(found.result());
    }

    @Test
    void findByIdAndUserHidesOtherUsersJobs() {
        repo.save(job("job-a", "alice", 1, Instant.now()));

        assertTrue(repo.findByIdAndUser("job-a", "alice").isPresent());
        assertTrue(repo.findByIdAndUser("job-a", "bob").isEmpty());
        assertTrue(repo.findById("missing").isEmpty());
    }

    @Test
    void findByStatusOrdersByPriorityThenAge() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        repo.save(job("old-low", "u", 1, t0));
        repo.save(job("new-high", "u", 5, t0.plusSeconds(20)));
        repo.save(job("old-high", "u", 5, t0.plusSeconds(10)));

        List<String> ids = repo.findByStatus(JobStatus.PENDING, 10).stream().map(Job::id).toList();
        assertEquals(List.of("old-high", "new-high", "old-low"), ids);
    }

    @Test
    void findByUserFiltersByStatus() {
        repo.save(job("j1", "alice", 1, Instant.now()));
        repo.save(job("j2", "alice", 1, Instant.now()));
        repo.save(job("j3", "bob", 1, Instant.now()));
        repo.applyTransition("j2", JobTransition.running("w-1", Instant.now()));

        assertEquals(2, repo.findByUser("alice", null, 10).size());
        assertEquals(List.of("j2"), repo.findByUser("alice", JobStatus.RUNNING, 10).stream().map(Job::id).toList());
        assertEquals(1, repo.countRunningForUser("alice"));
        assertEquals(0, repo.countRunningForUser("bob"));
        assertEquals(1, repo.countRunningOnWorker("w-1"));
    }

    @Test
    void transitionAppliesOnlyFromAllowedStatus() {
        repo.save(job("j1", "u", 1, Instant.now()));

        assertEquals(TransitionResult.APPLIED, repo.applyTransition("j1", JobTransition.running("w-1", Instant.now())));
        assertEquals(TransitionResult.REJECTED,
                repo.applyTransition("j1", JobTransition.running("w-2", Instant.now())));
        assertEquals(TransitionResult.NOT_FOUND,
                repo.applyTransition("nope", JobTransition.running("w-1", Instant.now())));

        Job running = repo.findById("j1").orElseThrow();
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals("w-1", running.assignedWorkerId());
        assertNotNull(running.startedAt());
    }

    @Test
    void progressNeverDecreases() {
        repo.save(job("j1", "u", 1, Instant.now()));
        repo.applyTransition("j1", JobTransition.running("w-1", Instant.now()));

        repo.applyTransition("j1", JobTransition.progress(40));
        repo.applyTransition("j1", JobTransition.progress(25));

        assertEquals(40.0, repo.findById("j1").orElseThrow().progress());
    }

    @Test
    void completedStoresResultAsJson() {
        repo.save(job("j1", "u", 1, Instant.now()));
        repo.applyTransition("j1", JobTransition.running("w-1", Instant.now()));
        repo.applyTransition("j1", JobTransition.completed(Map.of("accuracy", 0.93, "steps", 10), Instant.now()));

        Job done = repo.findById("j1").orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(100.0, done.progress());
        assertEquals(0.93, done.result().get("accuracy"));
        assertEquals(10, done.result().get("steps"));
        assertNull(done.errorMessage());
        assertNotNull(done.completedAt());
    }

    @Test
    void retryClearsRunFields() {
        repo.save(job("j1", "u", 1, Instant.now()));
        repo.applyTransition("j1", JobTransition.running("w-1", Instant.now()));
        repo.applyTransition("j1", JobTransition.progress(60));
        repo.applyTransition("j1", JobTransition.failed("disk full", Instant.now()));

        assertEquals(TransitionResult.APPLIED, repo.applyTransition("j1", JobTransition.retry()));

        Job retried = repo.findById("j1").orElseThrow();
        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals(0.0, retried.progress());
        assertNull(retried.assignedWorkerId());
        assertNull(retried.startedAt());
        assertNull(retried.completedAt());
        assertNull(retried.errorMessage());
        assertNull(retried.result());
    }

    @Test
    void updateDetailsChangesOnlyDescriptiveFields() {
        repo.save(job("j1", "u", 1, Instant.now()));
        repo.applyTransition("j1", JobTransition.running("w-1", Instant.now()));
        repo.applyTransition("j1", JobTransition.failed("disk full", Instant.now()));

        Job edited = repo.findById("j1").orElseThrow().toBuilder()
                .title("renamed")
                .description("second attempt")
                .priority(5)
                .config(Map.of("epochs", 7))
                .status(JobStatus.PENDING)
                .build();
        assertTrue(repo.updateDetails(edited));

        Job found = repo.findById("j1").orElseThrow();
        assertEquals("renamed", found.title());
        assertEquals("second attempt", found.description());
        assertEquals(5, found.priority());
        assertEquals(7, found.config().get("epochs"));
        assertEquals(JobStatus.FAILED, found.status());
        assertEquals("disk full", found.errorMessage());
        assertEquals("w-1", found.assignedWorkerId());
    }

    @Test
    void updateDetailsSkipsRunningAndCompletedJobs() {
        repo.save(job("j1", "u", 1, Instant.now()));
        repo.applyTransition("j1", JobTransition.running("w-1", Instant.now()));
        Job running = repo.findById("j1").orElseThrow();

        assertFalse(repo.updateDetails(running.toBuilder().title("renamed").build()));

        repo.applyTransition("j1", JobTransition.completed(Map.of(), Instant.now()));
        assertFalse(repo.updateDetails(running.toBuilder().title("renamed").build()));
        assertFalse(repo.updateDetails(job("missing", "u", 1, Instant.now())));
        assertEquals("title j1", repo.findById("j1").orElseThrow().title());
    }

    @Test
    void deleteRemovesJob() {
        repo.save(job("j1", "u", 1, Instant.now()));

        assertTrue(repo.delete("j1"));
        assertFalse(repo.delete("j1"));
        assertEquals(0, repo.countByStatus(JobStatus.PENDING));
    }

    @Test
    void generatedIdsAreUnique() {
        String a = repo.generateId();
        String b = repo.generateId();
        assertTrue(a.startsWith("job-"));
        assertNotEquals(a, b);
    }
}
