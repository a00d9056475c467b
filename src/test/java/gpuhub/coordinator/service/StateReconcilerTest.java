package gpuhub.coordinator.service;

import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.store.Database;
import gpuhub.coordinator.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle rules enforced by the reconciler.
 */
class StateReconcilerTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static StateReconciler reconciler;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-reconciler;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        jobs = new JdbcJobRepository(db);
        reconciler = new StateReconciler(jobs);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
        jobs.save(Job.builder().id("j1").userId("u").title("t").jobType("training").build());
    }

    private static Job load() {
        return jobs.findById("j1").orElseThrow();
    }

    @Test
    @DisplayName("PENDING -> RUNNING -> COMPLETED")
    void happyPath() {
        assertEquals(TransitionResult.APPLIED, reconciler.markRunning("j1", "w-1"));
        assertEquals(TransitionResult.APPLIED, reconciler.recordProgress("j1", 50));
        assertEquals(TransitionResult.APPLIED, reconciler.markCompleted("j1", Map.of("ok", true)));

        Job job = load();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(100.0, job.progress());
        assertEquals("w-1", job.assignedWorkerId());
        assertEquals(true, job.result().get("ok"));
        assertNull(job.errorMessage());
    }

    @Test
    void completedCannotBeLeft() {
        reconciler.markRunning("j1", "w-1");
        reconciler.markCompleted("j1", Map.of());

        assertEquals(TransitionResult.REJECTED, reconciler.markFailed("j1", "late failure"));
        assertEquals(TransitionResult.REJECTED, reconciler.markCancelled("j1"));
        assertEquals(TransitionResult.REJECTED, reconciler.recordProgress("j1", 10));
        assertEquals(TransitionResult.REJECTED, reconciler.retry("j1"));
        assertEquals(JobStatus.COMPLETED, load().status());
    }

    @Test
    void pendingCancelLeavesRunningJobAlone() {
        reconciler.markRunning("j1", "w-1");

        assertEquals(TransitionResult.REJECTED, reconciler.markPendingCancelled("j1"));

        Job job = load();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("w-1", job.assignedWorkerId());
    }

    @Test
    void pendingCancelAppliesToPendingJob() {
        assertEquals(TransitionResult.APPLIED, reconciler.markPendingCancelled("j1"));

        Job job = load();
        assertEquals(JobStatus.CANCELLED, job.status());
        assertNotNull(job.completedAt());
    }

    @Test
    void lateProgressDoesNotResurrectCancelledJob() {
        reconciler.markRunning("j1", "w-1");
        reconciler.markCancelled("j1");

        assertEquals(TransitionResult.REJECTED, reconciler.recordProgress("j1", 80));

        Job job = load();
        assertEquals(JobStatus.CANCELLED, job.status());
        assertNull(job.errorMessage());
        assertNull(job.assignedWorkerId());
    }

    @Test
    void handBuiltTransitionOutOfTerminalStateIsRefused() {
        reconciler.markRunning("j1", "w-1");
        reconciler.markFailed("j1", "boom");

        JobTransition resurrect = JobTransition.builder()
                .from(JobStatus.FAILED)
                .to(JobStatus.RUNNING)
                .build();

        assertEquals(TransitionResult.REJECTED, reconciler.writeTransition("j1", resurrect));
        assertEquals(JobStatus.FAILED, load().status());
    }

    @Test
    void pendingJobCannotCompleteDirectly() {
        assertEquals(TransitionResult.REJECTED, reconciler.markCompleted("j1", Map.of()));
        assertEquals(TransitionResult.REJECTED, reconciler.markFailed("j1", "x"));
        assertEquals(JobStatus.PENDING, load().status());
    }

    @Test
    void pendingJobCanBeRejectedWithoutWorker() {
        assertEquals(TransitionResult.APPLIED, reconciler.markRejected("j1", "Unsupported job type: x"));

        Job job = load();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("Unsupported job type: x", job.errorMessage());
        assertNull(job.assignedWorkerId());
        assertEquals(0.0, job.progress());
    }

    @Test
    @DisplayName("Retry resets every run field individually")
    void retryResetsFailedJob() {
        reconciler.markRunning("j1", "w-1");
        reconciler.recordProgress("j1", 70);
        reconciler.markFailed("j1", "out of memory");

        assertEquals(TransitionResult.APPLIED, reconciler.retry("j1"));

        Job job = load();
        assertEquals(JobStatus.PENDING, job.status());
        assertNull(job.errorMessage());
        assertEquals(0.0, job.progress());
        assertNull(job.assignedWorkerId());
        assertNull(job.startedAt());
        assertNull(job.completedAt());
        assertNull(job.result());
    }

    @Test
    void retryOfPendingOrRunningIsRejected() {
        assertEquals(TransitionResult.REJECTED, reconciler.retry("j1"));
        reconciler.markRunning("j1", "w-1");
        assertEquals(TransitionResult.REJECTED, reconciler.retry("j1"));
    }

    @Test
    void unknownJobReportsNotFound() {
        assertEquals(TransitionResult.NOT_FOUND, reconciler.markRunning("missing", "w-1"));
    }
}
