package gpuhub.coordinator.scheduler;

import gpuhub.coordinator.TestAwait;
import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.config.Dependencies;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Background sweeps wired through {@link Dependencies}.
 */
class SchedulerTest {

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-scheduler-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withBacklogRetryInterval(Duration.ofMillis(100))
                .withWorkerMonitorInterval(Duration.ofMillis(100))
                .withOrphanGracePeriod(Duration.ofMillis(200))
                .withStepDurations(Duration.ofMillis(5), Duration.ofMillis(5), Duration.ofMillis(5));
        deps = Dependencies.create(config, worker -> true);
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void backlogSweepPicksUpStoredPendingJob() {
        deps.workerRepository().save(Worker.builder().id("w-1").host("127.0.0.1").createdAt(Instant.now()).build());
        deps.jobRepository().save(Job.builder().id("job-1").userId("u").title("t").jobType("inference").build());

        deps.startScheduler();
        assertTrue(deps.scheduler().isRunning());

        TestAwait.until("stored job completed",
                () -> deps.jobRepository().findById("job-1").orElseThrow().status() == JobStatus.COMPLETED);
    }

    @Test
    void monitorMarksWorkersOnline() {
        deps.workerRepository().save(Worker.builder().id("w-1").host("127.0.0.1").createdAt(Instant.now()).build());

        deps.startScheduler();

        TestAwait.until("worker online",
                () -> deps.workerRepository().findById("w-1").orElseThrow().status() == WorkerStatus.ONLINE);
    }

    @Test
    void reaperFailsOrphanedJob() {
        deps.jobRepository().save(Job.builder().id("job-1").userId("u").title("t").jobType("training").build());
        deps.jobRepository().applyTransition("job-1", JobTransition.running("w-gone", Instant.now().minusSeconds(60)));

        deps.startScheduler();

        TestAwait.until("orphan reaped",
                () -> deps.jobRepository().findById("job-1").orElseThrow().status() == JobStatus.FAILED);
        assertEquals(JobReaper.INTERRUPTED_MESSAGE, deps.jobRepository().findById("job-1").orElseThrow().errorMessage());
    }

    @Test
    void stopIsIdempotent() {
        deps.startScheduler();
        deps.stopScheduler();
        deps.stopScheduler();
        assertFalse(deps.scheduler().isRunning());
    }
}
