package gpuhub.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobTransitionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void runningRequiresPendingAndSetsWorker() {
        JobTransition t = JobTransition.running("worker-1", NOW);

        assertEquals(Set.of(JobStatus.PENDING), t.allowedFrom());
        assertEquals(JobStatus.RUNNING, t.targetStatus());
        assertEquals("worker-1", t.fields().get(JobTransition.Field.ASSIGNED_WORKER_ID));
        assertEquals(NOW, t.fields().get(JobTransition.Field.STARTED_AT));
    }

    @Test
    void progressIsClampedAndProgressOnly() {
        assertEquals(100.0, JobTransition.progress(150).fields().get(JobTransition.Field.PROGRESS));
        assertEquals(0.0, JobTransition.progress(-5).fields().get(JobTransition.Field.PROGRESS));

        JobTransition t = JobTransition.progress(30);
        assertTrue(t.isProgressOnly());
        assertEquals(Set.of(JobStatus.RUNNING), t.allowedFrom());
    }

    @Test
    void completedSetsFullProgressAndClearsError() {
        JobTransition t = JobTransition.completed(Map.of("loss", 0.1), NOW);

        assertEquals(100.0, t.fields().get(JobTransition.Field.PROGRESS));
        assertTrue(t.fields().containsKey(JobTransition.Field.ERROR_MESSAGE));
        assertNull(t.fields().get(JobTransition.Field.ERROR_MESSAGE));
        assertEquals(Map.of("loss", 0.1), t.fields().get(JobTransition.Field.RESULT));
    }

    @Test
    void failedNeverStoresEmptyMessage() {
        assertEquals("unknown error", JobTransition.failed("  ", NOW).fields().get(JobTransition.Field.ERROR_MESSAGE));
        assertEquals("boom", JobTransition.failed("boom", NOW).fields().get(JobTransition.Field.ERROR_MESSAGE));
    }

    @Test
    void cancelledReleasesWorker() {
        JobTransition t = JobTransition.cancelled(NOW);

        assertEquals(Set.of(JobStatus.PENDING, JobStatus.RUNNING), t.allowedFrom());
        assertTrue(t.fields().containsKey(JobTransition.Field.ASSIGNED_WORKER_ID));
        assertNull(t.fields().get(JobTransition.Field.ASSIGNED_WORKER_ID));
        assertNull(t.fields().get(JobTransition.Field.ERROR_MESSAGE));
        assertFalse(t.leavesTerminalState());
    }

    @Test
    void retryClearsEveryRunField() {
        JobTransition t = JobTransition.retry();

        assertTrue(t.isRetry());
        assertTrue(t.leavesTerminalState());
        assertEquals(JobStatus.PENDING, t.targetStatus());
        assertEquals(0.0, t.fields().get(JobTransition.Field.PROGRESS));
        for (JobTransition.Field field : new JobTransition.Field[] {
                JobTransition.Field.ASSIGNED_WORKER_ID, JobTransition.Field.STARTED_AT,
                JobTransition.Field.COMPLETED_AT, JobTransition.Field.RESULT, JobTransition.Field.ERROR_MESSAGE }) {
            assertTrue(t.fields().containsKey(field), field.name());
            assertNull(t.fields().get(field), field.name());
        }
    }

    @Test
    void sourceStatusIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> JobTransition.builder().to(JobStatus.FAILED).build());
    }
}
