package gpuhub.coordinator.scheduler;

import gpuhub.coordinator.execution.CancellationSignal;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory record of a job whose routine is executing in this process.
 * {@code completion} finishes once the unit has written its terminal state
 * and the handle has been removed.
 */
public record ActiveJobHandle(
        String jobId,
        String workerId,
        CancellationSignal signal,
        Instant startedAt,
        CompletableFuture<Void> completion) {
}
