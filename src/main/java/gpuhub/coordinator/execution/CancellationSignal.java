package gpuhub.coordinator.execution;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation token shared between the supervisor and a running
 * routine. Raising it is idempotent. Routines wait on it instead of sleeping,
 * so a raised signal ends the current step immediately.
 */
public final class CancellationSignal {

    private final String jobId;
    private final CountDownLatch latch = new CountDownLatch(1);

    public CancellationSignal(String jobId) {
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public void throwIfCancelled() throws JobCancelledException {
        if (isCancelled()) {
            throw new JobCancelledException(jobId);
        }
    }

    /**
     * Wait for the given duration unless cancelled first.
     * An interrupt of the waiting thread counts as cancellation.
     *
     * @throws JobCancelledException if the signal was raised before or during the wait
     */
    public void pause(Duration duration) throws JobCancelledException {
        try {
            if (latch.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new JobCancelledException(jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new JobCancelledException(jobId);
        }
    }
}
