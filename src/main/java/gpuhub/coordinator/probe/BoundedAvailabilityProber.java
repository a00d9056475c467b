package gpuhub.coordinator.probe;

import gpuhub.coordinator.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorates a prober with a hard deadline.
 * The delegate runs on a dedicated daemon pool; a probe that does not answer
 * in time is abandoned and reported as unreachable.
 */
public final class BoundedAvailabilityProber implements AvailabilityProber, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedAvailabilityProber.class);

    private final AvailabilityProber delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public BoundedAvailabilityProber(AvailabilityProber delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gpuhub-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean probe(Worker worker) {
        Future<Boolean> future;
        try {
            future = executor.submit(() -> delegate.probe(worker));
        } catch (RuntimeException e) {
            log.warn("Could not start probe of worker {}: {}", worker.id(), e.getMessage());
            return false;
        }

        try {
            return Boolean.TRUE.equals(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Probe of worker {} timed out after {} ms", worker.id(), timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("Probe of worker {} failed: {}", worker.id(), e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
