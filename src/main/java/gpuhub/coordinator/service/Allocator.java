package gpuhub.coordinator.service;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import gpuhub.coordinator.probe.AvailabilityProber;
import gpuhub.coordinator.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * First-fit worker selection in registration order.
 *
 * <p>Workers in maintenance are skipped. A full worker is skipped without
 * being probed. Every probe result is persisted as ONLINE or OFFLINE.
 * The occupancy read and the subsequent decision are not serialized here;
 * {@code JobSupervisor} holds its admission lock across selection and the
 * RUNNING write.
 */
public class Allocator {

    private static final Logger log = LoggerFactory.getLogger(Allocator.class);

    private final ResourceRegistry registry;
    private final AvailabilityProber prober;
    private final WorkerRepository workerRepository;

    public Allocator(ResourceRegistry registry, AvailabilityProber prober, WorkerRepository workerRepository) {
        this.registry = registry;
        this.prober = prober;
        this.workerRepository = workerRepository;
    }

    /**
     * Pick a worker for one job.
     *
     * @return the first reachable worker with a free slot, or empty if none
     */
    public Optional<Worker> selectWorker() {
        for (Worker worker : registry.listActiveWorkers()) {
            if (worker.inMaintenance()) {
                continue;
            }

            int running = registry.occupancy(worker.id());
            if (running >= worker.gpuCount()) {
                log.debug("Worker {} is full ({}/{})", worker.id(), running, worker.gpuCount());
                continue;
            }

            boolean reachable = prober.probe(worker);
            WorkerStatus status = reachable ? WorkerStatus.ONLINE : WorkerStatus.OFFLINE;
            workerRepository.updateStatus(worker.id(), status, Instant.now());

            if (reachable) {
                log.debug("Allocated worker {} ({}/{} slots busy)", worker.id(), running, worker.gpuCount());
                return Optional.of(worker.toBuilder().status(status).build());
            }
            log.warn("Worker {} ({}:{}) is unreachable", worker.id(), worker.host(), worker.port());
        }
        return Optional.empty();
    }
}
