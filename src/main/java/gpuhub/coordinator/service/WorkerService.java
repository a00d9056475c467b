package gpuhub.coordinator.service;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import gpuhub.coordinator.probe.AvailabilityProber;
import gpuhub.coordinator.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service layer for worker node administration.
 * Handles registration, reachability checks and maintenance windows.
 */
public class WorkerService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private static final int MONITOR_THREADS = 8;

    private final WorkerRepository workerRepository;
    private final ResourceRegistry registry;
    private final AvailabilityProber prober;
    private final ExecutorService probeExecutor;
    private final ScheduledExecutorService maintenanceTimer;
    private final Map<String, ScheduledFuture<?>> maintenanceWindows = new ConcurrentHashMap<>();

    public WorkerService(WorkerRepository workerRepository, ResourceRegistry registry, AvailabilityProber prober) {
        this.workerRepository = workerRepository;
        this.registry = registry;
        this.prober = prober;
        AtomicInteger counter = new AtomicInteger();
        this.probeExecutor = Executors.newFixedThreadPool(MONITOR_THREADS, r -> {
            Thread t = new Thread(r, "gpuhub-monitor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.maintenanceTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gpuhub-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parameters of a worker registration.
     */
    public record NewWorker(String name, String host, Integer port, Integer gpuCount, String gpuModel) {
    }

    /**
     * Register a new worker. It starts OFFLINE until the first probe.
     */
    public Worker registerWorker(NewWorker request) {
        if (request == null || request.host() == null || request.host().isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        int port = request.port() != null ? request.port() : 22;
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        int gpuCount = request.gpuCount() != null ? request.gpuCount() : 1;
        if (gpuCount < 1) {
            throw new IllegalArgumentException("gpuCount must be at least 1");
        }

        String id = workerRepository.generateId();
        Worker worker = Worker.builder()
                .id(id)
                .name(request.name() != null && !request.name().isBlank() ? request.name() : request.host())
                .host(request.host().trim())
                .port(port)
                .gpuCount(gpuCount)
                .gpuModel(request.gpuModel())
                .status(WorkerStatus.OFFLINE)
                .active(true)
                .createdAt(Instant.now())
                .build();

        workerRepository.save(worker);
        log.info("Registered worker {} at {}:{} with {} GPU(s)", id, worker.host(), port, gpuCount);
        return worker;
    }

    public Optional<Worker> findById(String workerId) {
        return workerRepository.findById(workerId);
    }

    public List<Worker> findAll() {
        return workerRepository.findAll();
    }

    /**
     * Number of jobs currently running on the worker.
     */
    public int runningJobs(String workerId) {
        return registry.occupancy(workerId);
    }

    public Worker setActive(String workerId, boolean active) {
        require(workerId);
        workerRepository.setActive(workerId, active);
        log.info("Worker {} {}", workerId, active ? "enabled" : "disabled");
        return require(workerId);
    }

    /**
     * Remove a worker that runs no jobs.
     *
     * @throws IllegalStateException if jobs are still running on it
     */
    public void deleteWorker(String workerId) {
        require(workerId);
        int running = registry.occupancy(workerId);
        if (running > 0) {
            throw new IllegalStateException("Worker " + workerId + " still runs " + running + " job(s)");
        }
        cancelMaintenanceWindow(workerId);
        workerRepository.delete(workerId);
        log.info("Deleted worker {}", workerId);
    }

    /**
     * Probe one worker and persist the outcome.
     *
     * @return true if the worker is reachable
     */
    public boolean ping(String workerId) {
        return probeAndRecord(require(workerId));
    }

    /**
     * Probe every active worker concurrently. Workers in maintenance keep
     * their status until the window ends.
     *
     * @return number of reachable workers
     */
    public int monitorAll() {
        List<Worker> workers = workerRepository.findActive();
        if (workers.isEmpty()) {
            log.debug("No workers to monitor");
            return 0;
        }

        List<CompletableFuture<Boolean>> probes = workers.stream()
                .filter(w -> !w.inMaintenance())
                .map(w -> CompletableFuture.supplyAsync(() -> probeAndRecord(w), probeExecutor)
                        .exceptionally(e -> {
                            log.error("Monitoring of worker {} failed", w.id(), e);
                            return false;
                        }))
                .toList();

        int online = (int) probes.stream().filter(CompletableFuture::join).count();
        log.info("Worker monitor: {}/{} online", online, probes.size());
        return online;
    }

    /**
     * Put a worker into MAINTENANCE for the given window, then back ONLINE.
     * A new window replaces a pending one.
     */
    public Worker scheduleMaintenance(String workerId, Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("maintenance window must be positive");
        }
        require(workerId);

        workerRepository.updateStatus(workerId, WorkerStatus.MAINTENANCE, null);
        cancelMaintenanceWindow(workerId);
        ScheduledFuture<?> end = maintenanceTimer.schedule(() -> endMaintenance(workerId),
                window.toMillis(), TimeUnit.MILLISECONDS);
        maintenanceWindows.put(workerId, end);

        log.info("Worker {} in maintenance for {}", workerId, window);
        return require(workerId);
    }

    @Override
    public void close() {
        maintenanceTimer.shutdownNow();
        probeExecutor.shutdownNow();
    }

    // --- Helpers ---

    private void endMaintenance(String workerId) {
        maintenanceWindows.remove(workerId);
        try {
            Optional<Worker> worker = workerRepository.findById(workerId);
            if (worker.isPresent() && worker.get().inMaintenance()) {
                workerRepository.updateStatus(workerId, WorkerStatus.ONLINE, null);
                log.info("Maintenance of worker {} finished", workerId);
            }
        } catch (Exception e) {
            log.error("Failed to end maintenance of worker {}", workerId, e);
        }
    }

    private void cancelMaintenanceWindow(String workerId) {
        ScheduledFuture<?> previous = maintenanceWindows.remove(workerId);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private boolean probeAndRecord(Worker worker) {
        boolean reachable = prober.probe(worker);
        WorkerStatus status = worker.inMaintenance() ? WorkerStatus.MAINTENANCE
                : reachable ? WorkerStatus.ONLINE : WorkerStatus.OFFLINE;
        workerRepository.updateStatus(worker.id(), status, Instant.now());
        if (!reachable) {
            log.warn("Worker {} ({}:{}) is unreachable", worker.id(), worker.host(), worker.port());
        }
        return reachable;
    }

    private Worker require(String workerId) {
        return workerRepository.findById(workerId)
                .orElseThrow(() -> new NoSuchElementException("Worker not found: " + workerId));
    }
}
