package gpuhub.coordinator.scheduler;

import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.execution.CancellationSignal;
import gpuhub.coordinator.execution.ExecutionEngine;
import gpuhub.coordinator.execution.JobCancelledException;
import gpuhub.coordinator.execution.JobExecutionException;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.repository.JobRepository;
import gpuhub.coordinator.service.Allocator;
import gpuhub.coordinator.service.StateReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the jobs executing in this process.
 *
 * <p>A submitted job is scheduled asynchronously: allocate a worker, write
 * RUNNING, execute the routine and write the terminal outcome. Allocation
 * and the RUNNING write happen under one admission lock, so a worker is
 * never handed more jobs than it has free slots by this supervisor. A job id
 * is scheduled by at most one unit at a time, so a job never has two
 * handles. Jobs that find no worker stay PENDING and are picked up again by
 * {@link #scheduleBacklog()}.
 */
public class JobSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobSupervisor.class);

    private static final int BACKLOG_BATCH = 500;

    private final JobRepository jobRepository;
    private final Allocator allocator;
    private final ExecutionEngine engine;
    private final StateReconciler reconciler;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;

    private final Map<String, ActiveJobHandle> handles = new ConcurrentHashMap<>();
    // job ids between submit and the end of their unit
    private final Set<String> scheduled = ConcurrentHashMap.newKeySet();
    private final Object admissionLock = new Object();

    private volatile boolean shuttingDown = false;

    public JobSupervisor(JobRepository jobRepository, Allocator allocator, ExecutionEngine engine,
            StateReconciler reconciler, CoordinatorConfig config) {
        this(jobRepository, allocator, engine, reconciler, config.executorThreads(), config.shutdownTimeout());
    }

    public JobSupervisor(JobRepository jobRepository, Allocator allocator, ExecutionEngine engine,
            StateReconciler reconciler, int threads, Duration shutdownTimeout) {
        this.jobRepository = jobRepository;
        this.allocator = allocator;
        this.engine = engine;
        this.reconciler = reconciler;
        this.shutdownTimeout = shutdownTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "gpuhub-job-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a PENDING job. Returns immediately; nothing is written here.
     */
    public void submit(Job job) {
        submit(job.id());
    }

    public void submit(String jobId) {
        if (shuttingDown) {
            log.debug("Supervisor shutting down, not scheduling job {}", jobId);
            return;
        }
        if (!scheduled.add(jobId)) {
            log.debug("Job {} is already scheduled", jobId);
            return;
        }
        try {
            executor.execute(() -> runUnit(jobId));
        } catch (RejectedExecutionException e) {
            scheduled.remove(jobId);
            log.warn("Could not schedule job {}: executor is shut down", jobId);
        }
    }

    /**
     * Request cancellation.
     *
     * @return true if the job was executing and its signal was raised; false
     *         otherwise (a PENDING job is cancelled directly)
     */
    public boolean cancel(String jobId) {
        ActiveJobHandle handle = handles.get(jobId);
        if (handle != null) {
            handle.signal().cancel();
            log.info("Cancellation requested for running job {}", jobId);
            return true;
        }

        Optional<Job> job = jobRepository.findById(jobId);
        if (job.isPresent() && job.get().status() == JobStatus.PENDING
                && reconciler.markPendingCancelled(jobId) == TransitionResult.APPLIED) {
            return false;
        }

        // admitted between the handle lookup and the status read
        ActiveJobHandle admitted = handles.get(jobId);
        if (admitted != null) {
            admitted.signal().cancel();
            log.info("Cancellation requested for job {} admitted during cancel", jobId);
            return true;
        }
        return false;
    }

    /** Snapshot of the ids of jobs executing right now */
    public Set<String> activeJobIds() {
        return Set.copyOf(handles.keySet());
    }

    public Optional<ActiveJobHandle> handle(String jobId) {
        return Optional.ofNullable(handles.get(jobId));
    }

    public boolean isActive(String jobId) {
        return handles.containsKey(jobId);
    }

    /**
     * Admit PENDING jobs one at a time, highest priority first, until no
     * worker has a free slot.
     */
    public void scheduleBacklog() {
        if (shuttingDown) {
            return;
        }
        List<Job> pending = jobRepository.findByStatus(JobStatus.PENDING, BACKLOG_BATCH);
        if (!pending.isEmpty()) {
            log.debug("Backlog sweep: {} pending job(s)", pending.size());
        }
        for (Job job : pending) {
            if (shuttingDown) {
                return;
            }
            String jobId = job.id();
            if (!scheduled.add(jobId)) {
                continue;
            }
            Admission admission;
            try {
                admission = admit(jobId);
            } catch (RuntimeException e) {
                scheduled.remove(jobId);
                throw e;
            }
            if (admission.outcome() == Outcome.STARTED) {
                dispatch(admission);
                continue;
            }
            scheduled.remove(jobId);
            if (admission.outcome() == Outcome.NO_WORKER) {
                log.debug("Backlog sweep stopped at job {}: no free worker", jobId);
                return;
            }
        }
    }

    /**
     * Cancel every executing job and wait for all units to unwind.
     */
    public void shutdown() {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;
        log.info("Supervisor shutting down, {} active job(s)", handles.size());

        for (ActiveJobHandle handle : handles.values()) {
            handle.signal().cancel();
        }

        CompletableFuture<?>[] completions = handles.values().stream()
                .map(ActiveJobHandle::completion)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(completions).get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Active jobs did not unwind within {}", shutdownTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Active job ended abnormally during shutdown", e);
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Supervisor forcefully stopped");
            } else {
                log.info("Supervisor stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    // --- Scheduling unit ---

    private enum Outcome {
        STARTED,
        NO_WORKER,
        SKIPPED
    }

    private record Admission(Outcome outcome, Job job, Worker worker, ActiveJobHandle handle) {

        static Admission of(Outcome outcome) {
            return new Admission(outcome, null, null, null);
        }
    }

    private void runUnit(String jobId) {
        Admission admission;
        try {
            admission = admit(jobId);
        } catch (RuntimeException e) {
            log.error("Scheduling of job {} failed", jobId, e);
            scheduled.remove(jobId);
            return;
        }
        if (admission.outcome() != Outcome.STARTED) {
            scheduled.remove(jobId);
            return;
        }
        runAdmitted(admission);
    }

    /**
     * Allocate a worker, register the handle and write RUNNING. Admissions
     * are serialised so two jobs never claim the same free slot.
     */
    private Admission admit(String jobId) {
        synchronized (admissionLock) {
            if (shuttingDown) {
                return Admission.of(Outcome.SKIPPED);
            }
            Optional<Job> found = jobRepository.findById(jobId);
            if (found.isEmpty() || found.get().status() != JobStatus.PENDING) {
                log.debug("Job {} is no longer pending, skipping", jobId);
                return Admission.of(Outcome.SKIPPED);
            }
            Job job = found.get();

            if (!engine.supports(job.jobType())) {
                reconciler.markRejected(jobId, "Unsupported job type: " + job.jobType());
                return Admission.of(Outcome.SKIPPED);
            }

            Optional<Worker> allocated = allocator.selectWorker();
            if (allocated.isEmpty()) {
                log.info("No worker available for job {}, keeping it pending", jobId);
                return Admission.of(Outcome.NO_WORKER);
            }
            Worker worker = allocated.get();

            ActiveJobHandle handle = new ActiveJobHandle(jobId, worker.id(),
                    new CancellationSignal(jobId), Instant.now(), new CompletableFuture<>());
            handles.put(jobId, handle);
            if (shuttingDown || reconciler.markRunning(jobId, worker.id()) != TransitionResult.APPLIED) {
                // cancelled, deleted or shutting down while allocating
                release(handle);
                return Admission.of(Outcome.SKIPPED);
            }
            log.info("Job {} started on worker {}", jobId, worker.id());

            Job running = job.toBuilder()
                    .status(JobStatus.RUNNING)
                    .assignedWorkerId(worker.id())
                    .build();
            return new Admission(Outcome.STARTED, running, worker, handle);
        }
    }

    private void dispatch(Admission admission) {
        String jobId = admission.job().id();
        try {
            executor.execute(() -> runAdmitted(admission));
        } catch (RejectedExecutionException e) {
            log.warn("Could not execute job {}: executor is shut down", jobId);
            try {
                writeTerminal(() -> reconciler.markCancelled(jobId));
            } finally {
                release(admission.handle());
                scheduled.remove(jobId);
            }
        }
    }

    private void runAdmitted(Admission admission) {
        String jobId = admission.job().id();
        try {
            execute(admission.job(), admission.worker(), admission.handle().signal());
        } catch (RuntimeException e) {
            log.error("Terminal write for job {} failed", jobId, e);
        } finally {
            release(admission.handle());
            scheduled.remove(jobId);
        }
        // a slot was freed
        try {
            scheduleBacklog();
        } catch (RuntimeException e) {
            log.error("Backlog sweep after job {} failed", jobId, e);
        }
    }

    private void release(ActiveJobHandle handle) {
        handles.remove(handle.jobId(), handle);
        handle.completion().complete(null);
    }

    private void execute(Job job, Worker worker, CancellationSignal signal) {
        String jobId = job.id();
        try {
            Map<String, Object> result = engine.run(job, worker, signal,
                    percent -> reconciler.recordProgress(jobId, percent));
            writeTerminal(() -> reconciler.markCompleted(jobId, result));
            log.info("Job {} completed", jobId);
        } catch (JobCancelledException e) {
            writeTerminal(() -> reconciler.markCancelled(jobId));
            log.info("Job {} cancelled", jobId);
        } catch (JobExecutionException e) {
            writeTerminal(() -> reconciler.markFailed(jobId, e.getMessage()));
            log.warn("Job {} failed: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while executing job {}", jobId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            writeTerminal(() -> reconciler.markFailed(jobId, message));
        }
    }

    /**
     * Run a terminal write with the interrupt flag cleared, so the pool can
     * hand out a connection, and restore the flag afterwards.
     */
    private static void writeTerminal(Runnable write) {
        boolean interrupted = Thread.interrupted();
        try {
            write.run();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
