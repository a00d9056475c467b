package gpuhub.coordinator.scheduler;

import gpuhub.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - backlog sweep: resubmits PENDING jobs that found no worker
 * - worker monitor: probes every active worker
 * - JobReaper: fails RUNNING jobs nobody is executing
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobSupervisor supervisor;
    private final JobReaper jobReaper;
    private final Runnable workerMonitor;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    /**
     * @param supervisor    owner of the backlog sweep
     * @param jobReaper     orphan reaper
     * @param workerMonitor runnable probing all workers (typically
     *                      WorkerService::monitorAll)
     * @param config        configuration
     */
    public Scheduler(JobSupervisor supervisor, JobReaper jobReaper, Runnable workerMonitor,
            CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gpuhub-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.supervisor = supervisor;
        this.jobReaper = jobReaper;
        this.workerMonitor = workerMonitor;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long backlogMs = config.backlogRetryInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("backlog-sweep", supervisor::scheduleBacklog),
                0,
                backlogMs,
                TimeUnit.MILLISECONDS);
        log.info("Backlog sweep scheduled every {}ms", backlogMs);

        long reaperMs = config.orphanGracePeriod().toMillis();
        executor.scheduleWithFixedDelay(
                jobReaper,
                reaperMs,
                reaperMs,
                TimeUnit.MILLISECONDS);
        log.info("Job reaper scheduled every {}ms", reaperMs);

        long monitorMs = config.workerMonitorInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("worker-monitor", workerMonitor),
                monitorMs,
                monitorMs,
                TimeUnit.MILLISECONDS);
        log.info("Worker monitor scheduled every {}ms", monitorMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
