package gpuhub.coordinator.scheduler;

import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.repository.JobRepository;
import gpuhub.coordinator.service.StateReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that fails orphaned RUNNING jobs.
 *
 * A job is orphaned when the store says RUNNING but no unit in this process
 * is executing it, e.g. after a crash between the RUNNING write and the end
 * of execution. Jobs younger than the grace period are left alone so that a
 * unit which has just written RUNNING is not reaped.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    static final String INTERRUPTED_MESSAGE = "Job interrupted: execution was lost by the coordinator";
    private static final int BATCH = 500;

    private final JobRepository jobRepository;
    private final JobSupervisor supervisor;
    private final StateReconciler reconciler;
    private final Duration gracePeriod;

    public JobReaper(JobRepository jobRepository, JobSupervisor supervisor, StateReconciler reconciler,
            CoordinatorConfig config) {
        this(jobRepository, supervisor, reconciler, config.orphanGracePeriod());
    }

    public JobReaper(JobRepository jobRepository, JobSupervisor supervisor, StateReconciler reconciler,
            Duration gracePeriod) {
        this.jobRepository = jobRepository;
        this.supervisor = supervisor;
        this.reconciler = reconciler;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public void run() {
        try {
            reapOrphans();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * Fail RUNNING jobs that have no active handle.
     *
     * @return number of jobs failed
     */
    public int reapOrphans() {
        Instant cutoff = Instant.now().minus(gracePeriod);
        List<Job> running = jobRepository.findByStatus(JobStatus.RUNNING, BATCH);

        int reaped = 0;
        for (Job job : running) {
            if (supervisor.isActive(job.id())) {
                continue;
            }
            if (job.startedAt() != null && job.startedAt().isAfter(cutoff)) {
                continue;
            }
            try {
                if (reconciler.markFailed(job.id(), INTERRUPTED_MESSAGE) == TransitionResult.APPLIED) {
                    reaped++;
                    log.warn("Reaped orphaned job {} (started {}, worker {})",
                            job.id(), job.startedAt(), job.assignedWorkerId());
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        if (reaped > 0) {
            log.info("Job reaper: {} orphaned job(s) failed", reaped);
        } else {
            log.debug("No orphaned jobs found");
        }
        return reaped;
    }
}
