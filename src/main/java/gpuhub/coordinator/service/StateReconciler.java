package gpuhub.coordinator.service;

import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Sole writer of job lifecycle state.
 *
 * <p>Each write is a conditional update against the job's current status, so
 * a terminal record is never overwritten. Rejected writes are logged and
 * reported, never thrown.
 */
public class StateReconciler {

    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    private final JobRepository jobRepository;

    public StateReconciler(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    public TransitionResult writeTransition(String jobId, JobTransition transition) {
        if (transition.leavesTerminalState() && !transition.isRetry()) {
            log.warn("Refusing to move job {} out of a terminal state: {}", jobId, transition);
            return TransitionResult.REJECTED;
        }

        TransitionResult result = jobRepository.applyTransition(jobId, transition);
        switch (result) {
            case APPLIED -> {
                if (!transition.isProgressOnly()) {
                    log.info("Job {} -> {}", jobId, transition.targetStatus());
                }
            }
            case REJECTED -> log.warn("Transition rejected for job {}: {}", jobId, transition);
            case NOT_FOUND -> log.warn("Transition for unknown job {}: {}", jobId, transition);
        }
        return result;
    }

    public TransitionResult markRunning(String jobId, String workerId) {
        return writeTransition(jobId, JobTransition.running(workerId, Instant.now()));
    }

    public TransitionResult recordProgress(String jobId, double percent) {
        return writeTransition(jobId, JobTransition.progress(percent));
    }

    public TransitionResult markCompleted(String jobId, Map<String, Object> result) {
        return writeTransition(jobId, JobTransition.completed(result, Instant.now()));
    }

    public TransitionResult markFailed(String jobId, String errorMessage) {
        return writeTransition(jobId, JobTransition.failed(errorMessage, Instant.now()));
    }

    /** A PENDING job that can never be executed, e.g. an unknown job type */
    public TransitionResult markRejected(String jobId, String errorMessage) {
        return writeTransition(jobId, JobTransition.rejected(errorMessage, Instant.now()));
    }

    public TransitionResult markCancelled(String jobId) {
        return writeTransition(jobId, JobTransition.cancelled(Instant.now()));
    }

    /** Only applies while the job is still PENDING; an executing job is cancelled through its signal */
    public TransitionResult markPendingCancelled(String jobId) {
        return writeTransition(jobId, JobTransition.cancelledPending(Instant.now()));
    }

    public TransitionResult retry(String jobId) {
        return writeTransition(jobId, JobTransition.retry());
    }
}
