package gpuhub.coordinator.service;

import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.repository.JobRepository;
import gpuhub.coordinator.scheduler.JobSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Business logic for job submission and control on behalf of a user.
 * Enforces the per-user running-job limit before handing jobs to the
 * supervisor. The job type is not checked against the known routines here;
 * a job of an unknown type fails when it is scheduled.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_JOB_TYPE_LENGTH = 50;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;
    public static final int MAX_LIST_LIMIT = 500;

    private final JobRepository jobRepository;
    private final JobSupervisor supervisor;
    private final StateReconciler reconciler;
    private final CoordinatorConfig config;

    public JobService(JobRepository jobRepository, JobSupervisor supervisor, StateReconciler reconciler,
            CoordinatorConfig config) {
        this.jobRepository = jobRepository;
        this.supervisor = supervisor;
        this.reconciler = reconciler;
        this.config = config;
    }

    /**
     * Parameters of a new job.
     */
    public record NewJob(String title, String description, String jobType, Integer priority,
            Map<String, Object> config) {
    }

    /**
     * Edits to the descriptive fields of a job; a null component keeps the
     * current value.
     */
    public record JobUpdate(String title, String description, Integer priority, Map<String, Object> config) {
    }

    /**
     * Validate, persist as PENDING and hand over to the supervisor.
     *
     * @throws IllegalArgumentException           on invalid input
     * @throws ConcurrencyLimitExceededException if the user is at the running-job limit
     */
    public Job createJob(String userId, NewJob request) {
        requireUser(userId);
        validate(request);

        int running = jobRepository.countRunningForUser(userId);
        if (running >= config.maxRunningJobsPerUser()) {
            throw new ConcurrencyLimitExceededException(userId, config.maxRunningJobsPerUser());
        }

        Instant now = Instant.now();
        Job job = Job.builder()
                .id(jobRepository.generateId())
                .userId(userId)
                .title(request.title().trim())
                .description(request.description())
                .jobType(request.jobType())
                .priority(request.priority() != null ? request.priority() : MIN_PRIORITY)
                .config(request.config())
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        jobRepository.save(job);
        log.info("Created job {} ({}) for user {}", job.id(), job.jobType(), userId);

        supervisor.submit(job);
        return job;
    }

    /**
     * Find a job of the given user.
     */
    public Optional<Job> getJob(String jobId, String userId) {
        return jobRepository.findByIdAndUser(jobId, userId);
    }

    /**
     * Find a job regardless of owner.
     */
    public Optional<Job> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Jobs of a user, newest first.
     */
    public List<Job> listJobs(String userId, JobStatus status, int limit) {
        requireUser(userId);
        int bounded = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return jobRepository.findByUser(userId, status, bounded);
    }

    /**
     * Cancel a job of the user.
     *
     * @return the job as stored after the request (a running job may still
     *         show RUNNING until the routine observes the signal)
     * @throws NoSuchElementException if the job does not exist for this user
     * @throws IllegalStateException  if the job already finished
     */
    public Job cancelJob(String jobId, String userId) {
        Job job = require(jobId, userId);
        if (job.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + job.status());
        }

        boolean signalled = supervisor.cancel(jobId);
        log.info("Cancel requested for job {} by user {} (signalled={})", jobId, userId, signalled);
        return jobRepository.findById(jobId).orElse(job);
    }

    /**
     * Send a FAILED or CANCELLED job back to PENDING and resubmit it.
     *
     * @throws IllegalStateException if the job is not retryable
     */
    public Job retryJob(String jobId, String userId) {
        Job job = require(jobId, userId);
        if (!job.canRetry()) {
            throw new IllegalStateException("Job " + jobId + " cannot be retried from " + job.status());
        }

        TransitionResult result = reconciler.retry(jobId);
        if (result != TransitionResult.APPLIED) {
            throw new IllegalStateException("Job " + jobId + " changed state, retry not applied");
        }
        log.info("Job {} retried by user {}", jobId, userId);

        supervisor.submit(jobId);
        return jobRepository.findById(jobId).orElse(job);
    }

    /**
     * Change the title, description, priority or config of a job that is not
     * RUNNING or COMPLETED.
     *
     * @throws NoSuchElementException   if the job does not exist for this user
     * @throws IllegalArgumentException on invalid input
     * @throws IllegalStateException    if the job is RUNNING or COMPLETED
     */
    public Job updateJob(String jobId, String userId, JobUpdate update) {
        Job job = require(jobId, userId);
        validate(update);
        if (isLocked(job.status())) {
            throw new IllegalStateException("Job " + jobId + " is " + job.status() + " and cannot be updated");
        }

        Job edited = job.toBuilder()
                .title(update.title() != null ? update.title().trim() : job.title())
                .description(update.description() != null ? update.description() : job.description())
                .priority(update.priority() != null ? update.priority() : job.priority())
                .config(update.config() != null ? update.config() : job.config())
                .build();
        if (!jobRepository.updateDetails(edited)) {
            throw new IllegalStateException("Job " + jobId + " changed state, update not applied");
        }
        log.info("Updated job {} of user {}", jobId, userId);
        return jobRepository.findById(jobId).orElse(edited);
    }

    /**
     * Delete a job that is not running.
     *
     * @throws IllegalStateException if the job is RUNNING
     */
    public void deleteJob(String jobId, String userId) {
        Job job = require(jobId, userId);
        if (job.status() == JobStatus.RUNNING || supervisor.isActive(jobId)) {
            throw new IllegalStateException("Job " + jobId + " is running and cannot be deleted");
        }
        if (jobRepository.delete(jobId)) {
            log.info("Deleted job {} of user {}", jobId, userId);
        }
    }

    /**
     * Count jobs by status across all users.
     */
    public int countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    // --- Helpers ---

    private Job require(String jobId, String userId) {
        requireUser(userId);
        return jobRepository.findByIdAndUser(jobId, userId)
                .orElseThrow(() -> new NoSuchElementException("Job not found: " + jobId));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    private static boolean isLocked(JobStatus status) {
        return status == JobStatus.RUNNING || status == JobStatus.COMPLETED;
    }

    private static void validate(JobUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("request body is required");
        }
        if (update.title() != null && update.title().isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (update.title() != null && update.title().trim().length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (update.priority() != null
                && (update.priority() < MIN_PRIORITY || update.priority() > MAX_PRIORITY)) {
            throw new IllegalArgumentException(
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
    }

    private void validate(NewJob request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (request.title().trim().length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (request.jobType() == null || request.jobType().isBlank()) {
            throw new IllegalArgumentException("jobType is required");
        }
        if (request.jobType().length() > MAX_JOB_TYPE_LENGTH) {
            throw new IllegalArgumentException("jobType must be at most " + MAX_JOB_TYPE_LENGTH + " characters");
        }
        if (request.priority() != null
                && (request.priority() < MIN_PRIORITY || request.priority() > MAX_PRIORITY)) {
            throw new IllegalArgumentException(
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
    }
}
