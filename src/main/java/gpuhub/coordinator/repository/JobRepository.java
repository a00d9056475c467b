package gpuhub.coordinator.repository;

import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.TransitionResult;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Implementations can use JDBC or in-memory storage.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Find a job by ID, restricted to its owner.
     *
     * @param jobId  the job ID
     * @param userId the owning user
     * @return the job if found and owned by the user
     */
    Optional<Job> findByIdAndUser(String jobId, String userId);

    /**
     * Find jobs by status, highest priority first, then oldest first.
     *
     * @param status the status to filter by
     * @param limit  maximum number of results
     * @return list of jobs
     */
    List<Job> findByStatus(JobStatus status, int limit);

    /**
     * Find jobs of a user, newest first.
     *
     * @param userId the owning user
     * @param status optional status filter (null for all)
     * @param limit  maximum number of results
     * @return list of jobs
     */
    List<Job> findByUser(String userId, JobStatus status, int limit);

    /**
     * Count RUNNING jobs assigned to a worker.
     *
     * @param workerId the worker ID
     * @return number of running jobs
     */
    int countRunningOnWorker(String workerId);

    /**
     * Count RUNNING jobs owned by a user.
     *
     * @param userId the owning user
     * @return number of running jobs
     */
    int countRunningForUser(String userId);

    /**
     * Count jobs by status.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(JobStatus status);

    /**
     * Atomically apply a conditional partial update.
     * The update happens only if the current status is one of
     * {@link JobTransition#allowedFrom()}.
     *
     * @param jobId      the job ID
     * @param transition the transition to apply
     * @return APPLIED, REJECTED (status did not match) or NOT_FOUND
     */
    TransitionResult applyTransition(String jobId, JobTransition transition);

    /**
     * Overwrite the descriptive fields (title, description, priority, config)
     * of a job that is neither RUNNING nor COMPLETED. Lifecycle fields are
     * left untouched.
     *
     * @param job the job carrying the new values
     * @return true if updated, false if missing or in a locked status
     */
    boolean updateDetails(Job job);

    /**
     * Delete a job.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
