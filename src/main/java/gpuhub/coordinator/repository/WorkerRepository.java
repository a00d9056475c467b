package gpuhub.coordinator.repository;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker node persistence.
 */
public interface WorkerRepository {

    /**
     * Register a new worker or replace an existing one.
     *
     * @param worker the worker to save
     */
    void save(Worker worker);

    /**
     * Find a worker by ID.
     *
     * @param workerId the worker ID
     * @return the worker if found
     */
    Optional<Worker> findById(String workerId);

    /**
     * Get all workers in registration order.
     *
     * @return list of all workers
     */
    List<Worker> findAll();

    /**
     * Get administratively enabled workers in registration order
     * (created_at, then id).
     *
     * @return list of active workers
     */
    List<Worker> findActive();

    /**
     * Record a status change, e.g. after a probe.
     *
     * @param workerId     the worker ID
     * @param status       the new status
     * @param lastProbedAt probe timestamp, or null to keep the previous one
     * @return true if updated
     */
    boolean updateStatus(String workerId, WorkerStatus status, Instant lastProbedAt);

    /**
     * Enable or disable a worker.
     *
     * @param workerId the worker ID
     * @param active   the new flag
     * @return true if updated
     */
    boolean setActive(String workerId, boolean active);

    /**
     * Delete a worker.
     *
     * @param workerId the worker ID
     * @return true if deleted
     */
    boolean delete(String workerId);

    /**
     * Get count of workers by status.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(WorkerStatus status);

    /**
     * Generate a new unique worker ID.
     *
     * @return unique ID
     */
    String generateId();
}
