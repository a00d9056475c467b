package gpuhub.coordinator.service;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.repository.JobRepository;
import gpuhub.coordinator.repository.WorkerRepository;

import java.util.List;

/**
 * Read-only view of the worker pool.
 * Occupancy is always read from the store, never cached.
 */
public class ResourceRegistry {

    private final WorkerRepository workerRepository;
    private final JobRepository jobRepository;

    public ResourceRegistry(WorkerRepository workerRepository, JobRepository jobRepository) {
        this.workerRepository = workerRepository;
        this.jobRepository = jobRepository;
    }

    /**
     * Active workers in registration order.
     */
    public List<Worker> listActiveWorkers() {
        return workerRepository.findActive();
    }

    /**
     * Number of RUNNING jobs currently assigned to the worker.
     */
    public int occupancy(String workerId) {
        return jobRepository.countRunningOnWorker(workerId);
    }
}
