package gpuhub.coordinator.execution;

import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs a job's routine on its assigned worker.
 * Every failure surfaces as {@link JobExecutionException} or
 * {@link JobCancelledException}; nothing else escapes.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final RoutineRegistry routines;

    public ExecutionEngine(RoutineRegistry routines) {
        this.routines = routines;
    }

    public boolean supports(String jobType) {
        return routines.supports(jobType);
    }

    public Map<String, Object> run(Job job, Worker worker, CancellationSignal signal, ProgressSink progress)
            throws JobExecutionException, JobCancelledException {

        JobRoutine routine = routines.find(job.jobType())
                .orElseThrow(() -> new JobExecutionException("Unsupported job type: " + job.jobType()));

        log.info("Executing job {} ({}) on worker {}", job.id(), job.jobType(), worker.id());
        try {
            Map<String, Object> result = routine.run(new JobContext(job, worker, signal, progress));
            return result == null ? Map.of() : result;
        } catch (JobExecutionException | JobCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new JobExecutionException(message, e);
        }
    }
}
