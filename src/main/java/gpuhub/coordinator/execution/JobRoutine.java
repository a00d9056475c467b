package gpuhub.coordinator.execution;

import java.util.Map;

/**
 * The executable unit behind a job type.
 * A routine must check the cancellation signal at every step boundary.
 */
@FunctionalInterface
public interface JobRoutine {

    /**
     * Run the job to completion.
     *
     * @param context job, worker, signal and progress sink
     * @return result map stored on the completed job
     * @throws JobExecutionException on any failure
     * @throws JobCancelledException when the signal was observed
     */
    Map<String, Object> run(JobContext context) throws JobExecutionException, JobCancelledException;
}
