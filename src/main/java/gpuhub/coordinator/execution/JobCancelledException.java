package gpuhub.coordinator.execution;

/**
 * Raised by a routine when it observes a cancellation request.
 */
public class JobCancelledException extends Exception {

    public JobCancelledException(String jobId) {
        super("Job cancelled: " + jobId);
    }
}
