package gpuhub.coordinator.execution;

/**
 * Any failure of a job routine. The message is stored verbatim as the job's
 * error message.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
