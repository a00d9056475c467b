package gpuhub.coordinator.model;

/**
 * Job lifecycle status.
 */
public enum JobStatus {
    /** Job persisted, waiting for a worker */
    PENDING,
    /** Job assigned to a worker and executing */
    RUNNING,
    /** Job finished successfully (progress is 100) */
    COMPLETED,
    /** Job execution raised an error */
    FAILED,
    /** Job cancelled by user */
    CANCELLED;

    /** Check if no further transition is allowed except retry */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Only failed or cancelled jobs can be sent back to PENDING */
    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }
}
