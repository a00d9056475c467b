package gpuhub.coordinator.model;

/**
 * Result of writing a job state transition.
 */
public enum TransitionResult {
    /** Transition was written */
    APPLIED,

    /** Job was not in an allowed source state - nothing written */
    REJECTED,

    /** Job not found */
    NOT_FOUND
}
