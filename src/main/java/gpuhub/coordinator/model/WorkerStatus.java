package gpuhub.coordinator.model;

/**
 * Worker node status.
 */
public enum WorkerStatus {
    /** Last probe reached the worker */
    ONLINE,
    /** Last probe failed or worker never probed */
    OFFLINE,
    /** Worker reported as saturated by administration */
    BUSY,
    /** Worker taken out of rotation for a maintenance window */
    MAINTENANCE
}
