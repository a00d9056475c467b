package gpuhub.coordinator.probe;

import gpuhub.coordinator.model.Worker;

/**
 * Reachability check for a worker node.
 * Implementations never throw: an unreachable or slow worker is reported as
 * {@code false}. Probing does not write worker status.
 */
@FunctionalInterface
public interface AvailabilityProber {

    /**
     * @param worker the worker to check
     * @return true if the worker answered within the deadline
     */
    boolean probe(Worker worker);
}
