package gpuhub.coordinator.execution;

/**
 * Receives progress percentages in [0, 100] from a running routine.
 */
@FunctionalInterface
public interface ProgressSink {

    void report(double percent);

    static ProgressSink noop() {
        return percent -> {
        };
    }
}
