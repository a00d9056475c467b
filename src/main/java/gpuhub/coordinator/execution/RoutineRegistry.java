package gpuhub.coordinator.execution;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a job type tag to the routine that executes it.
 */
public final class RoutineRegistry {

    public static final String TRAINING = "training";
    public static final String INFERENCE = "inference";
    public static final String DATA_PROCESSING = "data_processing";

    private final Map<String, JobRoutine> routines = new ConcurrentHashMap<>();

    public RoutineRegistry register(String jobType, JobRoutine routine) {
        routines.put(jobType, routine);
        return this;
    }

    public Optional<JobRoutine> find(String jobType) {
        return jobType == null ? Optional.empty() : Optional.ofNullable(routines.get(jobType));
    }

    public boolean supports(String jobType) {
        return jobType != null && routines.containsKey(jobType);
    }

    public Set<String> jobTypes() {
        return Set.copyOf(routines.keySet());
    }

    /**
     * Registry with the built-in training, inference and data processing routines.
     */
    public static RoutineRegistry withDefaults(Duration trainingStep, Duration inferenceStep, Duration fileStep) {
        return new RoutineRegistry()
                .register(TRAINING, new StagedRoutine(TRAINING, 100, trainingStep))
                .register(INFERENCE, new StagedRoutine(INFERENCE, 50, inferenceStep))
                .register(DATA_PROCESSING, new FileEnumerationRoutine(20, fileStep));
    }

    public static RoutineRegistry withDefaults() {
        return withDefaults(Duration.ofMillis(100), Duration.ofMillis(50), Duration.ofMillis(200));
    }
}
