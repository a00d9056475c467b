package gpuhub.coordinator.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed number of equally long steps; progress after step k of K is k/K * 100.
 * Used for training and inference jobs.
 */
public final class StagedRoutine implements JobRoutine {

    private static final Logger log = LoggerFactory.getLogger(StagedRoutine.class);

    private final String name;
    private final int steps;
    private final Duration stepDuration;

    public StagedRoutine(String name, int steps, Duration stepDuration) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1");
        }
        this.name = name;
        this.steps = steps;
        this.stepDuration = stepDuration;
    }

    @Override
    public Map<String, Object> run(JobContext context) throws JobCancelledException {
        CancellationSignal signal = context.signal();
        for (int step = 0; step < steps; step++) {
            signal.throwIfCancelled();
            signal.pause(stepDuration);

            double progress = (step + 1) * 100.0 / steps;
            context.reportProgress(progress);
            log.debug("Job {} {} progress: {}%", context.job().id(), name, String.format("%.1f", progress));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("routine", name);
        result.put("steps", steps);
        result.put("workerId", context.worker().id());
        return result;
    }

    public int steps() {
        return steps;
    }

    public Duration stepDuration() {
        return stepDuration;
    }
}
