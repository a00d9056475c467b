package gpuhub.coordinator.execution;

import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.Worker;

/**
 * Everything a routine may see while it runs.
 */
public record JobContext(Job job, Worker worker, CancellationSignal signal, ProgressSink progress) {

    public void reportProgress(double percent) {
        progress.report(percent);
    }
}
