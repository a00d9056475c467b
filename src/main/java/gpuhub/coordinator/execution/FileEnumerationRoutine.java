package gpuhub.coordinator.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processes a list of input files one by one.
 * The list comes from the job configuration key {@code files}; without it a
 * default number of anonymous files is processed.
 */
public final class FileEnumerationRoutine implements JobRoutine {

    private static final Logger log = LoggerFactory.getLogger(FileEnumerationRoutine.class);

    public static final String FILES_KEY = "files";

    private final int defaultFileCount;
    private final Duration perFileDuration;

    public FileEnumerationRoutine(int defaultFileCount, Duration perFileDuration) {
        if (defaultFileCount < 1) {
            throw new IllegalArgumentException("defaultFileCount must be >= 1");
        }
        this.defaultFileCount = defaultFileCount;
        this.perFileDuration = perFileDuration;
    }

    @Override
    public Map<String, Object> run(JobContext context) throws JobExecutionException, JobCancelledException {
        List<String> files = resolveFiles(context.job().config().get(FILES_KEY));
        CancellationSignal signal = context.signal();

        List<String> processed = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            signal.throwIfCancelled();
            signal.pause(perFileDuration);
            processed.add(files.get(i));

            double progress = (i + 1) * 100.0 / files.size();
            context.reportProgress(progress);
            log.debug("Job {} processed {} ({}/{})", context.job().id(), files.get(i), i + 1, files.size());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("routine", "data_processing");
        result.put("filesProcessed", processed.size());
        result.put("files", processed);
        return result;
    }

    private List<String> resolveFiles(Object configured) throws JobExecutionException {
        if (configured == null) {
            List<String> files = new ArrayList<>(defaultFileCount);
            for (int i = 1; i <= defaultFileCount; i++) {
                files.add("file-" + i);
            }
            return files;
        }
        if (!(configured instanceof List<?> list)) {
            throw new JobExecutionException("'" + FILES_KEY + "' must be a list of file names");
        }
        if (list.isEmpty()) {
            throw new JobExecutionException("'" + FILES_KEY + "' must not be empty");
        }
        List<String> files = new ArrayList<>(list.size());
        for (Object item : list) {
            files.add(String.valueOf(item));
        }
        return files;
    }
}
