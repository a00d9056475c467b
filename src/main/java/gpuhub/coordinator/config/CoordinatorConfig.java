package gpuhub.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/gpuhub;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduling settings
    private Duration probeTimeout = Duration.ofSeconds(10);
    private Duration backlogRetryInterval = Duration.ofSeconds(5);
    private Duration workerMonitorInterval = Duration.ofSeconds(60);
    private Duration orphanGracePeriod = Duration.ofSeconds(30);
    private int maxRunningJobsPerUser = 5;
    private int executorThreads = 16;
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    // Routine step durations
    private Duration trainingStepDuration = Duration.ofMillis(100);
    private Duration inferenceStepDuration = Duration.ofMillis(50);
    private Duration fileStepDuration = Duration.ofMillis(200);

    // Auth settings (optional)
    private String adminKey = null; // If set, worker administration requires X-GpuHub-Admin-Key

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("GPUHUB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("GPUHUB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String adminKey = System.getenv("GPUHUB_ADMIN_KEY");
        if (adminKey != null && !adminKey.isBlank()) {
            config.adminKey = adminKey;
        }

        String probeTimeout = System.getenv("GPUHUB_PROBE_TIMEOUT_MS");
        if (probeTimeout != null && !probeTimeout.isBlank()) {
            config.probeTimeout = Duration.ofMillis(Long.parseLong(probeTimeout.trim()));
        }

        String maxRunning = System.getenv("GPUHUB_MAX_RUNNING_PER_USER");
        if (maxRunning != null && !maxRunning.isBlank()) {
            config.maxRunningJobsPerUser = Integer.parseInt(maxRunning.trim());
        }

        String threads = System.getenv("GPUHUB_EXECUTOR_THREADS");
        if (threads != null && !threads.isBlank()) {
            config.executorThreads = Integer.parseInt(threads.trim());
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public Duration backlogRetryInterval() {
        return backlogRetryInterval;
    }

    public Duration workerMonitorInterval() {
        return workerMonitorInterval;
    }

    public Duration orphanGracePeriod() {
        return orphanGracePeriod;
    }

    public int maxRunningJobsPerUser() {
        return maxRunningJobsPerUser;
    }

    public int executorThreads() {
        return executorThreads;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration trainingStepDuration() {
        return trainingStepDuration;
    }

    public Duration inferenceStepDuration() {
        return inferenceStepDuration;
    }

    public Duration fileStepDuration() {
        return fileStepDuration;
    }

    public String adminKey() {
        return adminKey;
    }

    public boolean hasAdminKey() {
        return adminKey != null && !adminKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withAdminKey(String key) {
        this.adminKey = key;
        return this;
    }

    public CoordinatorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withBacklogRetryInterval(Duration interval) {
        this.backlogRetryInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkerMonitorInterval(Duration interval) {
        this.workerMonitorInterval = interval;
        return this;
    }

    public CoordinatorConfig withOrphanGracePeriod(Duration gracePeriod) {
        this.orphanGracePeriod = gracePeriod;
        return this;
    }

    public CoordinatorConfig withMaxRunningJobsPerUser(int max) {
        this.maxRunningJobsPerUser = max;
        return this;
    }

    public CoordinatorConfig withExecutorThreads(int threads) {
        this.executorThreads = threads;
        return this;
    }

    public CoordinatorConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStepDurations(Duration training, Duration inference, Duration file) {
        this.trainingStepDuration = training;
        this.inferenceStepDuration = inference;
        this.fileStepDuration = file;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", probeTimeout=" + probeTimeout +
                ", maxRunningJobsPerUser=" + maxRunningJobsPerUser +
                ", executorThreads=" + executorThreads +
                ", adminKeySet=" + hasAdminKey() +
                '}';
    }
}
