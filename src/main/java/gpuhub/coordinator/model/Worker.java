package gpuhub.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a GPU worker node.
 * Occupancy is not stored here - it is derived from RUNNING jobs.
 */
public final class Worker {
    private final String id;
    private final String name;
    private final String host;
    private final int port;
    private final int gpuCount;
    private final String gpuModel;
    private final WorkerStatus status;
    private final boolean active;
    private final Instant lastProbedAt;
    private final Instant createdAt;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.host = Objects.requireNonNull(builder.host, "host is required");
        this.port = builder.port;
        this.gpuCount = builder.gpuCount;
        this.gpuModel = builder.gpuModel;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.active = builder.active;
        this.lastProbedAt = builder.lastProbedAt;
        this.createdAt = builder.createdAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /** Declared number of GPU slots, i.e. how many jobs may run at once */
    public int gpuCount() {
        return gpuCount;
    }

    public String gpuModel() {
        return gpuModel;
    }

    public WorkerStatus status() {
        return status;
    }

    public boolean active() {
        return active;
    }

    public Instant lastProbedAt() {
        return lastProbedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean inMaintenance() {
        return status == WorkerStatus.MAINTENANCE;
    }

    /** Create a builder from this worker (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .host(host)
                .port(port)
                .gpuCount(gpuCount)
                .gpuModel(gpuModel)
                .status(status)
                .active(active)
                .lastProbedAt(lastProbedAt)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String host;
        private int port = 22;
        private int gpuCount = 1;
        private String gpuModel;
        private WorkerStatus status = WorkerStatus.OFFLINE;
        private boolean active = true;
        private Instant lastProbedAt;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder gpuCount(int gpuCount) {
            this.gpuCount = gpuCount;
            return this;
        }

        public Builder gpuModel(String gpuModel) {
            this.gpuModel = gpuModel;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder lastProbedAt(Instant lastProbedAt) {
            this.lastProbedAt = lastProbedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', host='" + host + ":" + port + "', status=" + status
                + ", gpus=" + gpuCount + ", active=" + active + "}";
    }
}
