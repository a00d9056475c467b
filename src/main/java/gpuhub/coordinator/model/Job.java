package gpuhub.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model representing a user-submitted GPU job.
 * Only the {@link gpuhub.coordinator.service.StateReconciler} writes lifecycle
 * fields back to the store; instances are snapshots of the durable record.
 */
public final class Job {
    private final String id;
    private final String userId;
    private final String title;
    private final String description;
    private final String jobType;
    private final int priority;
    private final Map<String, Object> config;
    private final JobStatus status;
    private final double progress;
    private final String assignedWorkerId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Map<String, Object> result;
    private final String errorMessage;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.title = builder.title;
        this.description = builder.description;
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.priority = builder.priority;
        this.config = builder.config == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.assignedWorkerId = builder.assignedWorkerId;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.result = builder.result == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.result));
        this.errorMessage = builder.errorMessage;
    }

    // Getters
    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String jobType() {
        return jobType;
    }

    public int priority() {
        return priority;
    }

    public Map<String, Object> config() {
        return config;
    }

    public JobStatus status() {
        return status;
    }

    public double progress() {
        return progress;
    }

    public String assignedWorkerId() {
        return assignedWorkerId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Map<String, Object> result() {
        return result;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Check if job can be sent back to PENDING */
    public boolean canRetry() {
        return status.isRetryable();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .title(title)
                .description(description)
                .jobType(jobType)
                .priority(priority)
                .config(config)
                .status(status)
                .progress(progress)
                .assignedWorkerId(assignedWorkerId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .result(result)
                .errorMessage(errorMessage);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String title;
        private String description;
        private String jobType;
        private int priority = 1;
        private Map<String, Object> config;
        private JobStatus status = JobStatus.PENDING;
        private double progress = 0.0;
        private String assignedWorkerId;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private Map<String, Object> result;
        private String errorMessage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder assignedWorkerId(String assignedWorkerId) {
            this.assignedWorkerId = assignedWorkerId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', type='" + jobType + "', status=" + status
                + ", progress=" + progress + ", worker='" + assignedWorkerId + "'}";
    }
}
