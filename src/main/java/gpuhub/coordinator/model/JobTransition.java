package gpuhub.coordinator.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A conditional partial update of a job's durable record.
 *
 * <p>The update is applied only when the job's current status is one of
 * {@link #allowedFrom()}. Fields absent from {@link #fields()} are left
 * untouched; a field mapped to {@code null} is cleared. A transition with no
 * target status is a progress-only write and never lowers progress.
 */
public final class JobTransition {

    /** Columns a transition may write besides status */
    public enum Field {
        PROGRESS,
        ASSIGNED_WORKER_ID,
        STARTED_AT,
        COMPLETED_AT,
        RESULT,
        ERROR_MESSAGE
    }

    private final Set<JobStatus> allowedFrom;
    private final JobStatus targetStatus;
    private final Map<Field, Object> fields;
    private final boolean retry;

    private JobTransition(Builder builder) {
        if (builder.allowedFrom.isEmpty()) {
            throw new IllegalArgumentException("at least one source status is required");
        }
        this.allowedFrom = Collections.unmodifiableSet(EnumSet.copyOf(builder.allowedFrom));
        this.targetStatus = builder.targetStatus;
        this.fields = Collections.unmodifiableMap(new EnumMap<>(builder.fields));
        this.retry = builder.retry;
    }

    // Factories for the lifecycle edges

    /** PENDING -> RUNNING on the given worker */
    public static JobTransition running(String workerId, Instant now) {
        Objects.requireNonNull(workerId, "workerId is required");
        return builder()
                .from(JobStatus.PENDING)
                .to(JobStatus.RUNNING)
                .set(Field.ASSIGNED_WORKER_ID, workerId)
                .set(Field.STARTED_AT, now)
                .build();
    }

    /** Progress-only write while RUNNING, clamped to [0, 100] */
    public static JobTransition progress(double percent) {
        double clamped = Math.max(0.0, Math.min(100.0, percent));
        return builder()
                .from(JobStatus.RUNNING)
                .set(Field.PROGRESS, clamped)
                .build();
    }

    /** RUNNING -> COMPLETED with progress 100 */
    public static JobTransition completed(Map<String, Object> result, Instant now) {
        return builder()
                .from(JobStatus.RUNNING)
                .to(JobStatus.COMPLETED)
                .set(Field.PROGRESS, 100.0)
                .set(Field.RESULT, result == null ? Map.of() : result)
                .set(Field.ERROR_MESSAGE, null)
                .set(Field.COMPLETED_AT, now)
                .build();
    }

    /** RUNNING -> FAILED, error captured verbatim */
    public static JobTransition failed(String errorMessage, Instant now) {
        return builder()
                .from(JobStatus.RUNNING)
                .to(JobStatus.FAILED)
                .set(Field.ERROR_MESSAGE, nonEmpty(errorMessage))
                .set(Field.RESULT, null)
                .set(Field.COMPLETED_AT, now)
                .build();
    }

    /** PENDING -> FAILED for a job that can never run (no worker is claimed) */
    public static JobTransition rejected(String errorMessage, Instant now) {
        return builder()
                .from(JobStatus.PENDING)
                .to(JobStatus.FAILED)
                .set(Field.ERROR_MESSAGE, nonEmpty(errorMessage))
                .set(Field.RESULT, null)
                .set(Field.COMPLETED_AT, now)
                .build();
    }

    /** PENDING|RUNNING -> CANCELLED; the worker assignment is released */
    public static JobTransition cancelled(Instant now) {
        return builder()
                .from(JobStatus.PENDING, JobStatus.RUNNING)
                .to(JobStatus.CANCELLED)
                .set(Field.ASSIGNED_WORKER_ID, null)
                .set(Field.ERROR_MESSAGE, null)
                .set(Field.RESULT, null)
                .set(Field.COMPLETED_AT, now)
                .build();
    }

    /** PENDING -> CANCELLED for a job that never started */
    public static JobTransition cancelledPending(Instant now) {
        return builder()
                .from(JobStatus.PENDING)
                .to(JobStatus.CANCELLED)
                .set(Field.ASSIGNED_WORKER_ID, null)
                .set(Field.ERROR_MESSAGE, null)
                .set(Field.RESULT, null)
                .set(Field.COMPLETED_AT, now)
                .build();
    }

    /** FAILED|CANCELLED -> PENDING with every run field reset */
    public static JobTransition retry() {
        return builder()
                .from(JobStatus.FAILED, JobStatus.CANCELLED)
                .to(JobStatus.PENDING)
                .set(Field.PROGRESS, 0.0)
                .set(Field.ASSIGNED_WORKER_ID, null)
                .set(Field.STARTED_AT, null)
                .set(Field.COMPLETED_AT, null)
                .set(Field.RESULT, null)
                .set(Field.ERROR_MESSAGE, null)
                .retry(true)
                .build();
    }

    private static String nonEmpty(String errorMessage) {
        return errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage;
    }

    // Getters
    public Set<JobStatus> allowedFrom() {
        return allowedFrom;
    }

    public JobStatus targetStatus() {
        return targetStatus;
    }

    public Map<Field, Object> fields() {
        return fields;
    }

    public boolean isRetry() {
        return retry;
    }

    public boolean isProgressOnly() {
        return targetStatus == null;
    }

    /** True if the transition would move a job out of a terminal state */
    public boolean leavesTerminalState() {
        return allowedFrom.stream().anyMatch(JobStatus::isTerminal);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<JobStatus> allowedFrom = EnumSet.noneOf(JobStatus.class);
        private final Map<Field, Object> fields = new EnumMap<>(Field.class);
        private JobStatus targetStatus;
        private boolean retry;

        public Builder from(JobStatus... statuses) {
            allowedFrom.addAll(Arrays.asList(statuses));
            return this;
        }

        public Builder to(JobStatus status) {
            this.targetStatus = status;
            return this;
        }

        public Builder set(Field field, Object value) {
            fields.put(field, value);
            return this;
        }

        public Builder retry(boolean retry) {
            this.retry = retry;
            return this;
        }

        public JobTransition build() {
            return new JobTransition(this);
        }
    }

    @Override
    public String toString() {
        return "JobTransition{" + allowedFrom + " -> " + (targetStatus == null ? "(progress)" : targetStatus)
                + ", fields=" + fields.keySet() + "}";
    }
}
