package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpuhub.coordinator.model.Job;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("userId") String userId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("priority") int priority,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("status") String status,
        @JsonProperty("progress") double progress,
        @JsonProperty("assignedWorkerId") String assignedWorkerId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("errorMessage") String errorMessage) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.userId(),
                job.title(),
                job.description(),
                job.jobType(),
                job.priority(),
                job.config(),
                job.status().name(),
                job.progress(),
                job.assignedWorkerId(),
                job.createdAt(),
                job.updatedAt(),
                job.startedAt(),
                job.completedAt(),
                job.result(),
                job.errorMessage());
    }
}
