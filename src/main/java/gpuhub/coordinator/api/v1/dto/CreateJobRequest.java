package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpuhub.coordinator.service.JobService;

import java.util.Map;

/**
 * Request DTO for creating a new job.
 * POST /api/v1/jobs
 */
public record CreateJobRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("config") Map<String, Object> config) {

    /** Validate the request shape; business rules are checked by JobService */
    public void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType is required");
        }
    }

    public JobService.NewJob toNewJob() {
        return new JobService.NewJob(title, description, jobType, priority, config);
    }
}
