package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpuhub.coordinator.service.JobService;

import java.util.Map;

/**
 * Request DTO for editing a job. Omitted fields are left unchanged.
 * PUT /api/v1/jobs/{jobId}
 */
public record UpdateJobRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("config") Map<String, Object> config) {

    public JobService.JobUpdate toJobUpdate() {
        return new JobService.JobUpdate(title, description, priority, config);
    }
}
