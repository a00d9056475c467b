package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("onlineWorkers") Integer onlineWorkers,
        @JsonProperty("pendingJobs") Integer pendingJobs,
        @JsonProperty("runningJobs") Integer runningJobs,
        @JsonProperty("activeExecutions") Integer activeExecutions) {

    public static HealthResponse healthy(String uptime, String version, int onlineWorkers, int pendingJobs,
            int runningJobs, int activeExecutions) {
        return new HealthResponse("healthy", "ok", uptime, version, onlineWorkers, pendingJobs, runningJobs,
                activeExecutions);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
