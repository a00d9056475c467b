package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpuhub.coordinator.model.Worker;

import java.time.Instant;

/**
 * Response DTO for a worker node, including its current occupancy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("name") String name,
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("gpuCount") int gpuCount,
        @JsonProperty("gpuModel") String gpuModel,
        @JsonProperty("status") String status,
        @JsonProperty("active") boolean active,
        @JsonProperty("runningJobs") int runningJobs,
        @JsonProperty("lastProbedAt") Instant lastProbedAt,
        @JsonProperty("createdAt") Instant createdAt) {

    public static WorkerResponse from(Worker worker, int runningJobs) {
        return new WorkerResponse(
                worker.id(),
                worker.name(),
                worker.host(),
                worker.port(),
                worker.gpuCount(),
                worker.gpuModel(),
                worker.status().name(),
                worker.active(),
                runningJobs,
                worker.lastProbedAt(),
                worker.createdAt());
    }
}
