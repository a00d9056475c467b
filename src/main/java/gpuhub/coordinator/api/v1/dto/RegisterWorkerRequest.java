package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gpuhub.coordinator.service.WorkerService;

/**
 * Request DTO for registering a worker node.
 * POST /api/v1/workers
 */
public record RegisterWorkerRequest(
        @JsonProperty("name") String name,
        @JsonProperty("host") String host,
        @JsonProperty("port") Integer port,
        @JsonProperty("gpuCount") Integer gpuCount,
        @JsonProperty("gpuModel") String gpuModel) {

    public void validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
    }

    public WorkerService.NewWorker toNewWorker() {
        return new WorkerService.NewWorker(name, host, port, gpuCount, gpuModel);
    }
}
