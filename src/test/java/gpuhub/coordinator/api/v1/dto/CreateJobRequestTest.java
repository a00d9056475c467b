package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.server.RouterHandler;
import gpuhub.coordinator.service.JobService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "title": "Fine-tune llama",
                  "description": "LoRA on support tickets",
                  "jobType": "training",
                  "priority": 4,
                  "config": { "epochs": 3, "files": ["a.parquet", "b.parquet"] }
                }
                """;

        CreateJobRequest req = mapper.readValue(json, CreateJobRequest.class);
        req.validate();

        assertEquals("Fine-tune llama", req.title());
        assertEquals("training", req.jobType());
        assertEquals(4, req.priority());
        assertEquals(List.of("a.parquet", "b.parquet"), req.config().get("files"));

        JobService.NewJob newJob = req.toNewJob();
        assertEquals("LoRA on support tickets", newJob.description());
        assertEquals(3, newJob.config().get("epochs"));
    }

    @Test
    void missingTitleOrTypeFailsValidation() throws Exception {
        CreateJobRequest noTitle = mapper.readValue("{\"jobType\":\"training\"}", CreateJobRequest.class);
        assertThrows(IllegalArgumentException.class, noTitle::validate);

        CreateJobRequest noType = mapper.readValue("{\"title\":\"x\",\"jobType\":\" \"}", CreateJobRequest.class);
        assertThrows(IllegalArgumentException.class, noType::validate);
    }

    @Test
    void jobResponseOmitsUnsetFields() throws Exception {
        Job job = Job.builder()
                .id("job-1")
                .userId("alice")
                .title("t")
                .jobType("inference")
                .status(JobStatus.PENDING)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        JsonNode node = mapper.readTree(mapper.writeValueAsString(JobResponse.from(job)));

        assertEquals("job-1", node.get("jobId").asText());
        assertEquals("PENDING", node.get("status").asText());
        assertEquals("2024-05-01T10:00:00Z", node.get("createdAt").asText());
        assertFalse(node.has("assignedWorkerId"));
        assertFalse(node.has("errorMessage"));
        assertFalse(node.has("result"));
    }

    @Test
    void maintenanceWindowDefaultsToOneHour() throws Exception {
        MaintenanceRequest empty = mapper.readValue("{}", MaintenanceRequest.class);
        assertEquals(3600, empty.window().getSeconds());

        MaintenanceRequest negative = new MaintenanceRequest(-5L);
        assertThrows(IllegalArgumentException.class, negative::window);
    }

    @Test
    void workerResponseCarriesRunningJobs() throws Exception {
        Worker worker = Worker.builder()
                .id("worker-1")
                .name("rig")
                .host("10.0.0.5")
                .gpuCount(4)
                .build();

        JsonNode node = mapper.readTree(mapper.writeValueAsString(WorkerResponse.from(worker, 3)));

        assertEquals("worker-1", node.get("workerId").asText());
        assertEquals(3, node.get("runningJobs").asInt());
        assertEquals("OFFLINE", node.get("status").asText());
    }
}
