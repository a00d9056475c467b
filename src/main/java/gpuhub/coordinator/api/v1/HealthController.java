package gpuhub.coordinator.api.v1;

import gpuhub.coordinator.api.Controller;
import gpuhub.coordinator.api.v1.dto.HealthResponse;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.WorkerStatus;
import gpuhub.coordinator.repository.WorkerRepository;
import gpuhub.coordinator.scheduler.JobSupervisor;
import gpuhub.coordinator.server.RouterHandler;
import gpuhub.coordinator.service.JobService;
import gpuhub.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobService jobService;
    private final WorkerRepository workerRepository;
    private final JobSupervisor supervisor;

    public HealthController(Database database, JobService jobService, WorkerRepository workerRepository,
            JobSupervisor supervisor) {
        this.database = database;
        this.jobService = jobService;
        this.workerRepository = workerRepository;
        this.supervisor = supervisor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    workerRepository.countByStatus(WorkerStatus.ONLINE),
                    jobService.countByStatus(JobStatus.PENDING),
                    jobService.countByStatus(JobStatus.RUNNING),
                    supervisor.activeJobIds().size());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    "{\"status\":\"unhealthy\"}");
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
