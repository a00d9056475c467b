package gpuhub.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpuhub.coordinator.api.Controller;
import gpuhub.coordinator.api.v1.dto.MaintenanceRequest;
import gpuhub.coordinator.api.v1.dto.RegisterWorkerRequest;
import gpuhub.coordinator.api.v1.dto.SetActiveRequest;
import gpuhub.coordinator.api.v1.dto.WorkerResponse;
import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.server.RouterHandler;
import gpuhub.coordinator.service.WorkerService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker node administration.
 *
 * GET /api/v1/workers - List workers with occupancy
 * POST /api/v1/workers - Register a worker
 * GET /api/v1/workers/{id} - Worker details
 * POST /api/v1/workers/{id}/ping - Probe now
 * POST /api/v1/workers/{id}/maintenance - Start a maintenance window
 * POST /api/v1/workers/{id}/active - Enable or disable
 * DELETE /api/v1/workers/{id} - Remove an idle worker
 */
public class WorkerController implements Controller {

    private static final Pattern WORKERS_PATTERN = Pattern.compile("^/api/v1/workers$");
    private static final Pattern WORKER_BY_ID_PATTERN = Pattern.compile("^/api/v1/workers/([^/]+)$");
    private static final Pattern WORKER_ACTION_PATTERN = Pattern
            .compile("^/api/v1/workers/([^/]+)/(ping|maintenance|active)$");

    private final WorkerService workerService;

    public WorkerController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (WORKERS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (WORKER_ACTION_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (WORKER_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();
            if (WORKERS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleRegister(req) : handleList();
            }

            Matcher action = WORKER_ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                String workerId = action.group(1);
                return switch (action.group(2)) {
                    case "ping" -> handlePing(workerId);
                    case "maintenance" -> handleMaintenance(req, workerId);
                    default -> handleSetActive(req, workerId);
                };
            }

            Matcher byId = WORKER_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String workerId = byId.group(1);
                if (method.equals(HttpMethod.DELETE)) {
                    workerService.deleteWorker(workerId);
                    return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                            Map.of("success", true, "workerId", workerId)));
                }
                Optional<Worker> worker = workerService.findById(workerId);
                if (worker.isEmpty()) {
                    return ControllerResponse.notFound("worker not found");
                }
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(worker.get())));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * GET /api/v1/workers
     */
    private ControllerResponse handleList() throws JsonProcessingException {
        List<WorkerResponse> workers = workerService.findAll().stream()
                .map(this::toResponse)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("count", workers.size(), "workers", workers)));
    }

    /**
     * POST /api/v1/workers
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws JsonProcessingException {
        RegisterWorkerRequest request = RouterHandler.mapper().readValue(body(req), RegisterWorkerRequest.class);
        request.validate();

        Worker worker = workerService.registerWorker(request.toNewWorker());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(toResponse(worker)));
    }

    /**
     * POST /api/v1/workers/{id}/ping
     */
    private ControllerResponse handlePing(String workerId) throws JsonProcessingException {
        boolean reachable = workerService.ping(workerId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("workerId", workerId);
        response.put("reachable", reachable);
        workerService.findById(workerId).ifPresent(w -> response.put("status", w.status().name()));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/workers/{id}/maintenance {"windowSeconds": 3600}
     */
    private ControllerResponse handleMaintenance(FullHttpRequest req, String workerId)
            throws JsonProcessingException {
        String body = body(req);
        MaintenanceRequest request = body.isBlank()
                ? new MaintenanceRequest(null)
                : RouterHandler.mapper().readValue(body, MaintenanceRequest.class);

        Worker worker = workerService.scheduleMaintenance(workerId, request.window());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(worker)));
    }

    /**
     * POST /api/v1/workers/{id}/active {"active": false}
     */
    private ControllerResponse handleSetActive(FullHttpRequest req, String workerId)
            throws JsonProcessingException {
        SetActiveRequest request = RouterHandler.mapper().readValue(body(req), SetActiveRequest.class);
        request.validate();

        Worker worker = workerService.setActive(workerId, request.active());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(toResponse(worker)));
    }

    private WorkerResponse toResponse(Worker worker) {
        return WorkerResponse.from(worker, workerService.runningJobs(worker.id()));
    }

    private static String body(FullHttpRequest req) {
        return req.content().toString(StandardCharsets.UTF_8);
    }
}
