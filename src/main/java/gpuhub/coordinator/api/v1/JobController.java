package gpuhub.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import gpuhub.coordinator.api.Controller;
import gpuhub.coordinator.api.v1.dto.CreateJobRequest;
import gpuhub.coordinator.api.v1.dto.JobResponse;
import gpuhub.coordinator.api.v1.dto.UpdateJobRequest;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.server.RouterHandler;
import gpuhub.coordinator.service.JobService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for a user's jobs. The caller is identified by the
 * {@code X-User-Id} header.
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs - List own jobs (?status=&limit=)
 * GET /api/v1/jobs/{jobId} - Job status and progress
 * PUT /api/v1/jobs/{jobId} - Edit title, description, priority or config
 * POST /api/v1/jobs/{jobId}/cancel - Cancel
 * POST /api/v1/jobs/{jobId}/retry - Retry a failed or cancelled job
 * DELETE /api/v1/jobs/{jobId} - Delete a job that is not running
 */
public class JobController implements Controller {

    public static final String USER_HEADER = "X-User-Id";
    private static final int DEFAULT_LIMIT = 50;

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/(cancel|retry)$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (JOB_ACTION_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String userId = req.headers().get(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            return ControllerResponse.unauthorized(USER_HEADER + " header is required");
        }

        try {
            HttpMethod method = req.method();
            if (JOBS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req, userId) : handleList(req, userId);
            }

            Matcher action = JOB_ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                String jobId = action.group(1);
                Job job = "cancel".equals(action.group(2))
                        ? jobService.cancelJob(jobId, userId)
                        : jobService.retryJob(jobId, userId);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
            }

            Matcher byId = JOB_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String jobId = byId.group(1);
                if (method.equals(HttpMethod.DELETE)) {
                    jobService.deleteJob(jobId, userId);
                    return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                            Map.of("success", true, "jobId", jobId)));
                }
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(req, jobId, userId);
                }
                return handleGet(jobId, userId);
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreate(FullHttpRequest req, String userId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return ControllerResponse.badRequest("request body is required");
        }
        CreateJobRequest request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);
        request.validate();

        Job job = jobService.createJob(userId, request.toNewJob());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * PUT /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleUpdate(FullHttpRequest req, String jobId, String userId)
            throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return ControllerResponse.badRequest("request body is required");
        }
        UpdateJobRequest request = RouterHandler.mapper().readValue(body, UpdateJobRequest.class);

        Job job = jobService.updateJob(jobId, userId, request.toJobUpdate());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * GET /api/v1/jobs?status=RUNNING&limit=20
     */
    private ControllerResponse handleList(FullHttpRequest req, String userId) throws JsonProcessingException {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        JobStatus status = parseStatus(firstParam(query, "status"));
        int limit = parseLimit(firstParam(query, "limit"));

        List<JobResponse> jobs = jobService.listJobs(userId, status, limit).stream()
                .map(JobResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("count", jobs.size(), "jobs", jobs)));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGet(String jobId, String userId) throws JsonProcessingException {
        Optional<Job> job = jobService.getJob(jobId, userId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
    }

    private static String firstParam(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static JobStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + raw);
        }
    }

    private static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_LIMIT;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }
    }
}
