package gpuhub.coordinator.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gpuhub.coordinator.api.Controller;
import gpuhub.coordinator.api.Controller.ControllerResponse;
import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.service.ConcurrencyLimitExceededException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* endpoints exist; everything else returns 404. When an admin
 * key is configured, every non-GET worker endpoint requires it in the
 * {@code X-GpuHub-Admin-Key} header.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String ADMIN_KEY_HEADER = "X-GpuHub-Admin-Key";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String uri = req.uri();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        ControllerResponse response;
        try {
            response = route(ctx, req, method, path);
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (NoSuchElementException e) {
            response = ControllerResponse.notFound(e.getMessage());
        } catch (ConcurrencyLimitExceededException e) {
            log.info("Rejected {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.tooManyRequests(e.getMessage());
        } catch (IllegalStateException e) {
            log.info("Conflict on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error("internal error");
        }
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        if (!checkAuth(req, method, path)) {
            log.warn("Auth failed for {} {}", method, path);
            return ControllerResponse.forbidden("forbidden");
        }

        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }

        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    /**
     * Worker administration needs the admin key when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req, HttpMethod method, String path) {
        if (!config.hasAdminKey()) {
            return true;
        }
        if (!path.startsWith("/api/v1/workers") || method.equals(HttpMethod.GET)) {
            return true;
        }
        return config.adminKey().equals(req.headers().get(ADMIN_KEY_HEADER));
    }

    /**
     * Write a response, falling back to closing the channel if even that fails.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"channel error\"}");
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
