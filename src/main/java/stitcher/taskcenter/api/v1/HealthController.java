package stitcher.taskcenter.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import stitcher.taskcenter.api.Controller;
import stitcher.taskcenter.api.v1.dto.HealthResponse;
import stitcher.taskcenter.config.AppConfig;
import stitcher.taskcenter.server.RouterHandler;
import stitcher.taskcenter.service.TaskCenterService;
import stitcher.taskcenter.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health and runtime status.
 * GET /api/v1/health, GET /api/v1/queue, GET /api/v1/system/cpu
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private static final String HEALTH_PATH = "/api/v1/health";
    private static final String QUEUE_PATH = "/api/v1/queue";
    private static final String CPU_PATH = "/api/v1/system/cpu";

    private final Database database;
    private final TaskCenterService service;

    public HealthController(Database database, TaskCenterService service) {
        this.database = database;
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (HEALTH_PATH.equals(path) || QUEUE_PATH.equals(path) || CPU_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (QUEUE_PATH.equals(path)) {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(service.queueStatus()));
        }
        if (CPU_PATH.equals(path)) {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(service.cpuInfo()));
        }
        return handleHealth();
    }

    private ControllerResponse handleHealth() throws Exception {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }
            HealthResponse response = HealthResponse.healthy(formatUptime(), AppConfig.VERSION,
                    service.queueStatus());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
