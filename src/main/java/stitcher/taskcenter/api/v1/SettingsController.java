package stitcher.taskcenter.api.v1;

import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import stitcher.taskcenter.api.Controller;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.ValidationException;
import stitcher.taskcenter.server.RouterHandler;
import stitcher.taskcenter.service.TaskCenterService;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Runtime settings.
 * GET /api/v1/config, PUT /api/v1/config (partial update), POST /api/v1/config/reset
 */
public class SettingsController implements Controller {

    private static final String CONFIG_PATH = "/api/v1/config";
    private static final String RESET_PATH = "/api/v1/config/reset";

    private final TaskCenterService service;

    public SettingsController(TaskCenterService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (CONFIG_PATH.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT);
        }
        return method.equals(HttpMethod.POST) && RESET_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        TaskCenterSettings settings;
        if (RESET_PATH.equals(path)) {
            settings = service.resetConfig();
        } else if (req.method().equals(HttpMethod.PUT)) {
            String body = req.content().toString(StandardCharsets.UTF_8);
            if (body.isBlank()) {
                throw new ValidationException("request body is required");
            }
            Map<String, Object> partial = RouterHandler.mapper().readValue(body, new TypeReference<>() {
            });
            settings = service.setConfig(partial);
        } else {
            settings = service.getConfig();
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(settings.asMap()));
    }
}
