package stitcher.taskcenter.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import stitcher.taskcenter.api.Controller;
import stitcher.taskcenter.api.QueryParams;
import stitcher.taskcenter.api.v1.dto.OperationResponse;
import stitcher.taskcenter.api.v1.dto.TaskLogResponse;
import stitcher.taskcenter.model.TaskLog;
import stitcher.taskcenter.server.RouterHandler;
import stitcher.taskcenter.service.TaskCenterService;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task log lines.
 *
 * GET /api/v1/tasks/{id}/logs?limit&offset
 * DELETE /api/v1/tasks/{id}/logs
 * GET /api/v1/logs/recent?limit
 * DELETE /api/v1/logs
 */
public class LogController implements Controller {

    static final int DEFAULT_LIMIT = 200;

    private static final Pattern TASK_LOGS_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/logs$");
    private static final Pattern RECENT_PATTERN = Pattern.compile("^/api/v1/logs/recent$");
    private static final Pattern ALL_LOGS_PATTERN = Pattern.compile("^/api/v1/logs$");

    private final TaskCenterService service;

    public LogController(TaskCenterService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return TASK_LOGS_PATTERN.matcher(path).matches() || RECENT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return TASK_LOGS_PATTERN.matcher(path).matches() || ALL_LOGS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueryParams params = QueryParams.of(req.uri());
        Matcher taskLogs = TASK_LOGS_PATTERN.matcher(path);

        if (req.method().equals(HttpMethod.GET)) {
            if (taskLogs.matches()) {
                long taskId = Long.parseLong(taskLogs.group(1));
                List<TaskLog> lines = service.getLogs(taskId,
                        params.integer("limit", DEFAULT_LIMIT), params.integer("offset", 0));
                return logs(lines);
            }
            if (RECENT_PATTERN.matcher(path).matches()) {
                return logs(service.getRecentLogs(params.integer("limit", DEFAULT_LIMIT)));
            }
        }

        if (req.method().equals(HttpMethod.DELETE)) {
            int deleted = taskLogs.matches()
                    ? service.clearLogs(Long.parseLong(taskLogs.group(1)))
                    : service.clearAllLogs();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.count(deleted)));
        }

        return ControllerResponse.notFound("unknown log endpoint");
    }

    private static ControllerResponse logs(List<TaskLog> lines) throws Exception {
        List<TaskLogResponse> body = lines.stream().map(TaskLogResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("logs", body)));
    }
}
