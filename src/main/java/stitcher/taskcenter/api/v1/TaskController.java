package stitcher.taskcenter.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import stitcher.taskcenter.api.Controller;
import stitcher.taskcenter.api.QueryParams;
import stitcher.taskcenter.api.v1.dto.BatchSubmitRequest;
import stitcher.taskcenter.api.v1.dto.BatchSubmitResponse;
import stitcher.taskcenter.api.v1.dto.OperationResponse;
import stitcher.taskcenter.api.v1.dto.OutputDirRequest;
import stitcher.taskcenter.api.v1.dto.SubmitTaskRequest;
import stitcher.taskcenter.api.v1.dto.TaskListResponse;
import stitcher.taskcenter.api.v1.dto.TaskResponse;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskFilter;
import stitcher.taskcenter.model.TaskQuery;
import stitcher.taskcenter.model.TaskSort;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.model.ValidationException;
import stitcher.taskcenter.server.RouterHandler;
import stitcher.taskcenter.service.BatchSubmitResult;
import stitcher.taskcenter.service.TaskCenterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Controller for task management (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * POST /api/v1/tasks/batch - Submit several tasks
 * GET /api/v1/tasks - List tasks
 * GET /api/v1/tasks/{id} - Get a task
 * DELETE /api/v1/tasks/{id} - Delete a task
 * PUT /api/v1/tasks/{id}/output-dir - Change the output directory
 * POST /api/v1/tasks/{id}/{start|cancel|retry|pause|resume}
 * POST /api/v1/tasks/{pause-all|resume-all|cancel-all}
 * POST /api/v1/tasks/{clear-completed|clear-failed|clear-cancelled}
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern BATCH_PATTERN = Pattern.compile("^/api/v1/tasks/batch$");
    private static final Pattern BULK_PATTERN = Pattern.compile(
            "^/api/v1/tasks/(pause-all|resume-all|cancel-all|clear-completed|clear-failed|clear-cancelled)$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)$");
    private static final Pattern OUTPUT_DIR_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/output-dir$");
    private static final Pattern ACTION_PATTERN = Pattern.compile(
            "^/api/v1/tasks/(\\d+)/(start|cancel|retry|pause|resume)$");

    private final TaskCenterService service;

    public TaskController(TaskCenterService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || BATCH_PATTERN.matcher(path).matches()
                    || BULK_PATTERN.matcher(path).matches()
                    || ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.PUT)) {
            return OUTPUT_DIR_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (method.equals(HttpMethod.POST)) {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }
            if (BATCH_PATTERN.matcher(path).matches()) {
                return handleBatchSubmit(req);
            }
            Matcher bulk = BULK_PATTERN.matcher(path);
            if (bulk.matches()) {
                return handleBulk(bulk.group(1), QueryParams.of(req.uri()));
            }
            Matcher action = ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                return handleAction(Long.parseLong(action.group(1)), action.group(2));
            }
        }

        if (method.equals(HttpMethod.GET)) {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(QueryParams.of(req.uri()));
            }
            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                Task task = service.get(Long.parseLong(byId.group(1)));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
            }
        }

        if (method.equals(HttpMethod.DELETE)) {
            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                service.delete(Long.parseLong(byId.group(1)));
                return ok(OperationResponse.of(true));
            }
        }

        if (method.equals(HttpMethod.PUT)) {
            Matcher outputDir = OUTPUT_DIR_PATTERN.matcher(path);
            if (outputDir.matches()) {
                OutputDirRequest request = readBody(req, OutputDirRequest.class);
                service.updateOutputDir(Long.parseLong(outputDir.group(1)), request.outputDir());
                return ok(OperationResponse.of(true));
            }
        }

        return ControllerResponse.notFound("unknown task endpoint");
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        SubmitTaskRequest request = readBody(req, SubmitTaskRequest.class);
        Task task = service.submit(request.toSubmission());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * POST /api/v1/tasks/batch
     */
    private ControllerResponse handleBatchSubmit(FullHttpRequest req) throws Exception {
        BatchSubmitRequest request = readBody(req, BatchSubmitRequest.class);
        BatchSubmitResult result = service.batchSubmit(request.toSubmissions());
        HttpResponseStatus status = result.tasks().isEmpty() ? HttpResponseStatus.OK : HttpResponseStatus.CREATED;
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(BatchSubmitResponse.from(result)));
    }

    /**
     * GET /api/v1/tasks
     */
    private ControllerResponse handleList(QueryParams params) throws Exception {
        Set<TaskStatus> statuses = params.list("status").stream()
                .map(TaskStatus::fromWire)
                .collect(Collectors.toSet());
        Set<TaskType> types = params.list("type").stream()
                .map(TaskType::fromWire)
                .collect(Collectors.toSet());
        Long from = params.longValue("from");
        Long to = params.longValue("to");
        TaskFilter filter = new TaskFilter(statuses, types, params.string("search"),
                from != null ? Instant.ofEpochMilli(from) : null,
                to != null ? Instant.ofEpochMilli(to) : null);

        String sortField = params.string("sort");
        String order = params.string("order");
        if (order != null && !order.equalsIgnoreCase("asc") && !order.equalsIgnoreCase("desc")) {
            throw new ValidationException("order must be asc or desc");
        }
        TaskSort sort = new TaskSort(
                sortField != null ? TaskSort.Field.fromWire(sortField) : TaskSort.Field.CREATED_AT,
                "asc".equalsIgnoreCase(order));

        TaskQuery query = new TaskQuery(filter, sort,
                params.integer("page", 1),
                params.integer("pageSize", TaskQuery.DEFAULT_PAGE_SIZE),
                params.bool("withFiles", false),
                params.bool("withOutputs", false));

        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(TaskListResponse.from(service.list(query))));
    }

    private ControllerResponse handleAction(long taskId, String action) throws Exception {
        boolean ok = switch (action) {
            case "start" -> service.start(taskId);
            case "cancel" -> service.cancel(taskId);
            case "retry" -> service.retry(taskId);
            case "pause" -> service.pause(taskId);
            case "resume" -> service.resume(taskId);
            default -> throw new ValidationException("unknown action: " + action);
        };
        log.debug("Task {} {} -> {}", taskId, action, ok);
        return ok(OperationResponse.of(ok));
    }

    private ControllerResponse handleBulk(String operation, QueryParams params) throws Exception {
        int count = switch (operation) {
            case "pause-all" -> service.pauseAll();
            case "resume-all" -> service.resumeAll();
            case "cancel-all" -> service.cancelAll();
            case "clear-completed" -> service.clearCompleted(params.integer("beforeDays", 0));
            case "clear-failed" -> service.clearFailed();
            case "clear-cancelled" -> service.clearCancelled();
            default -> throw new ValidationException("unknown operation: " + operation);
        };
        return ok(OperationResponse.count(count));
    }

    private static ControllerResponse ok(OperationResponse response) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private static <T> T readBody(FullHttpRequest req, Class<T> type) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        return RouterHandler.mapper().readValue(body, type);
    }
}
