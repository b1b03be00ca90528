package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stitcher.taskcenter.model.TaskPage;
import stitcher.taskcenter.model.TaskStats;
import stitcher.taskcenter.model.TaskStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/tasks
 */
public record TaskListResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("total") int total,
        @JsonProperty("page") int page,
        @JsonProperty("pageSize") int pageSize,
        @JsonProperty("stats") Map<String, Object> stats) {

    public static TaskListResponse from(TaskPage page) {
        return new TaskListResponse(
                page.tasks().stream().map(TaskResponse::from).toList(),
                page.total(),
                page.page(),
                page.pageSize(),
                stats(page.stats()));
    }

    /** Per-status counts keyed by wire name, plus totals. */
    static Map<String, Object> stats(TaskStats stats) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            map.put(status.wireName(), stats.count(status));
        }
        map.put("total", stats.total());
        map.put("totalExecutionTime", stats.totalExecutionTime());
        return map;
    }
}
