package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stitcher.taskcenter.model.TaskLog;

import java.time.Instant;

/**
 * One log line.
 * GET /api/v1/tasks/{id}/logs, GET /api/v1/logs/recent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskLogResponse(
        @JsonProperty("id") long id,
        @JsonProperty("taskId") long taskId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("level") String level,
        @JsonProperty("message") String message,
        @JsonProperty("raw") String raw,
        @JsonProperty("taskType") String taskType) {

    public static TaskLogResponse from(TaskLog line) {
        return new TaskLogResponse(
                line.id(),
                line.taskId(),
                line.timestamp(),
                line.level().wireName(),
                line.message(),
                line.raw(),
                line.taskType() != null ? line.taskType().wireName() : null);
    }
}
