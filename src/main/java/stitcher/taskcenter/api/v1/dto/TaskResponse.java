package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskError;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskOutput;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") long id,
        @JsonProperty("type") String type,
        @JsonProperty("typeName") String typeName,
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("progress") int progress,
        @JsonProperty("currentStep") String currentStep,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetry") int maxRetry,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("executionTime") long executionTime,
        @JsonProperty("pid") Long pid,
        @JsonProperty("outputDir") String outputDir,
        @JsonRawValue @JsonProperty("config") String config,
        @JsonProperty("files") List<FileResponse> files,
        @JsonProperty("outputs") List<OutputResponse> outputs,
        @JsonProperty("error") ErrorResponse error) {

    public record FileResponse(
            @JsonProperty("id") Long id,
            @JsonProperty("path") String path,
            @JsonProperty("category") String category,
            @JsonProperty("categoryLabel") String categoryLabel,
            @JsonProperty("sortOrder") int sortOrder) {

        static FileResponse from(TaskFile file) {
            return new FileResponse(file.id(), file.path(), file.category(), file.categoryLabel(), file.sortOrder());
        }
    }

    public record OutputResponse(
            @JsonProperty("id") Long id,
            @JsonProperty("path") String path,
            @JsonProperty("kind") String kind,
            @JsonProperty("size") Long size,
            @JsonProperty("createdAt") Instant createdAt) {

        static OutputResponse from(TaskOutput output) {
            return new OutputResponse(output.id(), output.path(), output.kind().wireName(), output.size(),
                    output.createdAt());
        }
    }

    public record ErrorResponse(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("stack") String stack) {

        static ErrorResponse from(TaskError error) {
            return error == null ? null : new ErrorResponse(error.code(), error.message(), error.stack());
        }
    }

    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.type().wireName(),
                task.type().displayName(),
                task.name(),
                task.status().wireName(),
                task.priority(),
                task.progress(),
                task.currentStep(),
                task.retryCount(),
                task.maxRetry(),
                task.createdAt(),
                task.updatedAt(),
                task.startedAt(),
                task.completedAt(),
                task.executionTime(),
                task.pid(),
                task.outputDir(),
                task.config(),
                task.files().stream().map(FileResponse::from).toList(),
                task.outputs().stream().map(OutputResponse::from).toList(),
                ErrorResponse.from(task.error()));
    }
}
