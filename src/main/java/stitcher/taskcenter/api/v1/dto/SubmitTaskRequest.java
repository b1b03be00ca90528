package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.service.TaskSubmission;

import java.util.List;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 */
public record SubmitTaskRequest(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("outputDir") String outputDir,
        @JsonProperty("config") JsonNode config,
        @JsonProperty("files") List<FileRequest> files,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("maxRetry") Integer maxRetry) {

    public record FileRequest(
            @JsonProperty("path") String path,
            @JsonProperty("category") String category,
            @JsonProperty("categoryLabel") String categoryLabel) {
    }

    public TaskSubmission toSubmission() {
        List<TaskFile> taskFiles = files == null ? null
                : files.stream()
                        .map(f -> f == null ? null : TaskFile.of(f.path(), f.category(), f.categoryLabel()))
                        .toList();
        String configText = config == null || config.isNull() ? null : config.toString();
        return new TaskSubmission(type, name, outputDir, configText, taskFiles, priority, maxRetry);
    }
}
