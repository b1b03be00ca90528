package stitcher.taskcenter.model;

import java.util.List;

/**
 * Submission data for a new task, already validated.
 *
 * @param config   job parameters as a JSON object text
 * @param maxRetry null means the store default (3)
 */
public record NewTask(TaskType type, String name, String outputDir, String config, List<TaskFile> files,
        int priority, Integer maxRetry) {

    public NewTask {
        files = files != null ? List.copyOf(files) : List.of();
        config = config != null && !config.isBlank() ? config : "{}";
    }
}
