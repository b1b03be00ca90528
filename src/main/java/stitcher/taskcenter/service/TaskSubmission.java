package stitcher.taskcenter.service;

import stitcher.taskcenter.model.TaskFile;

import java.util.List;

/**
 * Raw submission as received from a caller, validated by {@link TaskCenterService}.
 *
 * @param type     task type wire name
 * @param name     display name, defaults to the type's display name
 * @param config   job parameters as JSON object text, null for none
 * @param priority null means 0
 * @param maxRetry null means the store default
 */
public record TaskSubmission(String type, String name, String outputDir, String config, List<TaskFile> files,
        Integer priority, Integer maxRetry) {
}
