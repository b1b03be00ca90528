package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stitcher.taskcenter.service.TaskSubmission;

import java.util.List;

/**
 * POST /api/v1/tasks/batch
 */
public record BatchSubmitRequest(@JsonProperty("tasks") List<SubmitTaskRequest> tasks) {

    public List<TaskSubmission> toSubmissions() {
        if (tasks == null) {
            return List.of();
        }
        return tasks.stream().map(t -> t == null ? null : t.toSubmission()).toList();
    }
}
