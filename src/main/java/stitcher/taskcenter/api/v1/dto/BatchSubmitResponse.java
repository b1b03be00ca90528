package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import stitcher.taskcenter.service.BatchSubmitResult;

import java.util.List;

/**
 * POST /api/v1/tasks/batch
 */
public record BatchSubmitResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("errors") List<ItemError> errors) {

    public record ItemError(@JsonProperty("index") int index, @JsonProperty("error") String error) {
    }

    public static BatchSubmitResponse from(BatchSubmitResult result) {
        return new BatchSubmitResponse(
                result.tasks().stream().map(TaskResponse::from).toList(),
                result.errors().stream().map(e -> new ItemError(e.index(), e.message())).toList());
    }
}
