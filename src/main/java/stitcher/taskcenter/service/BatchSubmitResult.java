package stitcher.taskcenter.service;

import stitcher.taskcenter.model.Task;

import java.util.List;

/**
 * Outcome of a batch submission: created tasks plus per-item rejections.
 */
public record BatchSubmitResult(List<Task> tasks, List<ItemError> errors) {

    /**
     * @param index position of the rejected item in the request
     */
    public record ItemError(int index, String message) {
    }
}
