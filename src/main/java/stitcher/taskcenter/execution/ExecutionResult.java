package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.TaskOutput;

import java.util.List;

/**
 * Successful outcome of a run.
 */
public record ExecutionResult(List<TaskOutput> outputs) {

    public ExecutionResult {
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static ExecutionResult empty() {
        return new ExecutionResult(List.of());
    }
}
