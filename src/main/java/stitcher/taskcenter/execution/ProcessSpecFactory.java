package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.Task;

/**
 * Builds the worker command for a task.
 */
@FunctionalInterface
public interface ProcessSpecFactory {

    ProcessSpec create(Task task, int threadsHint);
}
