package stitcher.taskcenter.model;

/**
 * Operation referenced a task id that does not exist (or was deleted).
 */
public class TaskNotFoundException extends RuntimeException {

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public long taskId() {
        return taskId;
    }
}
