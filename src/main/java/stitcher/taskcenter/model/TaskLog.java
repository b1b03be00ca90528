package stitcher.taskcenter.model;

import java.time.Instant;

/**
 * One immutable log line of a task.
 *
 * @param taskType type of the owning task, only filled by the recent-activity query
 */
public record TaskLog(long id, long taskId, Instant timestamp, LogLevel level, String message, String raw,
        TaskType taskType) {

    public TaskLog withTaskType(TaskType type) {
        return new TaskLog(id, taskId, timestamp, level, message, raw, type);
    }
}
