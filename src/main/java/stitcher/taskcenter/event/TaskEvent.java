package stitcher.taskcenter.event;

import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.TaskStatus;

import java.time.Instant;

/**
 * A change to one task, as published to listeners.
 *
 * @param status   status after the change, null for log and delete events
 * @param progress progress after the change, only for progress events
 * @param message  step text, log line or error message depending on the type
 * @param level    log level, only for log events
 */
public record TaskEvent(Type type, long taskId, TaskStatus status, Integer progress, String message,
        LogLevel level, Instant at) {

    public enum Type {
        CREATED,
        UPDATED,
        STARTED,
        PROGRESS,
        LOG,
        COMPLETED,
        FAILED,
        CANCELLED,
        DELETED
    }

    public static TaskEvent of(Type type, long taskId, TaskStatus status) {
        return new TaskEvent(type, taskId, status, null, null, null, Instant.now());
    }

    public static TaskEvent failed(long taskId, String message) {
        return new TaskEvent(Type.FAILED, taskId, TaskStatus.FAILED, null, message, null, Instant.now());
    }

    public static TaskEvent progress(long taskId, int progress, String step) {
        return new TaskEvent(Type.PROGRESS, taskId, null, progress, step, null, Instant.now());
    }

    public static TaskEvent log(long taskId, LogLevel level, String message) {
        return new TaskEvent(Type.LOG, taskId, null, null, message, level, Instant.now());
    }

    public static TaskEvent deleted(long taskId) {
        return new TaskEvent(Type.DELETED, taskId, null, null, null, null, Instant.now());
    }
}
