package stitcher.taskcenter.repository;

import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.TaskLog;

import java.util.List;

/**
 * Append-only per-task log lines.
 */
public interface TaskLogRepository {

    /**
     * Append one line stamped with the current time.
     *
     * @param raw unparsed payload, may be null
     * @return the stored line
     */
    TaskLog append(long taskId, LogLevel level, String message, String raw);

    /**
     * Lines of one task, oldest first.
     */
    List<TaskLog> findByTask(long taskId, int limit, int offset);

    /**
     * The newest {@code limit} lines across all tasks, returned oldest first,
     * each carrying the owning task's type.
     */
    List<TaskLog> findRecent(int limit);

    int countByTask(long taskId);

    int countAll();

    int deleteByTask(long taskId);

    /**
     * Delete every line. Reclaiming storage afterwards is up to the caller.
     */
    int deleteAll();
}
