package stitcher.taskcenter.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts per status plus total execution time of completed tasks.
 */
public record TaskStats(Map<TaskStatus, Integer> counts, long totalExecutionTime) {

    public TaskStats {
        EnumMap<TaskStatus, Integer> copy = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            copy.put(s, counts != null ? counts.getOrDefault(s, 0) : 0);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public int count(TaskStatus status) {
        return counts.get(status);
    }

    /** Pending, queued and paused tasks: everything that still waits for work. */
    public int waiting() {
        return count(TaskStatus.PENDING) + count(TaskStatus.QUEUED) + count(TaskStatus.PAUSED);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
