package stitcher.taskcenter.model;

import java.time.Instant;
import java.util.Set;

/**
 * Filter for task listing. Empty sets and null fields mean "no restriction".
 *
 * @param search      case-insensitive substring of the task name
 * @param createdFrom inclusive lower bound on createdAt
 * @param createdTo   inclusive upper bound on createdAt
 */
public record TaskFilter(Set<TaskStatus> statuses, Set<TaskType> types, String search, Instant createdFrom,
        Instant createdTo) {

    public TaskFilter {
        statuses = statuses != null ? Set.copyOf(statuses) : Set.of();
        types = types != null ? Set.copyOf(types) : Set.of();
    }

    public static TaskFilter none() {
        return new TaskFilter(Set.of(), Set.of(), null, null, null);
    }

    public static TaskFilter byStatus(TaskStatus... statuses) {
        return new TaskFilter(Set.of(statuses), Set.of(), null, null, null);
    }
}
