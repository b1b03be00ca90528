package stitcher.taskcenter.model;

import java.util.List;

/**
 * One page of tasks together with the filtered total and global stats.
 */
public record TaskPage(List<Task> tasks, int total, int page, int pageSize, TaskStats stats) {

    public TaskPage {
        tasks = List.copyOf(tasks);
    }
}
