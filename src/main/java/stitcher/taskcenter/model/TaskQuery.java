package stitcher.taskcenter.model;

/**
 * Listing request: filter, sort and offset pagination (pages start at 1).
 */
public record TaskQuery(TaskFilter filter, TaskSort sort, int page, int pageSize, boolean withFiles,
        boolean withOutputs) {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    public TaskQuery {
        filter = filter != null ? filter : TaskFilter.none();
        sort = sort != null ? sort : TaskSort.newestFirst();
        page = Math.max(1, page);
        pageSize = pageSize <= 0 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
    }

    public static TaskQuery firstPage(TaskFilter filter) {
        return new TaskQuery(filter, TaskSort.newestFirst(), 1, DEFAULT_PAGE_SIZE, false, false);
    }

    public long offset() {
        return (page - 1L) * pageSize;
    }
}
