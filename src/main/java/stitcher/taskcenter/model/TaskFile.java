package stitcher.taskcenter.model;

/**
 * One input file of a task. Order is meaningful (composition jobs).
 *
 * @param id            row id, null before persistence
 * @param path          absolute file path
 * @param category      category key, e.g. "A" or "background"
 * @param categoryLabel display label of the category
 * @param sortOrder     position within the task's input list
 */
public record TaskFile(Long id, String path, String category, String categoryLabel, int sortOrder) {

    public static TaskFile of(String path, String category, String categoryLabel) {
        return new TaskFile(null, path, category, categoryLabel, 0);
    }
}
