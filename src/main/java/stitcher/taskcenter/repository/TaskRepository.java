package stitcher.taskcenter.repository;

import stitcher.taskcenter.model.NewTask;
import stitcher.taskcenter.model.StatusExtras;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskPage;
import stitcher.taskcenter.model.TaskQuery;
import stitcher.taskcenter.model.TaskStats;
import stitcher.taskcenter.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Task persistence.
 * The only writer of task, task file and task output rows.
 * Every method is atomic; failures surface as {@code StoreException}.
 */
public interface TaskRepository {

    /**
     * Insert a task and its input files in one transaction.
     * The task starts as pending with progress 0 and retry count 0.
     *
     * @param task validated submission
     * @return the persisted task, files included
     */
    Task create(NewTask task);

    /**
     * Find a task by ID, with its files and outputs.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(long taskId);

    /**
     * Input files of a task, in sort order.
     */
    List<TaskFile> findFiles(long taskId);

    /**
     * Produced outputs of a task, in insertion order.
     */
    List<TaskOutput> findOutputs(long taskId);

    /**
     * Filtered, sorted, paginated listing plus global stats.
     *
     * @param query listing options
     * @return the page
     */
    TaskPage list(TaskQuery query);

    /**
     * Find tasks in any of the given statuses, oldest update first.
     * Used by start-up reconciliation to rebuild the wait list.
     *
     * @param statuses statuses to match
     * @return matching tasks without files or outputs
     */
    List<Task> findByStatus(Set<TaskStatus> statuses);

    /**
     * Count per status and total execution time of completed tasks.
     */
    TaskStats stats();

    /**
     * Change a task's status. Conditional field updates follow
     * {@code TaskLifecycle.apply}; the row is locked for the read-modify-write.
     * Moving a completed task back to pending drops its outputs in the same
     * transaction.
     *
     * @param taskId the task ID
     * @param status new status
     * @param extras optional field writes
     * @return true if the task exists and was updated
     */
    boolean updateStatus(long taskId, TaskStatus status, StatusExtras extras);

    /**
     * Lightweight progress write, separate from status changes.
     *
     * @param progress clamped to 0..100
     * @param step     current step text, may be null
     * @return true if updated
     */
    boolean updateProgress(long taskId, int progress, String step);

    /**
     * Add milliseconds to the accumulated execution time.
     */
    boolean incrementExecutionTime(long taskId, long millis);

    /**
     * Add one to the retry counter.
     */
    boolean incrementRetryCount(long taskId);

    /**
     * Bind the external worker process.
     *
     * @param pid       OS process id
     * @param startedAt process start time, disambiguates PID reuse
     */
    boolean updatePid(long taskId, long pid, Instant startedAt);

    /**
     * Drop the external worker process binding.
     */
    boolean clearPid(long taskId);

    /**
     * Record one produced output.
     */
    TaskOutput addOutput(long taskId, TaskOutput output);

    /**
     * Change the destination root of a task.
     */
    boolean updateOutputDir(long taskId, String outputDir);

    /**
     * Delete a task; files, outputs and logs cascade.
     *
     * @return true if a row was deleted
     */
    boolean delete(long taskId);

    /**
     * Delete completed tasks whose completion is older than the given age.
     *
     * @param beforeDays age in days; 0 removes every completed task
     * @return number of deleted tasks
     */
    int deleteCompleted(int beforeDays);

    /**
     * Delete all failed tasks.
     */
    int deleteFailed();

    /**
     * Delete all cancelled tasks.
     */
    int deleteCancelled();
}
