package stitcher.taskcenter.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.execution.WorkerProcesses;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.StatusExtras;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.TaskError;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.repository.TaskLogRepository;
import stitcher.taskcenter.repository.TaskRepository;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Start-up pass over tasks left behind by a previous run.
 * <p>
 * Tasks persisted as running or paused have lost their execution record:
 * they become failed with code {@code ABANDONED}, or are retried when automatic
 * retry allows it. Queued tasks are put back into the wait list in
 * (updatedAt, id) order. A worker process that is still alive is reported, not killed.
 * Must run before {@link TaskScheduler#start()}.
 */
public class AbandonedTaskReconciler {

    private static final Logger log = LoggerFactory.getLogger(AbandonedTaskReconciler.class);

    private final TaskRepository tasks;
    private final TaskLogRepository logs;
    private final TaskScheduler scheduler;

    public AbandonedTaskReconciler(TaskRepository tasks, TaskLogRepository logs, TaskScheduler scheduler) {
        this.tasks = tasks;
        this.logs = logs;
        this.scheduler = scheduler;
    }

    public record Report(int abandoned, int retried, int requeued, int orphanedWorkers) {
    }

    public Report reconcile(TaskCenterSettings settings) {
        List<Task> active = tasks.findByStatus(EnumSet.of(TaskStatus.RUNNING, TaskStatus.PAUSED));
        List<Task> queued = tasks.findByStatus(EnumSet.of(TaskStatus.QUEUED));

        int orphans = 0;
        List<Task> toRetry = new ArrayList<>();
        for (Task task : active) {
            if (scheduler.isScheduled(task.id())) {
                continue;
            }
            if (task.pid() != null && WorkerProcesses.findAlive(task.pid(), task.pidStartedAt()).isPresent()) {
                orphans++;
                log.warn("Task {} left an orphaned worker process pid={}", task.id(), task.pid());
            }

            TaskError error = new TaskError(TaskError.ABANDONED,
                    "Task was " + task.status().wireName() + " when the application stopped", null);
            tasks.updateStatus(task.id(), TaskStatus.FAILED, StatusExtras.failure(error, task.executionTime()));
            logs.append(task.id(), LogLevel.ERROR, error.message(), null);
            log.warn("Task {} abandoned in status {}", task.id(), task.status().wireName());

            if (settings.allowsAutoRetry(task)) {
                toRetry.add(task);
            }
        }

        int requeued = 0;
        for (Task task : queued) {
            if (scheduler.restoreQueued(task.id())) {
                requeued++;
            }
        }

        int retried = 0;
        for (Task task : toRetry) {
            if (scheduler.retry(task.id())) {
                retried++;
            }
        }

        Report report = new Report(active.size(), retried, requeued, orphans);
        if (!active.isEmpty() || !queued.isEmpty()) {
            log.info("Reconciled tasks: {}", report);
        }
        return report;
    }
}
