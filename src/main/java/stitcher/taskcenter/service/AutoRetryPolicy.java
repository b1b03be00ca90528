package stitcher.taskcenter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.event.EventSink;
import stitcher.taskcenter.event.TaskEvent;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.repository.SettingsRepository;
import stitcher.taskcenter.repository.TaskRepository;
import stitcher.taskcenter.scheduler.TaskScheduler;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Retries failed tasks automatically when {@code autoRetryFailed} is on and the
 * retry budget is not exhausted. Listens on the event bus and retries from its
 * own thread, never from inside the publishing call.
 */
public class AutoRetryPolicy implements EventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoRetryPolicy.class);

    private final TaskRepository tasks;
    private final SettingsRepository settings;
    private final TaskScheduler scheduler;
    private final ExecutorService executor;

    public AutoRetryPolicy(TaskRepository tasks, SettingsRepository settings, TaskScheduler scheduler) {
        this.tasks = tasks;
        this.settings = settings;
        this.scheduler = scheduler;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "taskcenter-auto-retry");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void notify(TaskEvent event) {
        if (event.type() != TaskEvent.Type.FAILED) {
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    maybeRetry(event.taskId());
                } catch (RuntimeException e) {
                    log.error("Automatic retry of task {} failed", event.taskId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Auto-retry closed, ignoring failure of task {}", event.taskId());
        }
    }

    /**
     * Retry the task if the policy allows it.
     *
     * @return true if a retry was issued
     */
    public boolean maybeRetry(long taskId) {
        Optional<Task> task = tasks.findById(taskId);
        if (task.isEmpty() || task.get().status() != TaskStatus.FAILED) {
            return false;
        }
        if (!settings.load().allowsAutoRetry(task.get())) {
            return false;
        }
        boolean retried = scheduler.retry(taskId);
        if (retried) {
            log.info("Task {} retried automatically (attempt {})", taskId, task.get().retryCount() + 1);
        }
        return retried;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
