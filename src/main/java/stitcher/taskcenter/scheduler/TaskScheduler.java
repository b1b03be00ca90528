package stitcher.taskcenter.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.event.EventSink;
import stitcher.taskcenter.event.TaskEvent;
import stitcher.taskcenter.execution.ExecutionAdapter;
import stitcher.taskcenter.execution.ExecutionAdapterRegistry;
import stitcher.taskcenter.execution.ExecutionContext;
import stitcher.taskcenter.execution.ExecutionResult;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.QueueStatus;
import stitcher.taskcenter.model.StatusExtras;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.TaskError;
import stitcher.taskcenter.model.TaskLifecycle;
import stitcher.taskcenter.model.TaskNotFoundException;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.repository.TaskLogRepository;
import stitcher.taskcenter.repository.TaskRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded-concurrency task scheduler.
 * <p>
 * All state (the FIFO wait list and the running records) is confined to one
 * scheduler thread. Public methods called from other threads are marshalled onto
 * it and block for the result. Adapters run on a separate worker pool; their
 * outcomes and reports are posted back to the scheduler thread, where a report
 * for a released task is dropped.
 * <p>
 * Admission is strict FIFO: while fewer than {@code maxConcurrentTasks} records
 * exist, the head of the wait list is started. Paused tasks keep their slot.
 */
public final class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskRepository tasks;
    private final TaskLogRepository logs;
    private final ExecutionAdapterRegistry adapters;
    private final EventSink events;
    private final Clock clock;
    private final Duration tick;

    private final ScheduledExecutorService loop;
    private final ExecutorService workers;
    private volatile Thread loopThread;

    // confined to the scheduler thread
    private final Deque<Long> waiting = new ArrayDeque<>();
    private final Map<Long, ExecutionRecord> running = new LinkedHashMap<>();
    private int maxConcurrent;
    private volatile int threadsPerTask;
    private boolean admitting = false;
    private volatile boolean closed = false;

    public TaskScheduler(TaskRepository tasks,
            TaskLogRepository logs,
            ExecutionAdapterRegistry adapters,
            EventSink events,
            TaskCenterSettings settings,
            Clock clock,
            Duration tick) {
        this.tasks = tasks;
        this.logs = logs;
        this.adapters = adapters;
        this.events = events;
        this.clock = clock;
        this.tick = tick;
        this.maxConcurrent = settings.maxConcurrentTasks();
        this.threadsPerTask = settings.threadsPerTask();

        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskcenter-scheduler");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskcenter-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start admitting waiting tasks and the execution-time tick.
     * Tasks enqueued before this call wait in FIFO order.
     */
    public void start() {
        onLoop(() -> {
            if (admitting) {
                log.warn("Scheduler already started");
                return null;
            }
            admitting = true;
            long tickMs = tick.toMillis();
            loop.scheduleAtFixedRate(this::flushSafely, tickMs, tickMs, TimeUnit.MILLISECONDS);
            log.info("Scheduler started: maxConcurrent={}, threadsPerTask={}, waiting={}",
                    maxConcurrent, threadsPerTask, waiting.size());
            admit();
            return null;
        });
    }

    // ==================== Control ====================

    /**
     * Queue a pending, failed or cancelled task.
     *
     * @return false if the task's status does not allow a start or it is already scheduled
     * @throws TaskNotFoundException if the task does not exist
     */
    public boolean enqueue(long taskId) {
        return onLoop(() -> enqueueOnLoop(taskId));
    }

    /**
     * Append a task already persisted as queued, keeping its status.
     * Used when rebuilding the wait list at start-up.
     */
    public boolean restoreQueued(long taskId) {
        return onLoop(() -> {
            if (isScheduled(taskId)) {
                return false;
            }
            waiting.addLast(taskId);
            admit();
            return true;
        });
    }

    /**
     * Freeze time accounting of a running task and persist it as paused.
     * The worker is only signalled, not stopped.
     */
    public boolean pause(long taskId) {
        return onLoop(() -> pauseOnLoop(taskId));
    }

    public boolean resume(long taskId) {
        return onLoop(() -> resumeOnLoop(taskId));
    }

    /**
     * Cancel a queued or running task. A running task's record is released so
     * its adapter stops; the next waiting task is admitted.
     *
     * @return false if the task is neither queued nor running (e.g. a second cancel)
     * @throws TaskNotFoundException if the task does not exist
     */
    public boolean cancel(long taskId) {
        return onLoop(() -> cancelOnLoop(taskId));
    }

    /**
     * Move a failed, cancelled or completed task back to pending, count the
     * retry, and queue it.
     *
     * @return false if the status does not allow a retry
     */
    public boolean retry(long taskId) {
        return onLoop(() -> {
            Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            if (!TaskLifecycle.canRetry(task.status())) {
                log.warn("Retry rejected for task {} in status {}", taskId, task.status().wireName());
                return false;
            }
            tasks.updateStatus(taskId, TaskStatus.PENDING, StatusExtras.none());
            tasks.incrementRetryCount(taskId);
            log.info("Task {} retry #{} requested", taskId, task.retryCount() + 1);
            emit(TaskEvent.of(TaskEvent.Type.UPDATED, taskId, TaskStatus.PENDING));
            return enqueueOnLoop(taskId);
        });
    }

    public int pauseAll() {
        return onLoop(() -> {
            int count = 0;
            for (Long taskId : new ArrayList<>(running.keySet())) {
                if (pauseOnLoop(taskId)) {
                    count++;
                }
            }
            return count;
        });
    }

    public int resumeAll() {
        return onLoop(() -> {
            int count = 0;
            for (Long taskId : new ArrayList<>(running.keySet())) {
                if (resumeOnLoop(taskId)) {
                    count++;
                }
            }
            return count;
        });
    }

    /**
     * Drain the wait list, then cancel every running task.
     *
     * @return number of cancelled tasks
     */
    public int cancelAll() {
        return onLoop(() -> {
            int count = 0;
            for (Long taskId : new ArrayList<>(waiting)) {
                if (cancelOnLoop(taskId)) {
                    count++;
                }
            }
            for (Long taskId : new ArrayList<>(running.keySet())) {
                if (cancelOnLoop(taskId)) {
                    count++;
                }
            }
            return count;
        });
    }

    /**
     * Take new concurrency settings and re-run admission. Lowering the ceiling
     * never stops running tasks.
     */
    public void applySettings(TaskCenterSettings settings) {
        onLoop(() -> {
            if (settings.maxConcurrentTasks() != maxConcurrent || settings.threadsPerTask() != threadsPerTask) {
                log.info("Concurrency changed: maxConcurrent {} -> {}, threadsPerTask {} -> {}",
                        maxConcurrent, settings.maxConcurrentTasks(), threadsPerTask, settings.threadsPerTask());
            }
            maxConcurrent = settings.maxConcurrentTasks();
            threadsPerTask = settings.threadsPerTask();
            admit();
            return null;
        });
    }

    public QueueStatus queueStatus() {
        return onLoop(() -> {
            int paused = (int) running.values().stream().filter(ExecutionRecord::isPaused).count();
            return new QueueStatus(running.size(), paused, waiting.size(), maxConcurrent, threadsPerTask,
                    running.size() * threadsPerTask);
        });
    }

    /**
     * Whether the task is in the wait list or holds an execution record.
     */
    public boolean isScheduled(long taskId) {
        return onLoop(() -> waiting.contains(taskId) || running.containsKey(taskId));
    }

    /** Wait list in admission order. */
    public List<Long> waitingTasks() {
        return onLoop(() -> List.copyOf(waiting));
    }

    // ==================== Loop-side operations ====================

    private boolean enqueueOnLoop(long taskId) {
        Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (isScheduled(taskId)) {
            log.debug("Task {} already scheduled", taskId);
            return false;
        }
        if (!TaskLifecycle.canStart(task.status())) {
            log.warn("Start rejected for task {} in status {}", taskId, task.status().wireName());
            return false;
        }
        tasks.updateStatus(taskId, TaskStatus.QUEUED, StatusExtras.none());
        waiting.addLast(taskId);
        log.info("Task {} queued (position {})", taskId, waiting.size());
        emit(TaskEvent.of(TaskEvent.Type.UPDATED, taskId, TaskStatus.QUEUED));
        admit();
        return true;
    }

    private boolean pauseOnLoop(long taskId) {
        ExecutionRecord record = running.get(taskId);
        if (record == null || record.isPaused()) {
            return false;
        }
        long now = clock.millis();
        record.pause(now);
        long busy = record.busyMillis(now);
        try {
            tasks.updateStatus(taskId, TaskStatus.PAUSED, StatusExtras.executionTime(busy));
        } catch (RuntimeException e) {
            record.resume(now);
            throw e;
        }
        record.markFlushed(busy);
        log.info("Task {} paused after {}ms", taskId, busy);
        emit(TaskEvent.of(TaskEvent.Type.UPDATED, taskId, TaskStatus.PAUSED));
        return true;
    }

    private boolean resumeOnLoop(long taskId) {
        ExecutionRecord record = running.get(taskId);
        if (record == null || !record.isPaused()) {
            return false;
        }
        tasks.updateStatus(taskId, TaskStatus.RUNNING, StatusExtras.none());
        record.resume(clock.millis());
        log.info("Task {} resumed", taskId);
        emit(TaskEvent.of(TaskEvent.Type.UPDATED, taskId, TaskStatus.RUNNING));
        return true;
    }

    private boolean cancelOnLoop(long taskId) {
        if (waiting.contains(taskId)) {
            tasks.updateStatus(taskId, TaskStatus.CANCELLED, StatusExtras.none());
            waiting.remove(taskId);
            log.info("Queued task {} cancelled", taskId);
            appendLog(taskId, LogLevel.WARNING, "Task cancelled while queued");
            emit(TaskEvent.of(TaskEvent.Type.CANCELLED, taskId, TaskStatus.CANCELLED));
            admit();
            return true;
        }

        ExecutionRecord record = running.get(taskId);
        if (record != null) {
            long busy = record.busyMillis(clock.millis());
            tasks.updateStatus(taskId, TaskStatus.CANCELLED, StatusExtras.executionTime(busy));
            release(record);
            log.info("Running task {} cancelled after {}ms", taskId, busy);
            appendLog(taskId, LogLevel.WARNING, "Task cancelled");
            emit(TaskEvent.of(TaskEvent.Type.CANCELLED, taskId, TaskStatus.CANCELLED));
            admit();
            return true;
        }

        Task task = tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        log.warn("Cancel ignored for task {} in status {}", taskId, task.status().wireName());
        return false;
    }

    /**
     * Start waiting tasks while capacity allows. A task that fails to persist
     * as running stays at the head of the wait list.
     */
    private void admit() {
        if (!admitting || closed) {
            return;
        }
        while (running.size() < maxConcurrent && !waiting.isEmpty()) {
            long taskId = waiting.peekFirst();

            Optional<Task> queued = tasks.findById(taskId);
            if (queued.isEmpty() || queued.get().status() != TaskStatus.QUEUED) {
                waiting.pollFirst();
                log.warn("Dropping task {} from wait list: {}", taskId,
                        queued.map(t -> "status " + t.status().wireName()).orElse("deleted"));
                continue;
            }

            tasks.updateStatus(taskId, TaskStatus.RUNNING, StatusExtras.freshRun());
            waiting.pollFirst();

            ExecutionRecord record = new ExecutionRecord(taskId, clock.millis());
            running.put(taskId, record);

            Task task = tasks.findById(taskId)
                    .orElseGet(() -> TaskLifecycle.apply(queued.get(), TaskStatus.RUNNING,
                            StatusExtras.freshRun(), Instant.now(clock)));
            log.info("Task {} started ({}, {}/{} slots)", taskId, task.type().wireName(), running.size(),
                    maxConcurrent);
            appendLog(taskId, LogLevel.INFO, "Task started");
            emit(TaskEvent.of(TaskEvent.Type.STARTED, taskId, TaskStatus.RUNNING));
            launch(task, record);
        }
    }

    private void launch(Task task, ExecutionRecord record) {
        ExecutionAdapter adapter = adapters.adapterFor(task.type());
        ExecutionContext context = new RunContext(record);

        CompletableFuture
                .supplyAsync(() -> invoke(adapter, task, context), workers)
                .thenCompose(Function.identity())
                .whenComplete((result, error) -> post(() -> onFinished(record, result, error)));
    }

    private static CompletionStage<ExecutionResult> invoke(ExecutionAdapter adapter, Task task,
            ExecutionContext context) {
        try {
            CompletionStage<ExecutionResult> stage = adapter.execute(task, context);
            return stage != null ? stage : CompletableFuture.completedFuture(ExecutionResult.empty());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onFinished(ExecutionRecord record, ExecutionResult result, Throwable error) {
        long taskId = record.taskId();
        if (record.isReleased() || running.get(taskId) != record) {
            log.debug("Ignoring outcome of released task {}", taskId);
            return;
        }
        long busy = record.busyMillis(clock.millis());
        release(record);

        try {
            if (error == null) {
                List<TaskOutput> outputs = result != null ? result.outputs() : List.of();
                for (TaskOutput output : outputs) {
                    tasks.addOutput(taskId, output);
                }
                tasks.updateStatus(taskId, TaskStatus.COMPLETED, StatusExtras.success(busy));
                log.info("Task {} completed in {}ms with {} outputs", taskId, busy, outputs.size());
                appendLog(taskId, LogLevel.SUCCESS, "Task completed in " + formatDuration(busy));
                emit(TaskEvent.of(TaskEvent.Type.COMPLETED, taskId, TaskStatus.COMPLETED));
            } else {
                TaskError taskError = TaskError.from(error);
                tasks.updateStatus(taskId, TaskStatus.FAILED, StatusExtras.failure(taskError, busy));
                log.warn("Task {} failed [{}]: {}", taskId, taskError.code(), taskError.message());
                appendLog(taskId, LogLevel.ERROR, taskError.message());
                emit(TaskEvent.failed(taskId, taskError.message()));
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist outcome of task {}", taskId, e);
        }
        admit();
    }

    private void release(ExecutionRecord record) {
        record.release();
        running.remove(record.taskId());
    }

    /**
     * Write the busy-time increment of every running, unpaused task.
     */
    void flushExecutionTime() {
        onLoop(() -> {
            long now = clock.millis();
            for (ExecutionRecord record : running.values()) {
                if (record.isPaused()) {
                    continue;
                }
                long delta = record.takeUnflushed(now);
                if (delta > 0) {
                    tasks.incrementExecutionTime(record.taskId(), delta);
                }
            }
            return null;
        });
    }

    private void flushSafely() {
        try {
            flushExecutionTime();
            admit();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    // ==================== Plumbing ====================

    private <T> T onLoop(Callable<T> action) {
        if (Thread.currentThread() == loopThread) {
            try {
                return action.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        Future<T> future = loop.submit(action);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the scheduler", e);
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    private void post(Runnable action) {
        try {
            loop.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("Scheduler callback failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler closed, dropping callback");
        }
    }

    private void emit(TaskEvent event) {
        try {
            events.notify(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed on {} of task {}", event.type(), event.taskId(), e);
        }
    }

    private void appendLog(long taskId, LogLevel level, String message) {
        try {
            logs.append(taskId, level, message, null);
        } catch (RuntimeException e) {
            log.error("Failed to append log to task {}", taskId, e);
        }
    }

    private static String formatDuration(long millis) {
        long seconds = millis / 1000;
        return seconds >= 60 ? (seconds / 60) + "m " + (seconds % 60) + "s" : seconds + "." + (millis % 1000) / 100 + "s";
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        post(() -> {
            running.values().forEach(ExecutionRecord::release);
            if (!running.isEmpty()) {
                log.info("Scheduler closing with {} running tasks left for reconciliation", running.size());
            }
        });
        loop.shutdown();
        workers.shutdownNow();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Context handed to the adapter of one run. Every report is sequenced on the
     * scheduler thread and dropped once the record is released.
     */
    private final class RunContext implements ExecutionContext {

        private final ExecutionRecord record;

        RunContext(ExecutionRecord record) {
            this.record = record;
        }

        @Override
        public int threadsHint() {
            return threadsPerTask;
        }

        @Override
        public boolean isStillOwned() {
            return !record.isReleased();
        }

        @Override
        public boolean isPaused() {
            return record.isPaused();
        }

        @Override
        public void log(LogLevel level, String message, String raw) {
            long taskId = record.taskId();
            post(() -> {
                if (record.isReleased()) {
                    return;
                }
                logs.append(taskId, level, message, raw);
                emit(TaskEvent.log(taskId, level != null ? level : LogLevel.INFO, message));
            });
        }

        @Override
        public void progress(int percent, String step) {
            long taskId = record.taskId();
            int clamped = TaskLifecycle.clampProgress(percent);
            post(() -> {
                if (record.isReleased()) {
                    return;
                }
                tasks.updateProgress(taskId, clamped, step);
                log.debug("Task {} progress {}% {}", taskId, clamped, step != null ? step : "");
                emit(TaskEvent.progress(taskId, clamped, step));
            });
        }

        @Override
        public void attachProcess(long pid, Instant startedAt) {
            long taskId = record.taskId();
            post(() -> {
                if (!record.isReleased()) {
                    tasks.updatePid(taskId, pid, startedAt);
                }
            });
        }

        @Override
        public void detachProcess() {
            long taskId = record.taskId();
            post(() -> {
                if (!record.isReleased()) {
                    tasks.clearPid(taskId);
                }
            });
        }
    }
}
