package stitcher.taskcenter.scheduler;

import stitcher.taskcenter.Await;
import stitcher.taskcenter.MutableClock;
import stitcher.taskcenter.event.TaskEvent;
import stitcher.taskcenter.execution.ControlledExecutionAdapter;
import stitcher.taskcenter.execution.ExecutionAdapterRegistry;
import stitcher.taskcenter.execution.ExecutionException;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.NewTask;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.QueueStatus;
import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskLog;
import stitcher.taskcenter.model.TaskNotFoundException;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.store.Database;
import stitcher.taskcenter.store.JdbcTaskLogRepository;
import stitcher.taskcenter.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scheduler behavior against a real H2 store and an adapter the test drives.
 */
class TaskSchedulerTest {

    private Database db;
    private MutableClock clock;
    private JdbcTaskRepository tasks;
    private JdbcTaskLogRepository logs;
    private ControlledExecutionAdapter adapter;
    private List<TaskEvent> events;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-scheduler-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tasks = new JdbcTaskRepository(db, clock);
        logs = new JdbcTaskLogRepository(db, clock);
        adapter = new ControlledExecutionAdapter();
        events = new CopyOnWriteArrayList<>();
        scheduler = newScheduler(new ExecutionAdapterRegistry().registerAll(adapter), 1);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        db.close();
    }

    private TaskScheduler newScheduler(ExecutionAdapterRegistry registry, int maxConcurrent) {
        TaskCenterSettings settings = TaskCenterSettings.from(Map.of(
                SettingKey.MAX_CONCURRENT_TASKS, maxConcurrent,
                SettingKey.THREADS_PER_TASK, 2));
        // long tick: execution time is flushed explicitly
        return new TaskScheduler(tasks, logs, registry, events::add, settings, clock, Duration.ofHours(1));
    }

    private long createTask(String name) {
        return createTask(TaskType.VIDEO_MERGE, name);
    }

    private long createTask(TaskType type, String name) {
        return tasks.create(new NewTask(type, name, "/out", "{}",
                List.of(TaskFile.of("/in/" + name + ".mp4", null, null)), 0, null)).id();
    }

    private TaskStatus status(long id) {
        return tasks.findById(id).orElseThrow().status();
    }

    private void awaitStatus(long id, TaskStatus expected) {
        Await.until("task " + id + " " + expected.wireName(), () -> status(id) == expected);
    }

    private void awaitStarted(long id, int runs) {
        Await.until("run " + runs + " of task " + id, () -> adapter.runsOf(id) >= runs);
    }

    @Test
    void admitsInFifoOrderWithOneSlot() {
        long a = createTask("a");
        long b = createTask("b");
        long c = createTask("c");
        assertTrue(scheduler.enqueue(a));
        assertTrue(scheduler.enqueue(b));
        assertTrue(scheduler.enqueue(c));
        assertEquals(List.of(a, b, c), scheduler.waitingTasks(), "nothing admitted before start");

        scheduler.start();
        awaitStarted(a, 1);
        assertEquals(TaskStatus.RUNNING, status(a));
        assertEquals(TaskStatus.QUEUED, status(b));
        QueueStatus queue = scheduler.queueStatus();
        assertEquals(1, queue.running());
        assertEquals(2, queue.queued());
        assertEquals(2, queue.totalThreads());

        adapter.succeed(a, TaskOutput.of("/out/a.mp4", OutputKind.VIDEO, 10L));
        awaitStarted(b, 1);
        Task done = tasks.findById(a).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(100, done.progress());
        assertNotNull(done.completedAt());
        assertEquals(1, done.outputs().size());

        adapter.succeed(b);
        awaitStarted(c, 1);
        adapter.succeed(c);
        awaitStatus(c, TaskStatus.COMPLETED);

        assertEquals(List.of(a, b, c), adapter.started());
        assertEquals(0, scheduler.queueStatus().running());
    }

    @Test
    void enqueueRejectsDuplicatesAndUnknownTasks() {
        long a = createTask("a");
        assertTrue(scheduler.enqueue(a));
        assertFalse(scheduler.enqueue(a));
        assertThrows(TaskNotFoundException.class, () -> scheduler.enqueue(999_999));
    }

    @Test
    void cancelQueuedAndRunningTasks() {
        long a = createTask("a");
        long b = createTask("b");
        long pending = createTask("pending");
        scheduler.start();
        scheduler.enqueue(a);
        scheduler.enqueue(b);
        awaitStarted(a, 1);

        assertTrue(scheduler.cancel(b));
        assertEquals(TaskStatus.CANCELLED, status(b));
        assertFalse(scheduler.cancel(b), "second cancel is a no-op");

        assertTrue(scheduler.cancel(a));
        assertEquals(TaskStatus.CANCELLED, status(a));
        assertFalse(adapter.context(a).isStillOwned());

        // a late success of the released run changes nothing
        adapter.succeed(a);
        assertFalse(scheduler.cancel(a));
        assertEquals(TaskStatus.CANCELLED, status(a));
        assertEquals(0, scheduler.queueStatus().running());

        assertFalse(scheduler.cancel(pending), "pending tasks are not scheduled");
        assertEquals(TaskStatus.PENDING, status(pending));
        assertThrows(TaskNotFoundException.class, () -> scheduler.cancel(999_999));

        assertTrue(events.stream().anyMatch(e -> e.type() == TaskEvent.Type.CANCELLED && e.taskId() == a));
    }

    @Test
    void failureIsRecordedAndRetryRunsAgain() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);

        adapter.fail(a, new ExecutionException(ExecutionException.PROCESS_EXIT, "Worker exited with code 1"));
        awaitStatus(a, TaskStatus.FAILED);
        scheduler.queueStatus(); // outcome handling finishes on the scheduler thread

        Task failed = tasks.findById(a).orElseThrow();
        assertEquals(ExecutionException.PROCESS_EXIT, failed.error().code());
        assertEquals("Worker exited with code 1", failed.error().message());
        assertNotNull(failed.completedAt());
        List<TaskLog> lines = logs.findByTask(a, 100, 0);
        assertTrue(lines.stream().anyMatch(l -> l.level() == LogLevel.ERROR));
        assertTrue(events.stream().anyMatch(e -> e.type() == TaskEvent.Type.FAILED && e.taskId() == a));

        assertTrue(scheduler.retry(a));
        awaitStarted(a, 2);
        Task rerun = tasks.findById(a).orElseThrow();
        assertEquals(1, rerun.retryCount());
        assertEquals(TaskStatus.RUNNING, rerun.status());
        assertFalse(scheduler.retry(a), "running tasks cannot be retried");

        adapter.succeed(a);
        awaitStatus(a, TaskStatus.COMPLETED);
        assertNull(tasks.findById(a).orElseThrow().error());
    }

    @Test
    void resubmittedCompletedTaskStartsWithoutOutputs() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);
        adapter.succeed(a, TaskOutput.of("/out/a.mp4", OutputKind.VIDEO, 10L));
        awaitStatus(a, TaskStatus.COMPLETED);
        scheduler.queueStatus();
        assertEquals(1, tasks.findOutputs(a).size());

        assertTrue(scheduler.retry(a));
        awaitStarted(a, 2);
        assertEquals(0, tasks.findOutputs(a).size(), "previous run's outputs are gone while re-running");

        adapter.succeed(a, TaskOutput.of("/out/a.mp4", OutputKind.VIDEO, 12L));
        awaitStatus(a, TaskStatus.COMPLETED);
        scheduler.queueStatus();
        List<TaskOutput> outputs = tasks.findOutputs(a);
        assertEquals(1, outputs.size());
        assertEquals(12L, outputs.get(0).size());
    }

    @Test
    void unexpectedExceptionGetsGenericCode() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);

        adapter.fail(a, new IllegalStateException("codec missing"));
        awaitStatus(a, TaskStatus.FAILED);
        assertEquals("EXECUTION_ERROR", tasks.findById(a).orElseThrow().error().code());
    }

    @Test
    void missingAdapterFailsTheTask() {
        scheduler.close();
        scheduler = newScheduler(new ExecutionAdapterRegistry().register(TaskType.VIDEO_MERGE, adapter), 1);
        long cover = createTask(TaskType.COVER_FORMAT, "cover");
        scheduler.start();
        scheduler.enqueue(cover);

        awaitStatus(cover, TaskStatus.FAILED);
        assertEquals(ExecutionException.NO_ADAPTER, tasks.findById(cover).orElseThrow().error().code());
    }

    @Test
    void pausedTimeIsNotCounted() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);

        clock.advance(Duration.ofSeconds(2));
        assertTrue(scheduler.pause(a));
        assertFalse(scheduler.pause(a));
        assertEquals(TaskStatus.PAUSED, status(a));
        assertEquals(2000, tasks.findById(a).orElseThrow().executionTime());
        assertTrue(adapter.context(a).isPaused());
        QueueStatus queue = scheduler.queueStatus();
        assertEquals(1, queue.running(), "a paused task keeps its slot");
        assertEquals(1, queue.paused());

        clock.advance(Duration.ofSeconds(10));
        scheduler.flushExecutionTime();
        assertEquals(2000, tasks.findById(a).orElseThrow().executionTime());

        assertTrue(scheduler.resume(a));
        assertFalse(scheduler.resume(a));
        assertEquals(TaskStatus.RUNNING, status(a));

        clock.advance(Duration.ofSeconds(3));
        scheduler.flushExecutionTime();
        assertEquals(5000, tasks.findById(a).orElseThrow().executionTime());

        adapter.succeed(a);
        awaitStatus(a, TaskStatus.COMPLETED);
        assertEquals(5000, tasks.findById(a).orElseThrow().executionTime());
    }

    @Test
    void raisingConcurrencyAdmitsWaitingTasks() {
        long a = createTask("a");
        long b = createTask("b");
        long c = createTask("c");
        scheduler.start();
        scheduler.enqueue(a);
        scheduler.enqueue(b);
        scheduler.enqueue(c);
        awaitStarted(a, 1);
        assertEquals(2, scheduler.queueStatus().queued());

        scheduler.applySettings(TaskCenterSettings.from(Map.of(SettingKey.MAX_CONCURRENT_TASKS, 3)));
        awaitStarted(c, 1);
        assertEquals(3, scheduler.queueStatus().running());

        // lowering never stops running tasks
        scheduler.applySettings(TaskCenterSettings.from(Map.of(SettingKey.MAX_CONCURRENT_TASKS, 1)));
        QueueStatus queue = scheduler.queueStatus();
        assertEquals(3, queue.running());
        assertEquals(1, queue.maxConcurrent());
        assertEquals(TaskStatus.RUNNING, status(b));
    }

    @Test
    void adapterReportsAreStoredUntilRelease() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);

        adapter.context(a).progress(40, "encoding");
        adapter.context(a).log(LogLevel.INFO, "frame=120");
        Await.until("progress stored", () -> tasks.findById(a).orElseThrow().progress() == 40);
        assertEquals("encoding", tasks.findById(a).orElseThrow().currentStep());
        Await.until("log stored", () -> logs.findByTask(a, 100, 0).stream()
                .anyMatch(l -> "frame=120".equals(l.message())));
        assertTrue(events.stream().anyMatch(e -> e.type() == TaskEvent.Type.PROGRESS && e.taskId() == a));

        scheduler.cancel(a);
        int linesAfterCancel = logs.countByTask(a);
        adapter.context(a).progress(90, "late");
        adapter.context(a).log(LogLevel.INFO, "late line");
        scheduler.queueStatus(); // drains the scheduler thread

        Task cancelled = tasks.findById(a).orElseThrow();
        assertEquals(40, cancelled.progress());
        assertEquals(TaskStatus.CANCELLED, cancelled.status());
        assertEquals(linesAfterCancel, logs.countByTask(a));
    }

    @Test
    void bulkOperations() {
        scheduler.close();
        scheduler = newScheduler(new ExecutionAdapterRegistry().registerAll(adapter), 2);
        long a = createTask("a");
        long b = createTask("b");
        long c = createTask("c");
        scheduler.start();
        scheduler.enqueue(a);
        scheduler.enqueue(b);
        scheduler.enqueue(c);
        awaitStarted(b, 1);

        assertEquals(2, scheduler.pauseAll());
        assertEquals(0, scheduler.pauseAll());
        assertEquals(2, scheduler.resumeAll());

        assertEquals(3, scheduler.cancelAll());
        assertEquals(TaskStatus.CANCELLED, status(a));
        assertEquals(TaskStatus.CANCELLED, status(b));
        assertEquals(TaskStatus.CANCELLED, status(c));
        assertEquals(0, adapter.runsOf(c), "queued task never started");
        assertFalse(scheduler.isScheduled(a));
    }

    @Test
    void deletedWaitingTaskIsDropped() {
        long a = createTask("a");
        long b = createTask("b");
        long c = createTask("c");
        scheduler.start();
        scheduler.enqueue(a);
        scheduler.enqueue(b);
        scheduler.enqueue(c);
        awaitStarted(a, 1);

        tasks.delete(b);
        adapter.succeed(a);

        awaitStarted(c, 1);
        assertEquals(0, adapter.runsOf(b));
        assertTrue(scheduler.waitingTasks().isEmpty());
    }

    @Test
    void closeLeavesRunningRowsForReconciliation() {
        long a = createTask("a");
        scheduler.start();
        scheduler.enqueue(a);
        awaitStarted(a, 1);

        scheduler.close();

        assertEquals(TaskStatus.RUNNING, status(a));
        assertThrows(IllegalStateException.class, () -> scheduler.enqueue(a));
    }
}
