package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskOutput;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Adapter whose runs finish only when the test says so.
 */
public final class ControlledExecutionAdapter implements ExecutionAdapter {

    private final Map<Long, CompletableFuture<ExecutionResult>> runs = new ConcurrentHashMap<>();
    private final Map<Long, ExecutionContext> contexts = new ConcurrentHashMap<>();
    private final List<Long> started = new CopyOnWriteArrayList<>();

    @Override
    public CompletionStage<ExecutionResult> execute(Task task, ExecutionContext context) {
        CompletableFuture<ExecutionResult> run = new CompletableFuture<>();
        runs.put(task.id(), run);
        contexts.put(task.id(), context);
        started.add(task.id());
        return run;
    }

    /** Task ids in the order their runs started; a retried task appears again. */
    public List<Long> started() {
        return List.copyOf(started);
    }

    public int runsOf(long taskId) {
        return (int) started.stream().filter(id -> id == taskId).count();
    }

    public ExecutionContext context(long taskId) {
        return contexts.get(taskId);
    }

    public void succeed(long taskId, TaskOutput... outputs) {
        runs.get(taskId).complete(new ExecutionResult(List.of(outputs)));
    }

    public void fail(long taskId, Throwable error) {
        runs.get(taskId).completeExceptionally(error);
    }
}
