package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.TaskType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter lookup by task type.
 */
public final class ExecutionAdapterRegistry {

    private final Map<TaskType, ExecutionAdapter> adapters = new EnumMap<>(TaskType.class);

    public synchronized ExecutionAdapterRegistry register(TaskType type, ExecutionAdapter adapter) {
        adapters.put(type, adapter);
        return this;
    }

    /** Register one adapter for every task type. */
    public synchronized ExecutionAdapterRegistry registerAll(ExecutionAdapter adapter) {
        for (TaskType type : TaskType.values()) {
            adapters.put(type, adapter);
        }
        return this;
    }

    public synchronized Optional<ExecutionAdapter> find(TaskType type) {
        return Optional.ofNullable(adapters.get(type));
    }

    /**
     * The registered adapter, or one that fails every run with {@code NO_ADAPTER}.
     */
    public ExecutionAdapter adapterFor(TaskType type) {
        return find(type).orElse((task, context) -> CompletableFuture.failedFuture(
                new ExecutionException(ExecutionException.NO_ADAPTER,
                        "No execution adapter registered for task type " + type.wireName())));
    }
}
