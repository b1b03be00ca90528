package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.Task;

import java.util.concurrent.CompletionStage;

/**
 * Performs the actual work of a task.
 * <p>
 * Implementations report through the context and must check
 * {@link ExecutionContext#isStillOwned()} regularly, aborting once it returns false.
 * Failure is signalled by throwing or by completing the stage exceptionally.
 */
@FunctionalInterface
public interface ExecutionAdapter {

    CompletionStage<ExecutionResult> execute(Task task, ExecutionContext context) throws Exception;
}
