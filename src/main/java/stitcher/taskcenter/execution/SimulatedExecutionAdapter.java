package stitcher.taskcenter.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskType;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Fake work for demo mode: sleeps through a number of steps, reporting progress
 * and log lines, and fails at random with the configured rate.
 * Honors the pause signal and stops once the task is released.
 */
public class SimulatedExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionAdapter.class);

    public static final String SIMULATED_FAILURE = "SIMULATED_FAILURE";

    private static final long PAUSE_POLL_MS = 100;

    private final int steps;
    private final Duration stepDelay;
    private final double failRate;
    private final DoubleSupplier random;

    public SimulatedExecutionAdapter(int steps, Duration stepDelay, double failRate) {
        this(steps, stepDelay, failRate, () -> ThreadLocalRandom.current().nextDouble());
    }

    public SimulatedExecutionAdapter(int steps, Duration stepDelay, double failRate, DoubleSupplier random) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1");
        }
        this.steps = steps;
        this.stepDelay = stepDelay;
        this.failRate = failRate;
        this.random = random;
    }

    @Override
    public CompletionStage<ExecutionResult> execute(Task task, ExecutionContext context) {
        // fail at a random step, decided up front
        int failAt = failRate > 0 && random.getAsDouble() < failRate
                ? 1 + (int) (random.getAsDouble() * steps)
                : -1;

        context.log(LogLevel.INFO, "Simulating " + task.type().displayName() + " with "
                + context.threadsHint() + " threads");

        try {
            for (int step = 1; step <= steps; step++) {
                awaitResume(context);
                if (!context.isStillOwned()) {
                    log.debug("Simulated task {} released at step {}", task.id(), step);
                    throw new ExecutionException(ExecutionException.RELEASED, "Task released");
                }
                Thread.sleep(stepDelay.toMillis());

                if (step == failAt) {
                    throw new ExecutionException(SIMULATED_FAILURE, "Simulated failure at step " + step);
                }
                String label = "Step " + step + "/" + steps;
                context.progress(step * 100 / steps, label);
                context.log(LogLevel.DEBUG, label + " done");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException(ExecutionException.INTERRUPTED, "Simulation interrupted", e);
        }

        context.log(LogLevel.SUCCESS, "Simulation finished");
        return CompletableFuture.completedFuture(new ExecutionResult(List.of(outputOf(task))));
    }

    private static void awaitResume(ExecutionContext context) throws InterruptedException {
        while (context.isPaused() && context.isStillOwned()) {
            Thread.sleep(PAUSE_POLL_MS);
        }
    }

    private static TaskOutput outputOf(Task task) {
        boolean image = task.type() == TaskType.IMAGE_MATERIAL || task.type() == TaskType.COVER_FORMAT
                || task.type() == TaskType.COVER_COMPRESS || task.type() == TaskType.LOSSLESS_GRID;
        String fileName = "task-" + task.id() + (image ? ".png" : ".mp4");
        Path path = task.outputDir() != null ? Path.of(task.outputDir(), fileName) : Path.of(fileName);
        return TaskOutput.of(path.toString(), image ? OutputKind.IMAGE : OutputKind.VIDEO, null);
    }
}
