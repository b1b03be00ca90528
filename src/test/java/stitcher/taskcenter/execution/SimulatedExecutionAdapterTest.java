package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedExecutionAdapterTest {

    private static Task task(TaskType type) {
        return Task.builder().id(7).type(type).name("demo").status(TaskStatus.RUNNING).outputDir("/out").build();
    }

    @Test
    void reportsEveryStepAndProducesOutput() throws Exception {
        SimulatedExecutionAdapter adapter = new SimulatedExecutionAdapter(4, Duration.ZERO, 0.0);
        RecordingContext context = new RecordingContext();

        ExecutionResult result = adapter.execute(task(TaskType.VIDEO_STITCH), context)
                .toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(25, 50, 75, 100), context.progress);
        assertEquals(LogLevel.SUCCESS, context.lines.get(context.lines.size() - 1).level());
        TaskOutput output = result.outputs().get(0);
        assertEquals(Path.of("/out", "task-7.mp4").toString(), output.path());
        assertEquals(OutputKind.VIDEO, output.kind());
    }

    @Test
    void imageJobsProduceImages() throws Exception {
        SimulatedExecutionAdapter adapter = new SimulatedExecutionAdapter(1, Duration.ZERO, 0.0);
        ExecutionResult result = adapter.execute(task(TaskType.COVER_FORMAT), new RecordingContext())
                .toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertEquals(OutputKind.IMAGE, result.outputs().get(0).kind());
    }

    @Test
    void failsWithSimulatedCode() {
        // first draw decides to fail, second picks step 1 of 3
        double[] draws = {0.1, 0.0};
        int[] next = {0};
        SimulatedExecutionAdapter adapter = new SimulatedExecutionAdapter(3, Duration.ZERO, 0.5,
                () -> draws[next[0]++]);
        RecordingContext context = new RecordingContext();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.execute(task(TaskType.VIDEO_MERGE), context));

        assertEquals(SimulatedExecutionAdapter.SIMULATED_FAILURE, e.code());
        assertTrue(context.progress.isEmpty());
    }

    @Test
    void stopsOnceReleased() {
        SimulatedExecutionAdapter adapter = new SimulatedExecutionAdapter(3, Duration.ZERO, 0.0);
        RecordingContext context = new RecordingContext();
        context.owned = false;

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.execute(task(TaskType.VIDEO_MERGE), context));
        assertEquals(ExecutionException.RELEASED, e.code());
    }

    @Test
    void waitsWhilePaused() throws Exception {
        SimulatedExecutionAdapter adapter = new SimulatedExecutionAdapter(2, Duration.ZERO, 0.0);
        RecordingContext context = new RecordingContext();
        context.paused = true;

        CompletableFuture<ExecutionResult> run = CompletableFuture.supplyAsync(() ->
                adapter.execute(task(TaskType.VIDEO_MERGE), context).toCompletableFuture().join());

        Thread.sleep(300);
        assertTrue(context.progress.isEmpty(), "no step runs while paused");
        assertFalse(run.isDone());

        context.paused = false;
        run.get(5, TimeUnit.SECONDS);
        assertEquals(List.of(50, 100), context.progress);
    }

    @Test
    void rejectsZeroSteps() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedExecutionAdapter(0, Duration.ZERO, 0.0));
    }
}
