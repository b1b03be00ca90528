package stitcher.taskcenter.execution;

import stitcher.taskcenter.Await;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real shell workers.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessExecutionAdapterTest {

    private ProcessExecutionAdapter adapter;

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.close();
        }
    }

    private static Task task() {
        return Task.builder().id(3).type(TaskType.VIDEO_RESIZE).name("resize").status(TaskStatus.RUNNING).build();
    }

    private ProcessExecutionAdapter shell(String script, List<Path> outputs) {
        adapter = new ProcessExecutionAdapter(
                (task, threads) -> new ProcessSpec(List.of("sh", "-c", script), null,
                        Map.of("THREADS", Integer.toString(threads)), outputs),
                ProgressParser.percent(), Duration.ofMillis(50));
        return adapter;
    }

    @Test
    void outputLinesBecomeLogsAndProgress(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("result.mp4");
        ProcessExecutionAdapter adapter = shell(
                "echo 'encoding 40%'; echo '' ; echo \"threads=$THREADS\"; echo 'oops' 1>&2; "
                        + "printf 'data' > '" + out + "'",
                List.of(out, dir.resolve("missing.mp4")));
        RecordingContext context = new RecordingContext();

        ExecutionResult result = adapter.execute(task(), context).toCompletableFuture().get(10, TimeUnit.SECONDS);

        assertEquals(List.of("encoding 40%", "threads=2", "oops"), context.messages());
        assertTrue(context.lines.stream().allMatch(l -> l.level() == LogLevel.INFO));
        assertEquals(List.of(40, 100), context.progress);
        assertEquals(1, context.attachedPids.size());
        assertTrue(context.detached);

        assertEquals(1, result.outputs().size());
        assertEquals(out.toString(), result.outputs().get(0).path());
        assertEquals(OutputKind.VIDEO, result.outputs().get(0).kind());
        assertEquals(4L, result.outputs().get(0).size());
    }

    @Test
    void nonZeroExitFails() {
        ProcessExecutionAdapter adapter = shell("echo failing; exit 3", List.of());
        RecordingContext context = new RecordingContext();

        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.execute(task(), context));

        assertEquals(ExecutionException.PROCESS_EXIT, e.code());
        assertTrue(e.getMessage().contains("3"));
        assertTrue(context.detached);
    }

    @Test
    void missingExecutableFailsToStart() {
        adapter = new ProcessExecutionAdapter(
                (task, threads) -> ProcessSpec.of(List.of("/nonexistent/worker-binary")));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.execute(task(), new RecordingContext()));
        assertEquals(ExecutionException.PROCESS_START, e.code());
    }

    @Test
    void releasedTaskKillsSilentWorker() throws Exception {
        ProcessExecutionAdapter adapter = shell("sleep 30", List.of());
        RecordingContext context = new RecordingContext();

        CompletableFuture<ExecutionResult> run = CompletableFuture.supplyAsync(
                () -> adapter.execute(task(), context).toCompletableFuture().join());
        Await.until("worker attached", () -> !context.attachedPids.isEmpty());
        long pid = context.attachedPids.get(0);

        context.owned = false;

        Await.until("worker destroyed", Duration.ofSeconds(10),
                () -> ProcessHandle.of(pid).map(h -> !h.isAlive()).orElse(true));
        Exception e = assertThrows(Exception.class, () -> run.get(10, TimeUnit.SECONDS));
        ExecutionException cause = (ExecutionException) e.getCause();
        assertEquals(ExecutionException.RELEASED, cause.code());
    }
}
