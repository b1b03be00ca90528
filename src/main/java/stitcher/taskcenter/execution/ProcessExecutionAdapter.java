package stitcher.taskcenter.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskOutput;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs a task as an external worker process.
 * <p>
 * Output lines (stderr merged) become INFO log lines and are fed to the progress
 * parser. A watchdog destroys the process tree once the scheduler releases the
 * task, so a silent worker is stopped too. Blocks the calling thread until the
 * process exits; the scheduler invokes adapters on its worker pool.
 */
public class ProcessExecutionAdapter implements ExecutionAdapter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionAdapter.class);

    private final ProcessSpecFactory specFactory;
    private final ProgressParser progressParser;
    private final Duration ownershipCheckInterval;
    private final ScheduledExecutorService watchdog;

    public ProcessExecutionAdapter(ProcessSpecFactory specFactory) {
        this(specFactory, ProgressParser.percent(), Duration.ofMillis(500));
    }

    public ProcessExecutionAdapter(ProcessSpecFactory specFactory, ProgressParser progressParser,
            Duration ownershipCheckInterval) {
        this.specFactory = specFactory;
        this.progressParser = progressParser != null ? progressParser : ProgressParser.none();
        this.ownershipCheckInterval = ownershipCheckInterval;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskcenter-process-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletionStage<ExecutionResult> execute(Task task, ExecutionContext context) {
        ProcessSpec spec = specFactory.create(task, context.threadsHint());

        ProcessBuilder builder = new ProcessBuilder(spec.command()).redirectErrorStream(true);
        if (spec.workingDir() != null) {
            builder.directory(spec.workingDir().toFile());
        }
        builder.environment().putAll(spec.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutionException(ExecutionException.PROCESS_START,
                    "Failed to start worker " + spec.command().get(0) + ": " + e.getMessage(), e);
        }

        ProcessHandle handle = process.toHandle();
        context.attachProcess(handle.pid(), WorkerProcesses.startTimeOf(handle));
        log.info("Task {} worker started: pid={} command={}", task.id(), handle.pid(), spec.command());

        long intervalMs = ownershipCheckInterval.toMillis();
        ScheduledFuture<?> ownershipCheck = watchdog.scheduleWithFixedDelay(() -> {
            if (!context.isStillOwned() && handle.isAlive()) {
                log.info("Task {} released, destroying worker pid={}", task.id(), handle.pid());
                WorkerProcesses.destroyTree(handle);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        int exitCode;
        try {
            pump(process, context);
            exitCode = process.waitFor();
        } catch (IOException e) {
            WorkerProcesses.destroyTree(handle);
            throw new ExecutionException(ExecutionException.PROCESS_EXIT,
                    "Lost worker output of pid " + handle.pid() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            WorkerProcesses.destroyTree(handle);
            throw new ExecutionException(ExecutionException.INTERRUPTED, "Interrupted while waiting for worker", e);
        } finally {
            ownershipCheck.cancel(false);
            context.detachProcess();
        }

        if (!context.isStillOwned()) {
            throw new ExecutionException(ExecutionException.RELEASED, "Task released while worker was running");
        }
        if (exitCode != 0) {
            throw new ExecutionException(ExecutionException.PROCESS_EXIT, "Worker exited with code " + exitCode);
        }

        context.progress(100, null);
        return CompletableFuture.completedFuture(new ExecutionResult(existingOutputs(spec.expectedOutputs())));
    }

    private void pump(Process process, ExecutionContext context) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!context.isStillOwned()) {
                    WorkerProcesses.destroyTree(process.toHandle());
                    return;
                }
                String message = line.strip();
                if (message.isEmpty()) {
                    continue;
                }
                context.log(LogLevel.INFO, message, line);
                progressParser.parse(message).ifPresent(p -> context.progress(p, null));
            }
        }
    }

    private static List<TaskOutput> existingOutputs(List<Path> expected) {
        List<TaskOutput> outputs = new ArrayList<>();
        for (Path path : expected) {
            if (!Files.isRegularFile(path)) {
                log.warn("Declared output {} does not exist", path);
                continue;
            }
            Long size = null;
            try {
                size = Files.size(path);
            } catch (IOException e) {
                log.warn("Cannot read size of {}: {}", path, e.getMessage());
            }
            outputs.add(TaskOutput.of(path.toString(), OutputKind.fromFileName(path.getFileName().toString()), size));
        }
        return outputs;
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
    }
}
