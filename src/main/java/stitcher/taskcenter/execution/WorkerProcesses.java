package stitcher.taskcenter.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * OS process helpers built on {@link ProcessHandle}.
 */
public final class WorkerProcesses {

    // start times reported by the OS and by the JVM may differ slightly
    private static final Duration START_TOLERANCE = Duration.ofSeconds(2);

    private WorkerProcesses() {
    }

    /**
     * Find a live process matching a recorded pid and start time.
     * A pid reused by another process (different start time) does not match.
     *
     * @param startedAt recorded start time, null skips the check
     */
    public static Optional<ProcessHandle> findAlive(long pid, Instant startedAt) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .filter(handle -> startedAt == null || handle.info().startInstant()
                        .map(actual -> Duration.between(actual, startedAt).abs().compareTo(START_TOLERANCE) <= 0)
                        .orElse(true));
    }

    /**
     * Start time of a process, falling back to now when the OS does not report it.
     */
    public static Instant startTimeOf(ProcessHandle handle) {
        return handle.info().startInstant().orElseGet(Instant::now);
    }

    /**
     * Terminate a process and all of its descendants, children first.
     */
    public static void destroyTree(ProcessHandle handle) {
        handle.descendants().forEach(ProcessHandle::destroyForcibly);
        handle.destroyForcibly();
    }
}
