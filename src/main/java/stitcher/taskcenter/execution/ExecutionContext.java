package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.LogLevel;

import java.time.Instant;

/**
 * Capabilities handed to an adapter for one run. Reports made after the
 * scheduler released the task are dropped.
 */
public interface ExecutionContext {

    /** Advisory worker thread count. */
    int threadsHint();

    /** False once the run was cancelled or otherwise released. */
    boolean isStillOwned();

    /** Cooperative pause signal; adapters may ignore it. */
    boolean isPaused();

    void log(LogLevel level, String message, String raw);

    default void log(LogLevel level, String message) {
        log(level, message, null);
    }

    /**
     * @param percent clamped to 0..100
     * @param step    current step text, null keeps the previous one
     */
    void progress(int percent, String step);

    /** Bind the external worker process to the task. */
    void attachProcess(long pid, Instant startedAt);

    void detachProcess();
}
