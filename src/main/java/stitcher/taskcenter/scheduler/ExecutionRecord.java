package stitcher.taskcenter.scheduler;

/**
 * In-memory bookkeeping of one admitted task. Owned by the scheduler thread;
 * only the released and paused flags are read from adapter threads.
 */
final class ExecutionRecord {

    private final long taskId;
    private final long startedAtMillis;
    private long pausedAtMillis;
    private long pausedTotalMillis;
    private long flushedMillis;
    private volatile boolean paused;
    private volatile boolean released;

    ExecutionRecord(long taskId, long startedAtMillis) {
        this.taskId = taskId;
        this.startedAtMillis = startedAtMillis;
    }

    long taskId() {
        return taskId;
    }

    boolean isPaused() {
        return paused;
    }

    boolean isReleased() {
        return released;
    }

    void release() {
        released = true;
    }

    void pause(long nowMillis) {
        if (!paused) {
            pausedAtMillis = nowMillis;
            paused = true;
        }
    }

    void resume(long nowMillis) {
        if (paused) {
            pausedTotalMillis += Math.max(0, nowMillis - pausedAtMillis);
            paused = false;
        }
    }

    /**
     * Busy time since admission, paused intervals excluded.
     */
    long busyMillis(long nowMillis) {
        long end = paused ? pausedAtMillis : nowMillis;
        return Math.max(0, end - startedAtMillis - pausedTotalMillis);
    }

    /**
     * Busy time not yet written to the store; marks it as written.
     */
    long takeUnflushed(long nowMillis) {
        long busy = busyMillis(nowMillis);
        long delta = busy - flushedMillis;
        flushedMillis = busy;
        return Math.max(0, delta);
    }

    /** Record that the store holds this absolute value. */
    void markFlushed(long busyMillis) {
        flushedMillis = busyMillis;
    }
}
