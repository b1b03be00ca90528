package stitcher.taskcenter.model;

/**
 * Snapshot of the scheduler's in-memory state.
 *
 * @param running      tasks holding an execution record (paused ones included)
 * @param paused       of those, how many are paused
 * @param queued       tasks in the wait list
 * @param totalThreads advisory: running * threadsPerTask
 */
public record QueueStatus(int running, int paused, int queued, int maxConcurrent, int threadsPerTask,
        int totalThreads) {
}
