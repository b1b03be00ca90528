package stitcher.taskcenter.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The task state machine in one place: which edges exist, and how every
 * conditional field changes when a status is applied.
 *
 * <pre>
 * pending -> queued -> running <-> paused -> completed | failed | cancelled
 * failed | cancelled | completed -> pending   (retry / resubmission)
 * failed | cancelled -> queued                 (start)
 * queued -> cancelled
 * </pre>
 */
public final class TaskLifecycle {

    private static final Map<TaskStatus, Set<TaskStatus>> EDGES = new EnumMap<>(TaskStatus.class);

    static {
        EDGES.put(TaskStatus.PENDING, EnumSet.of(TaskStatus.QUEUED));
        EDGES.put(TaskStatus.QUEUED, EnumSet.of(TaskStatus.RUNNING, TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.RUNNING, EnumSet.of(TaskStatus.PAUSED, TaskStatus.COMPLETED, TaskStatus.FAILED,
                TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.PAUSED, EnumSet.of(TaskStatus.RUNNING, TaskStatus.COMPLETED, TaskStatus.FAILED,
                TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.COMPLETED, EnumSet.of(TaskStatus.PENDING));
        EDGES.put(TaskStatus.FAILED, EnumSet.of(TaskStatus.PENDING, TaskStatus.QUEUED));
        EDGES.put(TaskStatus.CANCELLED, EnumSet.of(TaskStatus.PENDING, TaskStatus.QUEUED));
    }

    private TaskLifecycle() {
    }

    public static boolean canTransition(TaskStatus from, TaskStatus to) {
        return EDGES.get(from).contains(to);
    }

    /** Statuses from which a task may be (re)queued by an explicit start. */
    public static boolean canStart(TaskStatus status) {
        return status == TaskStatus.PENDING || status == TaskStatus.FAILED || status == TaskStatus.CANCELLED;
    }

    /** Statuses from which retry is accepted; completed counts as a resubmission. */
    public static boolean canRetry(TaskStatus status) {
        return canTransition(status, TaskStatus.PENDING);
    }

    /**
     * Apply a status change to a task snapshot.
     * <ul>
     * <li>updatedAt is always bumped</li>
     * <li>startedAt is set only the first time the task enters running</li>
     * <li>completedAt is set on terminal statuses</li>
     * <li>the worker pid binding is dropped once the task is no longer running or paused</li>
     * <li>progress is clamped to 0..100</li>
     * </ul>
     */
    public static Task apply(Task task, TaskStatus to, StatusExtras extras, Instant now) {
        StatusExtras x = extras != null ? extras : StatusExtras.none();
        Task.Builder b = task.toBuilder()
                .status(to)
                .updatedAt(now);

        if (to == TaskStatus.RUNNING && task.startedAt() == null) {
            b.startedAt(now);
        }
        if (to.isTerminal()) {
            b.completedAt(now);
        }
        if (!to.isActive()) {
            b.pid(null).pidStartedAt(null);
        }

        if (x.progress() != null) {
            b.progress(clampProgress(x.progress()));
        }
        if (x.clearStep()) {
            b.currentStep(null);
        } else if (x.currentStep() != null) {
            b.currentStep(x.currentStep());
        }
        if (x.clearError()) {
            b.error(null);
        } else if (x.error() != null) {
            b.error(x.error());
        }
        if (x.executionTime() != null) {
            b.executionTime(Math.max(0, x.executionTime()));
        }
        return b.build();
    }

    public static int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }
}
