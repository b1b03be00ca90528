package stitcher.taskcenter.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle status.
 * Persisted by its lowercase wire name.
 */
public enum TaskStatus {
    /** Created, not yet queued */
    PENDING,
    /** Waiting in the scheduler's FIFO list */
    QUEUED,
    /** Admitted and handed to an execution adapter */
    RUNNING,
    /** Admitted, time accounting frozen */
    PAUSED,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error */
    FAILED,
    /** Cancelled by the user */
    CANCELLED;

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Running or paused: an execution record exists for the task. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public static TaskStatus fromWire(String value) {
        if (value == null) {
            throw new ValidationException("status is required");
        }
        for (TaskStatus s : values()) {
            if (s.wireName().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new ValidationException("unknown task status: " + value);
    }
}
