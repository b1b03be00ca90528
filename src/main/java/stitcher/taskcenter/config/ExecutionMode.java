package stitcher.taskcenter.config;

import java.util.Locale;

/**
 * How tasks are executed: fake work for demos, or an external worker command.
 */
public enum ExecutionMode {
    SIMULATED,
    PROCESS;

    public static ExecutionMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown execution mode: " + value, e);
        }
    }
}
