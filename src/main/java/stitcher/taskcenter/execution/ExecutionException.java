package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.TaskError;

/**
 * Adapter-side failure carrying a specific error code.
 */
public class ExecutionException extends RuntimeException implements TaskError.CodedFailure {

    public static final String NO_ADAPTER = "NO_ADAPTER";
    public static final String PROCESS_EXIT = "PROCESS_EXIT";
    public static final String PROCESS_START = "PROCESS_START";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String RELEASED = "RELEASED";

    private final String code;

    public ExecutionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ExecutionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
