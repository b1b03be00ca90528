package stitcher.taskcenter.model;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletionException;

/**
 * Failure details recorded on a failed task.
 */
public record TaskError(String code, String message, String stack) {

    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";
    public static final String ABANDONED = "ABANDONED";

    /**
     * Build an error record from a throwable. Completion wrappers are unwrapped;
     * a {@link CodedFailure} supplies its own code.
     */
    public static TaskError from(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        String code = t instanceof CodedFailure coded ? coded.code() : EXECUTION_ERROR;
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return new TaskError(code, message, stackTraceOf(t));
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /** Implemented by exceptions that carry a specific error code. */
    public interface CodedFailure {
        String code();
    }
}
