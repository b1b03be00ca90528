package stitcher.taskcenter.model;

/**
 * Optional field writes accompanying a status change. Null means "leave as is".
 *
 * @param executionTime absolute busy milliseconds of the current run
 * @param clearStep     write null into currentStep
 * @param clearError    remove stored error fields
 */
public record StatusExtras(Integer progress, String currentStep, boolean clearStep, TaskError error,
        boolean clearError, Long executionTime) {

    private static final StatusExtras NONE = new StatusExtras(null, null, false, null, false, null);

    public static StatusExtras none() {
        return NONE;
    }

    public static StatusExtras failure(TaskError error, long executionTime) {
        return new StatusExtras(null, null, false, error, false, executionTime);
    }

    /** A new run: progress back to 0, no step, time counter restarted. Errors are kept. */
    public static StatusExtras freshRun() {
        return new StatusExtras(0, null, true, null, false, 0L);
    }

    public static StatusExtras success(long executionTime) {
        return new StatusExtras(100, null, true, null, true, executionTime);
    }

    public static StatusExtras executionTime(long executionTime) {
        return new StatusExtras(null, null, false, null, false, executionTime);
    }
}
