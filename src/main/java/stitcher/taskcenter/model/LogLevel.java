package stitcher.taskcenter.model;

/**
 * Severity of a task log line.
 */
public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    SUCCESS,
    DEBUG;

    public String wireName() {
        return name().toLowerCase();
    }

    public static LogLevel fromWire(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        for (LogLevel l : values()) {
            if (l.wireName().equalsIgnoreCase(value.trim())) {
                return l;
            }
        }
        throw new ValidationException("unknown log level: " + value);
    }
}
