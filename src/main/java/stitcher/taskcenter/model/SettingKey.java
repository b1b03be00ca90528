package stitcher.taskcenter.model;

/**
 * Known keys of the config store, with their value type and default.
 */
public enum SettingKey {
    MAX_CONCURRENT_TASKS("maxConcurrentTasks", Integer.class, 2, 1),
    THREADS_PER_TASK("threadsPerTask", Integer.class, 4, 1),
    AUTO_START_TASKS("autoStartTasks", Boolean.class, true, 0),
    AUTO_RETRY_FAILED("autoRetryFailed", Boolean.class, false, 0),
    MAX_RETRY_COUNT("maxRetryCount", Integer.class, 3, 0),
    SHOW_NOTIFICATION("showNotification", Boolean.class, true, 0),
    KEEP_COMPLETED_DAYS("keepCompletedDays", Integer.class, 7, 0),
    AUTO_BACKUP("autoBackup", Boolean.class, true, 0),
    MAX_BACKUP_COUNT("maxBackupCount", Integer.class, 5, 0);

    private final String key;
    private final Class<?> valueType;
    private final Object defaultValue;
    private final int minimum;

    SettingKey(String key, Class<?> valueType, Object defaultValue, int minimum) {
        this.key = key;
        this.valueType = valueType;
        this.defaultValue = defaultValue;
        this.minimum = minimum;
    }

    public String key() {
        return key;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * Check a candidate value's type and range.
     *
     * @return the value coerced to this key's type
     * @throws ValidationException if the value does not fit
     */
    public Object validate(Object value) {
        if (value == null) {
            throw new ValidationException(key + " must not be null");
        }
        if (valueType == Boolean.class) {
            if (value instanceof Boolean) {
                return value;
            }
            throw new ValidationException(key + " must be a boolean");
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new ValidationException(key + " must be an integer");
        }
        int intValue = number.intValue();
        if (intValue < minimum) {
            throw new ValidationException(key + " must be >= " + minimum);
        }
        return intValue;
    }

    public static SettingKey fromKey(String key) {
        for (SettingKey k : values()) {
            if (k.key.equals(key)) {
                return k;
            }
        }
        throw new ValidationException("unknown config key: " + key);
    }
}
