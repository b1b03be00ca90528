package stitcher.taskcenter.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed snapshot of the config store, merged over defaults.
 */
public record TaskCenterSettings(
        int maxConcurrentTasks,
        int threadsPerTask,
        boolean autoStartTasks,
        boolean autoRetryFailed,
        int maxRetryCount,
        boolean showNotification,
        int keepCompletedDays,
        boolean autoBackup,
        int maxBackupCount) {

    public static TaskCenterSettings defaults() {
        return from(Map.of());
    }

    /**
     * Build a snapshot from stored values; missing keys fall back to defaults.
     */
    public static TaskCenterSettings from(Map<SettingKey, Object> values) {
        Map<SettingKey, Object> merged = new EnumMap<>(SettingKey.class);
        for (SettingKey k : SettingKey.values()) {
            merged.put(k, values.getOrDefault(k, k.defaultValue()));
        }
        return new TaskCenterSettings(
                (Integer) merged.get(SettingKey.MAX_CONCURRENT_TASKS),
                (Integer) merged.get(SettingKey.THREADS_PER_TASK),
                (Boolean) merged.get(SettingKey.AUTO_START_TASKS),
                (Boolean) merged.get(SettingKey.AUTO_RETRY_FAILED),
                (Integer) merged.get(SettingKey.MAX_RETRY_COUNT),
                (Boolean) merged.get(SettingKey.SHOW_NOTIFICATION),
                (Integer) merged.get(SettingKey.KEEP_COMPLETED_DAYS),
                (Boolean) merged.get(SettingKey.AUTO_BACKUP),
                (Integer) merged.get(SettingKey.MAX_BACKUP_COUNT));
    }

    /**
     * Whether a failed task should be retried automatically: the flag is on and the
     * retry count is below both the task's own limit and the global one.
     */
    public boolean allowsAutoRetry(Task task) {
        return autoRetryFailed && task.retryCount() < Math.min(task.maxRetry(), maxRetryCount);
    }

    /** Key/value view in declaration order, keyed by wire name. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SettingKey.MAX_CONCURRENT_TASKS.key(), maxConcurrentTasks);
        map.put(SettingKey.THREADS_PER_TASK.key(), threadsPerTask);
        map.put(SettingKey.AUTO_START_TASKS.key(), autoStartTasks);
        map.put(SettingKey.AUTO_RETRY_FAILED.key(), autoRetryFailed);
        map.put(SettingKey.MAX_RETRY_COUNT.key(), maxRetryCount);
        map.put(SettingKey.SHOW_NOTIFICATION.key(), showNotification);
        map.put(SettingKey.KEEP_COMPLETED_DAYS.key(), keepCompletedDays);
        map.put(SettingKey.AUTO_BACKUP.key(), autoBackup);
        map.put(SettingKey.MAX_BACKUP_COUNT.key(), maxBackupCount);
        return map;
    }
}
