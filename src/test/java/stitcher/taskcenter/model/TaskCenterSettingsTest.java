package stitcher.taskcenter.model;

import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskCenterSettingsTest {

    @Test
    void defaults() {
        TaskCenterSettings s = TaskCenterSettings.defaults();
        assertEquals(2, s.maxConcurrentTasks());
        assertEquals(4, s.threadsPerTask());
        assertTrue(s.autoStartTasks());
        assertFalse(s.autoRetryFailed());
        assertEquals(3, s.maxRetryCount());
        assertEquals(7, s.keepCompletedDays());
    }

    @Test
    void fromMergesOverDefaults() {
        TaskCenterSettings s = TaskCenterSettings.from(Map.of(SettingKey.MAX_CONCURRENT_TASKS, 5));
        assertEquals(5, s.maxConcurrentTasks());
        assertEquals(4, s.threadsPerTask());
        assertEquals(5, s.asMap().get("maxConcurrentTasks"));
        assertEquals(SettingKey.values().length, s.asMap().size());
    }

    @Test
    void validateCoercesAndRejects() {
        assertEquals(3, SettingKey.MAX_CONCURRENT_TASKS.validate(3L));
        assertEquals(3, SettingKey.MAX_CONCURRENT_TASKS.validate(3.0));
        assertEquals(true, SettingKey.AUTO_START_TASKS.validate(true));

        assertThrows(ValidationException.class, () -> SettingKey.MAX_CONCURRENT_TASKS.validate(0));
        assertThrows(ValidationException.class, () -> SettingKey.MAX_CONCURRENT_TASKS.validate(1.5));
        assertThrows(ValidationException.class, () -> SettingKey.MAX_CONCURRENT_TASKS.validate("3"));
        assertThrows(ValidationException.class, () -> SettingKey.AUTO_START_TASKS.validate(1));
        assertThrows(ValidationException.class, () -> SettingKey.KEEP_COMPLETED_DAYS.validate(null));
        assertEquals(0, SettingKey.KEEP_COMPLETED_DAYS.validate(0));
    }

    @Test
    void unknownKeyRejected() {
        assertThrows(ValidationException.class, () -> SettingKey.fromKey("theme"));
        assertEquals(SettingKey.THREADS_PER_TASK, SettingKey.fromKey("threadsPerTask"));
    }

    @Test
    void autoRetryRespectsBothLimits() {
        TaskCenterSettings on = TaskCenterSettings.from(Map.of(
                SettingKey.AUTO_RETRY_FAILED, true,
                SettingKey.MAX_RETRY_COUNT, 2));
        Task base = Task.builder().id(1).type(TaskType.VIDEO_STITCH).name("n").status(TaskStatus.FAILED)
                .maxRetry(3).build();

        assertTrue(on.allowsAutoRetry(base.toBuilder().retryCount(1).build()));
        assertFalse(on.allowsAutoRetry(base.toBuilder().retryCount(2).build()), "global limit");
        assertFalse(on.allowsAutoRetry(base.toBuilder().maxRetry(1).retryCount(1).build()), "task limit");
        assertFalse(TaskCenterSettings.defaults().allowsAutoRetry(base), "flag off");
    }
}
