package stitcher.taskcenter.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.ValidationException;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSettingsRepositoryTest {

    private static Database db;
    private static JdbcSettingsRepository settings;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-settings-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        settings = new JdbcSettingsRepository(db, new ObjectMapper());
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanConfig() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM config");
            conn.commit();
        }
    }

    @Test
    void emptyStoreLoadsDefaults() {
        assertEquals(TaskCenterSettings.defaults(), settings.load());
        assertTrue(settings.get("maxConcurrentTasks").isEmpty());
    }

    @Test
    void seedDefaultsOnlyFillsMissingKeys() {
        settings.set(SettingKey.MAX_CONCURRENT_TASKS, 6);

        assertEquals(SettingKey.values().length - 1, settings.seedDefaults());
        assertEquals(0, settings.seedDefaults());
        assertEquals(6, settings.load().maxConcurrentTasks());
        assertEquals(4, settings.get("threadsPerTask").orElseThrow());
    }

    @Test
    void setManyIsPartialUpdate() {
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("autoRetryFailed", true);
        update.put("keepCompletedDays", 30);
        settings.setMany(update);

        TaskCenterSettings loaded = settings.load();
        assertTrue(loaded.autoRetryFailed());
        assertEquals(30, loaded.keepCompletedDays());
        assertEquals(2, loaded.maxConcurrentTasks());

        settings.setMany(Map.of("keepCompletedDays", 1));
        assertEquals(1, settings.load().keepCompletedDays());
        assertTrue(settings.load().autoRetryFailed());
    }

    @Test
    void setValidatesValue() {
        assertThrows(ValidationException.class, () -> settings.set(SettingKey.THREADS_PER_TASK, 0));
        assertTrue(settings.get("threadsPerTask").isEmpty());
    }

    @Test
    void badStoredValueFallsBackToDefault() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("INSERT INTO config (config_key, config_value, updated_at) "
                    + "VALUES ('maxConcurrentTasks', '\"lots\"', CURRENT_TIMESTAMP)");
            conn.commit();
        }
        assertEquals(2, settings.load().maxConcurrentTasks());
    }

    @Test
    void resetRestoresDefaults() {
        settings.setMany(Map.of("maxConcurrentTasks", 8, "autoStartTasks", false));
        settings.resetToDefault();
        assertEquals(TaskCenterSettings.defaults(), settings.load());
    }
}
