package stitcher.taskcenter.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import stitcher.taskcenter.MutableClock;
import stitcher.taskcenter.model.NewTask;
import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.StatusExtras;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.store.Database;
import stitcher.taskcenter.store.JdbcSettingsRepository;
import stitcher.taskcenter.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceSchedulerTest {

    private Database db;
    private MutableClock clock;
    private JdbcTaskRepository tasks;
    private JdbcSettingsRepository settings;
    private MaintenanceScheduler maintenance;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-maintenance-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tasks = new JdbcTaskRepository(db, clock);
        settings = new JdbcSettingsRepository(db, new ObjectMapper(), clock);
        maintenance = new MaintenanceScheduler(tasks, settings, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        maintenance.close();
        db.close();
    }

    private long completedTask() {
        long id = tasks.create(new NewTask(TaskType.VIDEO_RESIZE, "r", "/out", "{}",
                List.of(TaskFile.of("/in/a.mp4", null, null)), 0, null)).id();
        tasks.updateStatus(id, TaskStatus.COMPLETED, StatusExtras.success(10));
        return id;
    }

    @Test
    void sweepDeletesCompletedTasksPastRetention() {
        long old = completedTask();
        clock.advance(Duration.ofDays(8));
        long fresh = completedTask();

        assertEquals(1, maintenance.sweep());
        assertTrue(tasks.findById(old).isEmpty());
        assertTrue(tasks.findById(fresh).isPresent());
    }

    @Test
    void zeroRetentionDisablesSweep() {
        long old = completedTask();
        clock.advance(Duration.ofDays(30));
        settings.set(SettingKey.KEEP_COMPLETED_DAYS, 0);

        assertEquals(0, maintenance.sweep());
        assertTrue(tasks.findById(old).isPresent());
    }

    @Test
    void lifecycle() {
        assertFalse(maintenance.isRunning());
        maintenance.start();
        assertTrue(maintenance.isRunning());
        maintenance.close();
        assertFalse(maintenance.isRunning());
    }
}
