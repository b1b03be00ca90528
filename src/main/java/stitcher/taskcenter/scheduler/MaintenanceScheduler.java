package stitcher.taskcenter.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.repository.SettingsRepository;
import stitcher.taskcenter.repository.TaskRepository;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background housekeeping: periodically deletes completed tasks older than
 * {@code keepCompletedDays}. A value of 0 or less disables the sweep.
 * Uses a single-threaded executor.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskRepository tasks;
    private final SettingsRepository settings;
    private final Duration interval;

    private volatile boolean running = false;

    public MaintenanceScheduler(TaskRepository tasks, SettingsRepository settings, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskcenter-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.tasks = tasks;
        this.settings = settings;
        this.interval = interval;
    }

    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }
        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("Retention sweep error", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Retention sweep scheduled every {}ms", intervalMs);
    }

    /**
     * Run one retention sweep now.
     *
     * @return number of deleted tasks
     */
    public int sweep() {
        int keepDays = settings.load().keepCompletedDays();
        if (keepDays <= 0) {
            log.debug("Retention sweep disabled (keepCompletedDays={})", keepDays);
            return 0;
        }
        int deleted = tasks.deleteCompleted(keepDays);
        if (deleted > 0) {
            log.info("Retention sweep removed {} completed tasks older than {} days", deleted, keepDays);
        }
        return deleted;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Maintenance scheduler stopped");
    }
}
