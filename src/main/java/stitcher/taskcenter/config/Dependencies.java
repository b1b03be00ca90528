package stitcher.taskcenter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import stitcher.taskcenter.api.v1.HealthController;
import stitcher.taskcenter.api.v1.LogController;
import stitcher.taskcenter.api.v1.SettingsController;
import stitcher.taskcenter.api.v1.TaskController;
import stitcher.taskcenter.event.TaskEventBus;
import stitcher.taskcenter.execution.CommandTemplateSpecFactory;
import stitcher.taskcenter.execution.ExecutionAdapterRegistry;
import stitcher.taskcenter.execution.ProcessExecutionAdapter;
import stitcher.taskcenter.execution.SimulatedExecutionAdapter;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.repository.SettingsRepository;
import stitcher.taskcenter.repository.TaskLogRepository;
import stitcher.taskcenter.repository.TaskRepository;
import stitcher.taskcenter.scheduler.AbandonedTaskReconciler;
import stitcher.taskcenter.scheduler.MaintenanceScheduler;
import stitcher.taskcenter.scheduler.TaskScheduler;
import stitcher.taskcenter.server.RouterHandler;
import stitcher.taskcenter.service.AutoRetryPolicy;
import stitcher.taskcenter.service.TaskCenterService;
import stitcher.taskcenter.store.Database;
import stitcher.taskcenter.store.JdbcSettingsRepository;
import stitcher.taskcenter.store.JdbcTaskLogRepository;
import stitcher.taskcenter.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(AppConfig.load());
 * deps.start(); // reconcile, then start background work
 * TaskCenterService service = deps.service();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final AppConfig config;
    private final Database database;
    private final ObjectMapper mapper;
    private final TaskRepository taskRepository;
    private final TaskLogRepository logRepository;
    private final SettingsRepository settingsRepository;
    private final TaskEventBus eventBus;
    private final ExecutionAdapterRegistry adapters;
    private final ProcessExecutionAdapter processAdapter;
    private final TaskScheduler scheduler;
    private final AbandonedTaskReconciler reconciler;
    private final MaintenanceScheduler maintenance;
    private final AutoRetryPolicy autoRetry;
    private final TaskCenterService service;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private boolean started = false;

    private Dependencies(AppConfig config, ExecutionAdapterRegistry registry) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.mapper = RouterHandler.mapper();
        Clock clock = Clock.systemUTC();

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database, clock);
        this.logRepository = new JdbcTaskLogRepository(database, clock);
        this.settingsRepository = new JdbcSettingsRepository(database, mapper, clock);
        settingsRepository.seedDefaults();
        TaskCenterSettings settings = settingsRepository.load();

        // Execution
        this.eventBus = new TaskEventBus();
        if (registry != null) {
            this.adapters = registry;
            this.processAdapter = null;
        } else if (config.executionMode() == ExecutionMode.PROCESS) {
            if (config.workerCommand() == null || config.workerCommand().isBlank()) {
                throw new IllegalStateException("execution mode 'process' requires a worker command");
            }
            this.processAdapter = new ProcessExecutionAdapter(new CommandTemplateSpecFactory(config.workerCommand()));
            this.adapters = new ExecutionAdapterRegistry().registerAll(processAdapter);
        } else {
            this.processAdapter = null;
            this.adapters = new ExecutionAdapterRegistry().registerAll(new SimulatedExecutionAdapter(
                    config.simulatedSteps(), config.simulatedStepDelay(), config.simulatedFailRate()));
        }

        // Scheduling
        this.scheduler = new TaskScheduler(taskRepository, logRepository, adapters, eventBus, settings, clock,
                config.schedulerTick());
        this.reconciler = new AbandonedTaskReconciler(taskRepository, logRepository, scheduler);
        this.maintenance = new MaintenanceScheduler(taskRepository, settingsRepository,
                config.retentionSweepInterval());
        this.autoRetry = new AutoRetryPolicy(taskRepository, settingsRepository, scheduler);
        eventBus.subscribe(autoRetry);

        // Services
        this.service = new TaskCenterService(taskRepository, logRepository, settingsRepository, scheduler, eventBus,
                mapper);

        log.info("Dependencies initialized successfully (execution mode {})", config.executionMode());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(AppConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with a caller-supplied adapter registry instead of the configured execution mode.
     */
    public static Dependencies create(AppConfig config, ExecutionAdapterRegistry registry) {
        return new Dependencies(config, registry);
    }

    /**
     * Reconcile tasks left over by a previous run, then start the scheduler and the retention sweep.
     */
    public synchronized AbandonedTaskReconciler.Report start() {
        if (started) {
            throw new IllegalStateException("already started");
        }
        started = true;
        AbandonedTaskReconciler.Report report = reconciler.reconcile(settingsRepository.load());
        scheduler.start();
        maintenance.start();
        return report;
    }

    // Getters
    public AppConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TaskLogRepository logRepository() {
        return logRepository;
    }

    public SettingsRepository settingsRepository() {
        return settingsRepository;
    }

    public TaskEventBus eventBus() {
        return eventBus;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public MaintenanceScheduler maintenance() {
        return maintenance;
    }

    public TaskCenterService service() {
        return service;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, service))
                    .registerController(new LogController(service))
                    .registerController(new TaskController(service))
                    .registerController(new SettingsController(service));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        closeQuietly("retention sweep", maintenance);
        closeQuietly("auto-retry", autoRetry);
        closeQuietly("scheduler", scheduler);
        if (processAdapter != null) {
            closeQuietly("process adapter", processAdapter);
        }
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
