package stitcher.taskcenter.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Bootstrap settings of the task center.
 * <p>
 * Sources, later ones winning: built-in defaults, an optional INI file
 * ({@code [database]}, {@code [server]}, {@code [execution]}, {@code [maintenance]}),
 * then {@code TASKCENTER_*} environment variables. Runtime tunables such as
 * concurrency live in the config store instead.
 */
public final class AppConfig {

    public static final String DEFAULT_INI = "taskcenter.ini";
    public static final String VERSION = "1.0.0";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskcenter;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 5;

    // Server settings
    private String serverHost = "127.0.0.1";
    private int serverPort = 8765;

    // Execution settings
    private ExecutionMode executionMode = ExecutionMode.SIMULATED;
    private String workerCommand = null;
    private int simulatedSteps = 10;
    private Duration simulatedStepDelay = Duration.ofMillis(500);
    private double simulatedFailRate = 0.1;
    private Duration schedulerTick = Duration.ofSeconds(1);

    // Maintenance settings
    private Duration retentionSweepInterval = Duration.ofHours(1);

    private AppConfig() {
    }

    public static AppConfig defaults() {
        return new AppConfig();
    }

    /**
     * Defaults, then {@code taskcenter.ini} in the working directory if present, then the environment.
     */
    public static AppConfig load() {
        return load(Path.of(DEFAULT_INI), System.getenv());
    }

    public static AppConfig load(Path iniFile, Map<String, String> env) {
        AppConfig config = new AppConfig();
        if (iniFile != null && Files.isRegularFile(iniFile)) {
            config.applyIni(iniFile);
        }
        config.applyEnv(env);
        return config;
    }

    /**
     * Override settings from an INI file. Missing sections and keys keep their value.
     *
     * @throws IllegalStateException if the file cannot be read
     * @throws IllegalArgumentException if a value is malformed
     */
    public AppConfig applyIni(Path iniFile) {
        Ini ini;
        try {
            ini = new Ini(iniFile.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + iniFile, e);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            databaseUrl = string(database, "url", databaseUrl);
            databasePoolSize = integer(database, "pool_size", databasePoolSize);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = string(server, "host", serverHost);
            serverPort = integer(server, "port", serverPort);
        }

        Profile.Section execution = ini.get("execution");
        if (execution != null) {
            String mode = execution.get("mode");
            if (mode != null && !mode.isBlank()) {
                executionMode = ExecutionMode.parse(mode);
            }
            workerCommand = string(execution, "worker_command", workerCommand);
            simulatedSteps = integer(execution, "simulated_steps", simulatedSteps);
            simulatedStepDelay = Duration.ofMillis(
                    integer(execution, "simulated_step_delay_ms", (int) simulatedStepDelay.toMillis()));
            simulatedFailRate = decimal(execution, "simulated_fail_rate", simulatedFailRate);
            schedulerTick = Duration.ofMillis(integer(execution, "tick_ms", (int) schedulerTick.toMillis()));
        }

        Profile.Section maintenance = ini.get("maintenance");
        if (maintenance != null) {
            retentionSweepInterval = Duration.ofMinutes(
                    integer(maintenance, "sweep_interval_minutes", (int) retentionSweepInterval.toMinutes()));
        }
        return this;
    }

    /**
     * Override settings from environment variables.
     */
    public AppConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("TASKCENTER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String host = env.get("TASKCENTER_HOST");
        if (host != null && !host.isBlank()) {
            serverHost = host;
        }

        String port = env.get("TASKCENTER_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = parseInt("TASKCENTER_PORT", port);
        }

        String mode = env.get("TASKCENTER_EXECUTION_MODE");
        if (mode != null && !mode.isBlank()) {
            executionMode = ExecutionMode.parse(mode);
        }

        String command = env.get("TASKCENTER_WORKER_COMMAND");
        if (command != null && !command.isBlank()) {
            workerCommand = command;
        }
        return this;
    }

    private static String string(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static int integer(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        return value != null && !value.isBlank() ? parseInt(section.getName() + "." + key, value) : fallback;
    }

    private static double decimal(Profile.Section section, String key, double fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(section.getName() + "." + key + " is not a number: " + value, e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public ExecutionMode executionMode() {
        return executionMode;
    }

    public String workerCommand() {
        return workerCommand;
    }

    public int simulatedSteps() {
        return simulatedSteps;
    }

    public Duration simulatedStepDelay() {
        return simulatedStepDelay;
    }

    public double simulatedFailRate() {
        return simulatedFailRate;
    }

    public Duration schedulerTick() {
        return schedulerTick;
    }

    public Duration retentionSweepInterval() {
        return retentionSweepInterval;
    }

    // Fluent setters for testing/customization
    public AppConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public AppConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public AppConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public AppConfig withExecutionMode(ExecutionMode mode) {
        this.executionMode = mode;
        return this;
    }

    public AppConfig withWorkerCommand(String command) {
        this.workerCommand = command;
        return this;
    }

    public AppConfig withSimulation(int steps, Duration stepDelay, double failRate) {
        this.simulatedSteps = steps;
        this.simulatedStepDelay = stepDelay;
        this.simulatedFailRate = failRate;
        return this;
    }

    public AppConfig withSchedulerTick(Duration tick) {
        this.schedulerTick = tick;
        return this;
    }

    public AppConfig withRetentionSweepInterval(Duration interval) {
        this.retentionSweepInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", server=" + serverHost + ":" + serverPort +
                ", executionMode=" + executionMode +
                ", schedulerTick=" + schedulerTick +
                '}';
    }
}
