package stitcher.taskcenter.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.config.AppConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Pooled access to the task center database. The schema is migrated to the
 * latest version when the pool opens.
 * <p>
 * Connections come with autocommit off: every store method commits or rolls
 * back its own work before closing the connection.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final Duration CHECKOUT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration IDLE_TIMEOUT = Duration.ofMinutes(5);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final HikariDataSource pool;

    public Database(AppConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("taskcenter-db");
        hc.setJdbcUrl(jdbcUrl);
        hc.setMaximumPoolSize(poolSize);
        hc.setMinimumIdle(Math.min(2, poolSize));
        hc.setConnectionTimeout(CHECKOUT_TIMEOUT.toMillis());
        hc.setIdleTimeout(IDLE_TIMEOUT.toMillis());
        hc.setAutoCommit(false);
        this.pool = new HikariDataSource(hc);
        log.info("Opened {} (pool size {})", jdbcUrl, poolSize);

        try {
            log.info("Schema version {}", Migrations.apply(this));
        } catch (RuntimeException e) {
            pool.close();
            throw e;
        }
    }

    /** A pooled connection; the caller commits and closes it. */
    public Connection getConnection() throws SQLException {
        return pool.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = pool.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
            log.info("Database closed");
        }
    }
}
