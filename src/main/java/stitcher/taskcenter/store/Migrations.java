package stitcher.taskcenter.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Versioned schema migrations. Each migration runs in its own transaction and is
 * recorded in {@code schema_version}; already applied versions are skipped.
 */
public final class Migrations {

    private static final Logger log = LoggerFactory.getLogger(Migrations.class);

    record Migration(int version, String description, List<String> statements) {
    }

    static final List<Migration> ALL = List.of(
            new Migration(1, "tasks, files, outputs, logs and config", List.of(
                    """
                            CREATE TABLE IF NOT EXISTS tasks (
                                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                                type            VARCHAR(32) NOT NULL,
                                name            VARCHAR(512) NOT NULL,
                                status          VARCHAR(16) DEFAULT 'pending' NOT NULL,
                                priority        INT DEFAULT 0 NOT NULL,
                                progress        INT DEFAULT 0 NOT NULL,
                                current_step    VARCHAR(1024),
                                retry_count     INT DEFAULT 0 NOT NULL,
                                max_retry       INT DEFAULT 3 NOT NULL,
                                created_at      TIMESTAMP NOT NULL,
                                updated_at      TIMESTAMP NOT NULL,
                                started_at      TIMESTAMP,
                                completed_at    TIMESTAMP,
                                execution_time  BIGINT DEFAULT 0 NOT NULL,
                                pid             BIGINT,
                                pid_started_at  TIMESTAMP,
                                output_dir      VARCHAR(2048) NOT NULL,
                                config          CLOB NOT NULL,
                                error_code      VARCHAR(64),
                                error_message   CLOB,
                                error_stack     CLOB,
                                CONSTRAINT chk_tasks_status CHECK (status IN
                                    ('pending', 'queued', 'running', 'paused', 'completed', 'failed', 'cancelled')),
                                CONSTRAINT chk_tasks_progress CHECK (progress BETWEEN 0 AND 100)
                            )
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS task_files (
                                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                                task_id         BIGINT NOT NULL,
                                file_path       VARCHAR(2048) NOT NULL,
                                category        VARCHAR(64),
                                category_label  VARCHAR(128),
                                sort_order      INT DEFAULT 0 NOT NULL,
                                CONSTRAINT fk_task_files_task FOREIGN KEY (task_id)
                                    REFERENCES tasks(id) ON DELETE CASCADE
                            )
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS task_outputs (
                                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                                task_id         BIGINT NOT NULL,
                                file_path       VARCHAR(2048) NOT NULL,
                                kind            VARCHAR(16) DEFAULT 'other' NOT NULL,
                                file_size       BIGINT,
                                created_at      TIMESTAMP NOT NULL,
                                CONSTRAINT fk_task_outputs_task FOREIGN KEY (task_id)
                                    REFERENCES tasks(id) ON DELETE CASCADE
                            )
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS task_logs (
                                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                                task_id         BIGINT NOT NULL,
                                logged_at       TIMESTAMP NOT NULL,
                                log_level       VARCHAR(16) DEFAULT 'info' NOT NULL,
                                message         CLOB NOT NULL,
                                raw             CLOB,
                                CONSTRAINT fk_task_logs_task FOREIGN KEY (task_id)
                                    REFERENCES tasks(id) ON DELETE CASCADE,
                                CONSTRAINT chk_task_logs_level CHECK (log_level IN
                                    ('info', 'warning', 'error', 'success', 'debug'))
                            )
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS config (
                                config_key      VARCHAR(128) PRIMARY KEY,
                                config_value    CLOB NOT NULL,
                                updated_at      TIMESTAMP NOT NULL
                            )
                            """,
                    "CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_type ON tasks(type)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_created_at ON tasks(created_at)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_priority ON tasks(priority)",
                    "CREATE INDEX IF NOT EXISTS idx_task_files_task ON task_files(task_id)",
                    "CREATE INDEX IF NOT EXISTS idx_task_outputs_task ON task_outputs(task_id)",
                    "CREATE INDEX IF NOT EXISTS idx_task_logs_task ON task_logs(task_id)",
                    "CREATE INDEX IF NOT EXISTS idx_task_logs_logged_at ON task_logs(logged_at)")));

    private Migrations() {
    }

    /**
     * Apply every pending migration.
     *
     * @return the schema version after the run
     */
    public static int apply(Database db) {
        try (Connection conn = db.getConnection()) {
            try (Statement st = conn.createStatement()) {
                st.execute("""
                        CREATE TABLE IF NOT EXISTS schema_version (
                            version         INT PRIMARY KEY,
                            description     VARCHAR(256),
                            applied_at      TIMESTAMP NOT NULL
                        )
                        """);
            }
            conn.commit();

            int current = currentVersion(conn);
            for (Migration migration : ALL) {
                if (migration.version() <= current) {
                    continue;
                }
                try {
                    applyOne(conn, migration);
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
                log.info("Applied schema migration {}: {}", migration.version(), migration.description());
                current = migration.version();
            }
            return current;
        } catch (SQLException e) {
            throw new StoreException("Failed to migrate database schema", e);
        }
    }

    /**
     * Highest applied migration version, 0 for an empty database.
     */
    public static int currentVersion(Database db) {
        try (Connection conn = db.getConnection()) {
            int version = currentVersion(conn);
            conn.commit();
            return version;
        } catch (SQLException e) {
            throw new StoreException("Failed to read schema version", e);
        }
    }

    private static int currentVersion(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void applyOne(Connection conn, Migration migration) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)")) {
            ps.setInt(1, migration.version());
            ps.setString(2, migration.description());
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }
    }
}
