package stitcher.taskcenter.store;

import stitcher.taskcenter.model.LogLevel;
import stitcher.taskcenter.model.TaskLog;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.repository.TaskLogRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC implementation of TaskLogRepository.
 */
public class JdbcTaskLogRepository implements TaskLogRepository {

    private final Database db;
    private final Clock clock;

    public JdbcTaskLogRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskLogRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public TaskLog append(long taskId, LogLevel level, String message, String raw) {
        String sql = "INSERT INTO task_logs (task_id, logged_at, log_level, message, raw) VALUES (?, ?, ?, ?, ?)";
        LogLevel effective = level != null ? level : LogLevel.INFO;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            Instant now = clock.instant();
            ps.setLong(1, taskId);
            Jdbc.setTimestamp(ps, 2, now);
            ps.setString(3, effective.wireName());
            ps.setString(4, message != null ? message : "");
            ps.setString(5, raw);
            ps.executeUpdate();

            long id = 0;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            conn.commit();
            return new TaskLog(id, taskId, now, effective, message, raw, null);
        } catch (SQLException e) {
            throw new StoreException("Failed to append log to task: " + taskId, e);
        }
    }

    @Override
    public List<TaskLog> findByTask(long taskId, int limit, int offset) {
        String sql = """
                    SELECT * FROM task_logs
                    WHERE task_id = ?
                    ORDER BY logged_at, id
                    LIMIT ? OFFSET ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            ps.setInt(2, Math.max(0, limit));
            ps.setInt(3, Math.max(0, offset));
            List<TaskLog> logs = executeQuery(ps, false);
            conn.commit();
            return logs;
        } catch (SQLException e) {
            throw new StoreException("Failed to read logs of task: " + taskId, e);
        }
    }

    @Override
    public List<TaskLog> findRecent(int limit) {
        String sql = """
                    SELECT l.*, t.type AS task_type
                    FROM task_logs l
                    LEFT JOIN tasks t ON t.id = l.task_id
                    ORDER BY l.logged_at DESC, l.id DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, Math.max(0, limit));
            List<TaskLog> logs = executeQuery(ps, true);
            conn.commit();
            Collections.reverse(logs);
            return logs;
        } catch (SQLException e) {
            throw new StoreException("Failed to read recent logs", e);
        }
    }

    @Override
    public int countByTask(long taskId) {
        return count("SELECT COUNT(*) FROM task_logs WHERE task_id = ?", taskId);
    }

    @Override
    public int countAll() {
        return count("SELECT COUNT(*) FROM task_logs", null);
    }

    @Override
    public int deleteByTask(long taskId) {
        return delete("DELETE FROM task_logs WHERE task_id = ?", taskId);
    }

    @Override
    public int deleteAll() {
        return delete("DELETE FROM task_logs", null);
    }

    private int count(String sql, Long taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (taskId != null) {
                ps.setLong(1, taskId);
            }
            int count;
            try (ResultSet rs = ps.executeQuery()) {
                count = rs.next() ? rs.getInt(1) : 0;
            }
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw new StoreException("Failed to count logs", e);
        }
    }

    private int delete(String sql, Long taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (taskId != null) {
                ps.setLong(1, taskId);
            }
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete logs" + (taskId != null ? " of task " + taskId : ""), e);
        }
    }

    private static List<TaskLog> executeQuery(PreparedStatement ps, boolean withTaskType) throws SQLException {
        List<TaskLog> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                TaskType type = null;
                if (withTaskType) {
                    String wire = rs.getString("task_type");
                    type = wire != null ? TaskType.fromWire(wire) : null;
                }
                results.add(new TaskLog(
                        rs.getLong("id"),
                        rs.getLong("task_id"),
                        Jdbc.toInstant(rs.getTimestamp("logged_at")),
                        LogLevel.fromWire(rs.getString("log_level")),
                        rs.getString("message"),
                        rs.getString("raw"),
                        type));
            }
        }
        return results;
    }
}
