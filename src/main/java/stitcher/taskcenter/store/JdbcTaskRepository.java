package stitcher.taskcenter.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.model.NewTask;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.StatusExtras;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskError;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskFilter;
import stitcher.taskcenter.model.TaskLifecycle;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.model.TaskPage;
import stitcher.taskcenter.model.TaskQuery;
import stitcher.taskcenter.model.TaskStats;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.repository.TaskRepository;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of TaskRepository.
 * Status changes lock the row and run the lifecycle function inside one transaction.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    static final int DEFAULT_MAX_RETRY = 3;

    private final Database db;
    private final Clock clock;

    public JdbcTaskRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Task create(NewTask task) {
        String insertTask = """
                    INSERT INTO tasks (type, name, status, priority, progress, retry_count, max_retry,
                                       created_at, updated_at, execution_time, output_dir, config)
                    VALUES (?, ?, 'pending', ?, 0, 0, ?, ?, ?, 0, ?, ?)
                """;
        String insertFile = """
                    INSERT INTO task_files (task_id, file_path, category, category_label, sort_order)
                    VALUES (?, ?, ?, ?, ?)
                """;

        long id;
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(insertTask, Statement.RETURN_GENERATED_KEYS);
                    PreparedStatement filePs = conn.prepareStatement(insertFile)) {
                Instant now = clock.instant();
                ps.setString(1, task.type().wireName());
                ps.setString(2, task.name());
                ps.setInt(3, task.priority());
                ps.setInt(4, task.maxRetry() != null ? task.maxRetry() : DEFAULT_MAX_RETRY);
                Jdbc.setTimestamp(ps, 5, now);
                Jdbc.setTimestamp(ps, 6, now);
                ps.setString(7, task.outputDir());
                ps.setString(8, task.config());
                ps.executeUpdate();

                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for task");
                    }
                    id = keys.getLong(1);
                }

                // list position is the sort order
                int order = 0;
                for (TaskFile file : task.files()) {
                    filePs.setLong(1, id);
                    filePs.setString(2, file.path());
                    filePs.setString(3, file.category());
                    filePs.setString(4, file.categoryLabel());
                    filePs.setInt(5, order++);
                    filePs.addBatch();
                }
                if (!task.files().isEmpty()) {
                    filePs.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create task of type " + task.type().wireName(), e);
        }

        log.debug("Created task {} ({}, {} files)", id, task.type().wireName(), task.files().size());
        return findById(id).orElseThrow(() -> new IllegalStateException("Task vanished after insert: " + id));
    }

    @Override
    public Optional<Task> findById(long taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            Task task = null;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    task = mapRow(rs);
                }
            }
            if (task == null) {
                return Optional.empty();
            }
            List<Long> ids = List.of(taskId);
            task = task.toBuilder()
                    .files(loadFiles(conn, ids).getOrDefault(taskId, List.of()))
                    .outputs(loadOutputs(conn, ids).getOrDefault(taskId, List.of()))
                    .build();
            conn.commit();
            return Optional.of(task);
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<TaskFile> findFiles(long taskId) {
        try (Connection conn = db.getConnection()) {
            List<TaskFile> files = loadFiles(conn, List.of(taskId)).getOrDefault(taskId, List.of());
            conn.commit();
            return files;
        } catch (SQLException e) {
            throw new StoreException("Failed to load files of task: " + taskId, e);
        }
    }

    @Override
    public List<TaskOutput> findOutputs(long taskId) {
        try (Connection conn = db.getConnection()) {
            List<TaskOutput> outputs = loadOutputs(conn, List.of(taskId)).getOrDefault(taskId, List.of());
            conn.commit();
            return outputs;
        } catch (SQLException e) {
            throw new StoreException("Failed to load outputs of task: " + taskId, e);
        }
    }

    @Override
    public TaskPage list(TaskQuery query) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(query.filter(), params);
        String direction = query.sort().ascending() ? "ASC" : "DESC";
        String orderBy = " ORDER BY " + query.sort().field().column() + " " + direction + ", id " + direction;

        String countSql = "SELECT COUNT(*) FROM tasks" + where;
        String pageSql = "SELECT * FROM tasks" + where + orderBy + " LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection()) {
            int total;
            try (PreparedStatement ps = conn.prepareStatement(countSql)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getInt(1) : 0;
                }
            }

            List<Task> tasks = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(pageSql)) {
                int next = bind(ps, params);
                ps.setInt(next, query.pageSize());
                ps.setLong(next + 1, query.offset());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        tasks.add(mapRow(rs));
                    }
                }
            }

            if (!tasks.isEmpty() && (query.withFiles() || query.withOutputs())) {
                List<Long> ids = tasks.stream().map(Task::id).toList();
                Map<Long, List<TaskFile>> files = query.withFiles() ? loadFiles(conn, ids) : Map.of();
                Map<Long, List<TaskOutput>> outputs = query.withOutputs() ? loadOutputs(conn, ids) : Map.of();
                tasks = tasks.stream()
                        .map(t -> t.toBuilder()
                                .files(files.getOrDefault(t.id(), List.of()))
                                .outputs(outputs.getOrDefault(t.id(), List.of()))
                                .build())
                        .toList();
            }

            TaskStats stats = stats(conn);
            conn.commit();
            return new TaskPage(tasks, total, query.page(), query.pageSize(), stats);
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks", e);
        }
    }

    @Override
    public List<Task> findByStatus(Set<TaskStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM tasks WHERE status IN (" + placeholders(statuses.size()) + ") ORDER BY updated_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (TaskStatus status : statuses) {
                ps.setString(i++, status.wireName());
            }
            List<Task> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            conn.commit();
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to find tasks by status: " + statuses, e);
        }
    }

    @Override
    public TaskStats stats() {
        try (Connection conn = db.getConnection()) {
            TaskStats stats = stats(conn);
            conn.commit();
            return stats;
        } catch (SQLException e) {
            throw new StoreException("Failed to compute task stats", e);
        }
    }

    @Override
    public boolean updateStatus(long taskId, TaskStatus status, StatusExtras extras) {
        String selectSql = "SELECT * FROM tasks WHERE id = ? FOR UPDATE";
        String updateSql = """
                    UPDATE tasks
                    SET status = ?, updated_at = ?, started_at = ?, completed_at = ?,
                        pid = ?, pid_started_at = ?, progress = ?, current_step = ?,
                        error_code = ?, error_message = ?, error_stack = ?, execution_time = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Task current;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setLong(1, taskId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return false;
                        }
                        current = mapRow(rs);
                    }
                }

                Task next = TaskLifecycle.apply(current, status, extras, clock.instant());
                TaskError error = next.error();

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, next.status().wireName());
                    Jdbc.setTimestamp(ps, 2, next.updatedAt());
                    Jdbc.setTimestamp(ps, 3, next.startedAt());
                    Jdbc.setTimestamp(ps, 4, next.completedAt());
                    Jdbc.setLongOrNull(ps, 5, next.pid());
                    Jdbc.setTimestamp(ps, 6, next.pidStartedAt());
                    ps.setInt(7, next.progress());
                    ps.setString(8, next.currentStep());
                    ps.setString(9, error != null ? error.code() : null);
                    ps.setString(10, error != null ? error.message() : null);
                    ps.setString(11, error != null ? error.stack() : null);
                    ps.setLong(12, next.executionTime());
                    ps.setLong(13, taskId);
                    ps.executeUpdate();
                }
                if (current.status() == TaskStatus.COMPLETED && next.status() == TaskStatus.PENDING) {
                    // resubmission: outputs belong to the run that produced them
                    try (PreparedStatement ps = conn.prepareStatement("DELETE FROM task_outputs WHERE task_id = ?")) {
                        ps.setLong(1, taskId);
                        ps.executeUpdate();
                    }
                }
                conn.commit();

                log.debug("Task {} {} -> {}", taskId, current.status().wireName(), status.wireName());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update status of task " + taskId + " to " + status.wireName(), e);
        }
    }

    @Override
    public boolean updateProgress(long taskId, int progress, String step) {
        String sql = """
                    UPDATE tasks
                    SET progress = ?, current_step = COALESCE(?, current_step), updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, TaskLifecycle.clampProgress(progress));
            ps.setString(2, step);
            Jdbc.setTimestamp(ps, 3, clock.instant());
            ps.setLong(4, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update progress of task: " + taskId, e);
        }
    }

    @Override
    public boolean incrementExecutionTime(long taskId, long millis) {
        return executeUpdate("UPDATE tasks SET execution_time = execution_time + ? WHERE id = ?",
                "increment execution time of task " + taskId, millis, taskId) > 0;
    }

    @Override
    public boolean incrementRetryCount(long taskId) {
        String sql = "UPDATE tasks SET retry_count = retry_count + 1, updated_at = ? WHERE id = ?";
        return executeUpdate(sql, "increment retry count of task " + taskId,
                Timestamp.from(clock.instant()), taskId) > 0;
    }

    @Override
    public boolean updatePid(long taskId, long pid, Instant startedAt) {
        String sql = "UPDATE tasks SET pid = ?, pid_started_at = ?, updated_at = ? WHERE id = ?";
        return executeUpdate(sql, "bind pid of task " + taskId,
                pid, startedAt != null ? Timestamp.from(startedAt) : null, Timestamp.from(clock.instant()),
                taskId) > 0;
    }

    @Override
    public boolean clearPid(long taskId) {
        String sql = "UPDATE tasks SET pid = NULL, pid_started_at = NULL, updated_at = ? WHERE id = ?";
        return executeUpdate(sql, "clear pid of task " + taskId, Timestamp.from(clock.instant()), taskId) > 0;
    }

    @Override
    public TaskOutput addOutput(long taskId, TaskOutput output) {
        String sql = "INSERT INTO task_outputs (task_id, file_path, kind, file_size, created_at) VALUES (?, ?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            Instant now = clock.instant();
            OutputKind kind = output.kind() != null ? output.kind() : OutputKind.fromFileName(output.path());
            ps.setLong(1, taskId);
            ps.setString(2, output.path());
            ps.setString(3, kind.wireName());
            Jdbc.setLongOrNull(ps, 4, output.size());
            Jdbc.setTimestamp(ps, 5, now);
            ps.executeUpdate();

            Long id = null;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            conn.commit();
            return new TaskOutput(id, output.path(), kind, output.size(), now);
        } catch (SQLException e) {
            throw new StoreException("Failed to add output to task: " + taskId, e);
        }
    }

    @Override
    public boolean updateOutputDir(long taskId, String outputDir) {
        String sql = "UPDATE tasks SET output_dir = ?, updated_at = ? WHERE id = ?";
        return executeUpdate(sql, "update output dir of task " + taskId,
                outputDir, Timestamp.from(clock.instant()), taskId) > 0;
    }

    @Override
    public boolean delete(long taskId) {
        return executeUpdate("DELETE FROM tasks WHERE id = ?", "delete task " + taskId, taskId) > 0;
    }

    @Override
    public int deleteCompleted(int beforeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(0, beforeDays)));
        int deleted = executeUpdate("DELETE FROM tasks WHERE status = 'completed' AND completed_at < ?",
                "delete completed tasks", Timestamp.from(cutoff));
        if (deleted > 0) {
            log.info("Deleted {} completed tasks older than {} days", deleted, beforeDays);
        }
        return deleted;
    }

    @Override
    public int deleteFailed() {
        return executeUpdate("DELETE FROM tasks WHERE status = 'failed'", "delete failed tasks");
    }

    @Override
    public int deleteCancelled() {
        return executeUpdate("DELETE FROM tasks WHERE status = 'cancelled'", "delete cancelled tasks");
    }

    // ==================== Helper Methods ====================

    private int executeUpdate(String sql, String operation, Object... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    private static String whereClause(TaskFilter filter, List<Object> params) {
        List<String> conditions = new ArrayList<>();

        if (!filter.statuses().isEmpty()) {
            conditions.add("status IN (" + placeholders(filter.statuses().size()) + ")");
            filter.statuses().forEach(s -> params.add(s.wireName()));
        }
        if (!filter.types().isEmpty()) {
            conditions.add("type IN (" + placeholders(filter.types().size()) + ")");
            filter.types().forEach(t -> params.add(t.wireName()));
        }
        if (filter.search() != null && !filter.search().isBlank()) {
            conditions.add("LOWER(name) LIKE ? ESCAPE '!'");
            params.add(Jdbc.likeContains(filter.search().trim()));
        }
        if (filter.createdFrom() != null) {
            conditions.add("created_at >= ?");
            params.add(Timestamp.from(filter.createdFrom()));
        }
        if (filter.createdTo() != null) {
            conditions.add("created_at <= ?");
            params.add(Timestamp.from(filter.createdTo()));
        }

        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /** Bind positional params; returns the next free index. */
    private static int bind(PreparedStatement ps, List<Object> params) throws SQLException {
        int i = 1;
        for (Object param : params) {
            ps.setObject(i++, param);
        }
        return i;
    }

    private static TaskStats stats(Connection conn) throws SQLException {
        String sql = "SELECT status, COUNT(*) AS cnt, COALESCE(SUM(execution_time), 0) AS busy FROM tasks GROUP BY status";
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        long totalExecutionTime = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                TaskStatus status = TaskStatus.fromWire(rs.getString("status"));
                counts.put(status, rs.getInt("cnt"));
                if (status == TaskStatus.COMPLETED) {
                    totalExecutionTime = rs.getLong("busy");
                }
            }
        }
        return new TaskStats(counts, totalExecutionTime);
    }

    private static Map<Long, List<TaskFile>> loadFiles(Connection conn, Collection<Long> taskIds) throws SQLException {
        String sql = "SELECT * FROM task_files WHERE task_id IN (" + placeholders(taskIds.size())
                + ") ORDER BY task_id, sort_order, id";
        Map<Long, List<TaskFile>> byTask = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, new ArrayList<>(taskIds));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byTask.computeIfAbsent(rs.getLong("task_id"), k -> new ArrayList<>())
                            .add(new TaskFile(
                                    rs.getLong("id"),
                                    rs.getString("file_path"),
                                    rs.getString("category"),
                                    rs.getString("category_label"),
                                    rs.getInt("sort_order")));
                }
            }
        }
        return byTask;
    }

    private static Map<Long, List<TaskOutput>> loadOutputs(Connection conn, Collection<Long> taskIds)
            throws SQLException {
        String sql = "SELECT * FROM task_outputs WHERE task_id IN (" + placeholders(taskIds.size())
                + ") ORDER BY task_id, id";
        Map<Long, List<TaskOutput>> byTask = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, new ArrayList<>(taskIds));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byTask.computeIfAbsent(rs.getLong("task_id"), k -> new ArrayList<>())
                            .add(new TaskOutput(
                                    rs.getLong("id"),
                                    rs.getString("file_path"),
                                    OutputKind.fromWire(rs.getString("kind")),
                                    Jdbc.getLongOrNull(rs, "file_size"),
                                    Jdbc.toInstant(rs.getTimestamp("created_at"))));
                }
            }
        }
        return byTask;
    }

    private static Task mapRow(ResultSet rs) throws SQLException {
        String errorCode = rs.getString("error_code");
        String errorMessage = rs.getString("error_message");
        TaskError error = errorCode != null || errorMessage != null
                ? new TaskError(errorCode, errorMessage, rs.getString("error_stack"))
                : null;

        return Task.builder()
                .id(rs.getLong("id"))
                .type(TaskType.fromWire(rs.getString("type")))
                .name(rs.getString("name"))
                .status(TaskStatus.fromWire(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .progress(rs.getInt("progress"))
                .currentStep(rs.getString("current_step"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetry(rs.getInt("max_retry"))
                .createdAt(Jdbc.toInstant(rs.getTimestamp("created_at")))
                .updatedAt(Jdbc.toInstant(rs.getTimestamp("updated_at")))
                .startedAt(Jdbc.toInstant(rs.getTimestamp("started_at")))
                .completedAt(Jdbc.toInstant(rs.getTimestamp("completed_at")))
                .executionTime(rs.getLong("execution_time"))
                .pid(Jdbc.getLongOrNull(rs, "pid"))
                .pidStartedAt(Jdbc.toInstant(rs.getTimestamp("pid_started_at")))
                .outputDir(rs.getString("output_dir"))
                .config(rs.getString("config"))
                .error(error)
                .build();
    }
}
