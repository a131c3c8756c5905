package mytrader.worker.store;

import mytrader.worker.model.StatKey;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.model.TaskUpdate;
import mytrader.worker.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskRepository.
 * Each call is one short transaction; conditional UPDATEs provide the per-row exclusion.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    /** Appended to every statement that must not touch finished tasks. */
    private static final String LIVE_GUARD = " AND status NOT IN ('completed', 'failed', 'stopped')";

    private static final String TERMINAL_IN = "('completed', 'failed', 'stopped')";

    /** Column widths from {@link Database}; longer text is cut to fit. */
    static final int MESSAGE_MAX_LENGTH = 1024;
    static final int ERROR_MAX_LENGTH = 2048;

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (task_id, task_type, status, progress, message, current_index, total_items,
                                       stats_success, stats_failed, stats_skipped, params, metadata,
                                       created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = task.createdAt() != null ? task.createdAt() : Instant.now();
            ps.setString(1, task.id());
            ps.setString(2, task.taskType());
            ps.setString(3, task.status().code());
            ps.setInt(4, task.progress());
            ps.setString(5, clip(task.message(), MESSAGE_MAX_LENGTH));
            ps.setInt(6, task.currentIndex());
            ps.setInt(7, task.totalItems());
            ps.setInt(8, task.stats().success());
            ps.setInt(9, task.stats().failed());
            ps.setInt(10, task.stats().skipped());
            ps.setString(11, task.params());
            ps.setString(12, task.metadata());
            setTimestamp(ps, 13, createdAt);
            setTimestamp(ps, 14, createdAt);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findAll(TaskStatus status, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks");
        if (status != null) {
            sql.append(" WHERE status = ?");
        }
        sql.append(" ORDER BY created_at DESC");
        if (limit > 0) {
            sql.append(" LIMIT ?");
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int i = 1;
            if (status != null) {
                ps.setString(i++, status.code());
            }
            if (limit > 0) {
                ps.setInt(i, limit);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list tasks (status=" + status + ")", e);
        }
    }

    @Override
    public List<Task> findByStatusIn(Collection<TaskStatus> statuses, int limit) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM tasks WHERE status IN (" + placeholders + ") ORDER BY created_at"
                + (limit > 0 ? " LIMIT ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (TaskStatus status : statuses) {
                ps.setString(i++, status.code());
            }
            if (limit > 0) {
                ps.setInt(i, limit);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to find tasks by status: " + statuses, e);
        }
    }

    @Override
    public boolean update(String taskId, TaskUpdate update) {
        if (update.isEmpty()) {
            return false;
        }

        try (Connection conn = db.getConnection()) {
            int updated = applyUpdate(conn, taskId, update);
            conn.commit();

            if (updated == 0) {
                log.debug("Update of task {} ignored (missing or terminal): {}", taskId, update);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to update task: " + taskId, e);
        }
    }

    @Override
    public boolean complete(String taskId, TaskUpdate update) {
        if (update.status() != TaskStatus.COMPLETED) {
            throw new IllegalArgumentException("complete() needs a completed status, got " + update.status());
        }

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement cp = conn.prepareStatement("DELETE FROM task_checkpoints WHERE task_id = ?")) {
                int updated = applyUpdate(conn, taskId, update);
                if (updated > 0) {
                    cp.setString(1, taskId);
                    cp.executeUpdate();
                }
                conn.commit();

                if (updated == 0) {
                    log.debug("Completion of task {} ignored (missing or terminal)", taskId);
                }
                return updated > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to complete task: " + taskId, e);
        }
    }

    private int applyUpdate(Connection conn, String taskId, TaskUpdate update) throws SQLException {
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();

        if (update.status() != null) {
            columns.add("status = ?");
            values.add(update.status().code());
        }
        if (update.progress() != null) {
            columns.add("progress = ?");
            values.add(update.progress());
        }
        if (update.currentIndex() != null) {
            columns.add("current_index = ?");
            values.add(update.currentIndex());
        }
        if (update.totalItems() != null) {
            columns.add("total_items = ?");
            values.add(update.totalItems());
        }
        if (update.stats() != null) {
            for (StatKey key : StatKey.values()) {
                columns.add(key.column() + " = ?");
                values.add(update.stats().get(key));
            }
        }
        if (update.result() != null) {
            columns.add("result = ?");
            values.add(update.result());
        }
        if (update.error() != null) {
            columns.add("error = ?");
            values.add(clip(update.error(), ERROR_MAX_LENGTH));
        }
        if (update.message() != null) {
            columns.add("message = ?");
            values.add(clip(update.message(), MESSAGE_MAX_LENGTH));
        }

        Timestamp now = Timestamp.from(Instant.now());
        columns.add("updated_at = ?");
        values.add(now);

        if (update.status() != null && update.status().isTerminal()) {
            columns.add("completed_at = ?");
            values.add(now);
            columns.add("stop_requested = FALSE");
            columns.add("pause_requested = FALSE");
        } else if (update.status() == TaskStatus.RUNNING) {
            columns.add("started_at = COALESCE(started_at, ?)");
            values.add(now);
        }

        String sql = "UPDATE tasks SET " + String.join(", ", columns) + " WHERE task_id = ?" + LIVE_GUARD;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            for (Object value : values) {
                ps.setObject(i++, value);
            }
            ps.setString(i, taskId);
            return ps.executeUpdate();
        }
    }

    @Override
    public boolean transition(String taskId, TaskStatus expected, TaskStatus next, String message) {
        StringBuilder sql = new StringBuilder("UPDATE tasks SET status = ?, message = ?, updated_at = ?");
        if (next == TaskStatus.RUNNING) {
            sql.append(", started_at = COALESCE(started_at, ?)");
        } else if (next.isTerminal()) {
            sql.append(", completed_at = ?, stop_requested = FALSE, pause_requested = FALSE");
        }
        sql.append(" WHERE task_id = ? AND status = ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            Timestamp now = Timestamp.from(Instant.now());
            int i = 1;
            ps.setString(i++, next.code());
            ps.setString(i++, clip(message, MESSAGE_MAX_LENGTH));
            ps.setTimestamp(i++, now);
            if (next == TaskStatus.RUNNING || next.isTerminal()) {
                ps.setTimestamp(i++, now);
            }
            ps.setString(i++, taskId);
            ps.setString(i, expected.code());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} {} -> {}", taskId, expected.code(), next.code());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to move task " + taskId + " to " + next.code(), e);
        }
    }

    @Override
    public boolean incrementStat(String taskId, StatKey key, int amount) {
        String sql = "UPDATE tasks SET " + key.column() + " = " + key.column() + " + ?, updated_at = ?"
                + " WHERE task_id = ?" + LIVE_GUARD;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, amount);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to increment " + key.key() + " of task: " + taskId, e);
        }
    }

    @Override
    public boolean setStopRequested(String taskId, boolean requested) {
        return setFlag(taskId, "stop_requested", requested);
    }

    @Override
    public boolean setPauseRequested(String taskId, boolean requested) {
        return setFlag(taskId, "pause_requested", requested);
    }

    /**
     * Raising a flag needs a live task; clearing works on any row so that a handler
     * can clear its own request after finishing.
     */
    private boolean setFlag(String taskId, String column, boolean requested) {
        String sql = "UPDATE tasks SET " + column + " = ?, updated_at = ? WHERE task_id = ?"
                + (requested ? LIVE_GUARD : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, requested);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to set " + column + " of task: " + taskId, e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement cp = conn.prepareStatement("DELETE FROM task_checkpoints WHERE task_id = ?");
                    PreparedStatement tp = conn.prepareStatement("DELETE FROM tasks WHERE task_id = ?")) {

                cp.setString(1, taskId);
                cp.executeUpdate();
                tp.setString(1, taskId);
                int deleted = tp.executeUpdate();

                conn.commit();
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        String checkpointsSql = """
                    DELETE FROM task_checkpoints
                    WHERE task_id IN (
                        SELECT task_id FROM tasks
                        WHERE status IN %s AND completed_at < ?
                    )
                """.formatted(TERMINAL_IN);
        String tasksSql = "DELETE FROM tasks WHERE status IN " + TERMINAL_IN + " AND completed_at < ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement cp = conn.prepareStatement(checkpointsSql);
                    PreparedStatement tp = conn.prepareStatement(tasksSql)) {

                Timestamp ts = Timestamp.from(cutoff);
                cp.setTimestamp(1, ts);
                cp.executeUpdate();
                tp.setTimestamp(1, ts);
                int deleted = tp.executeUpdate();

                conn.commit();
                return deleted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to purge tasks finished before " + cutoff, e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("task_id"))
                .taskType(rs.getString("task_type"))
                .status(TaskStatus.fromCode(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .message(rs.getString("message"))
                .result(rs.getString("result"))
                .error(rs.getString("error"))
                .currentIndex(rs.getInt("current_index"))
                .totalItems(rs.getInt("total_items"))
                .stats(new TaskStats(
                        rs.getInt("stats_success"),
                        rs.getInt("stats_failed"),
                        rs.getInt("stats_skipped")))
                .params(rs.getString("params"))
                .metadata(rs.getString("metadata"))
                .stopRequested(rs.getBoolean("stop_requested"))
                .pauseRequested(rs.getBoolean("pause_requested"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static String clip(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
