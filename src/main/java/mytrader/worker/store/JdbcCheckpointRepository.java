package mytrader.worker.store;

import mytrader.worker.model.Checkpoint;
import mytrader.worker.model.TaskStats;
import mytrader.worker.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of CheckpointRepository.
 * Upsert is UPDATE-then-INSERT in one transaction; the INSERT selects from tasks
 * so a checkpoint is never written for a task that no longer exists.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointRepository.class);

    /** SQLState class for integrity constraint violations. */
    private static final String INTEGRITY_VIOLATION = "23";

    private final Database db;

    public JdbcCheckpointRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean save(Checkpoint checkpoint) {
        try {
            return upsert(checkpoint);
        } catch (SQLException e) {
            if (e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_VIOLATION)) {
                // A concurrent writer inserted first; our UPDATE will now hit its row.
                log.debug("Checkpoint insert race for task {}, retrying as update", checkpoint.taskId());
                try {
                    return upsert(checkpoint);
                } catch (SQLException retryError) {
                    throw new TaskStoreException("Failed to save checkpoint: " + checkpoint.taskId(), retryError);
                }
            }
            throw new TaskStoreException("Failed to save checkpoint: " + checkpoint.taskId(), e);
        }
    }

    private boolean upsert(Checkpoint checkpoint) throws SQLException {
        String updateSql = """
                    UPDATE task_checkpoints
                    SET current_index = ?, stats_success = ?, stats_failed = ?, stats_skipped = ?,
                        stage = ?, saved_at = ?
                    WHERE task_id = ?
                """;
        String insertSql = """
                    INSERT INTO task_checkpoints (task_id, current_index, stats_success, stats_failed,
                                                  stats_skipped, stage, saved_at)
                    SELECT task_id, CAST(? AS INT), CAST(? AS INT), CAST(? AS INT), CAST(? AS INT),
                           CAST(? AS VARCHAR(64)), CAST(? AS TIMESTAMP)
                    FROM tasks WHERE task_id = ?
                """;

        Timestamp now = Timestamp.from(Instant.now());
        TaskStats stats = checkpoint.stats();

        try (Connection conn = db.getConnection()) {
            try {
                int written;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    bindCheckpoint(ps, checkpoint, stats, now);
                    written = ps.executeUpdate();
                }
                if (written == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        bindCheckpoint(ps, checkpoint, stats, now);
                        written = ps.executeUpdate();
                    }
                }
                conn.commit();

                if (written > 0) {
                    log.debug("Checkpoint saved for task {} at index {} (stage {})",
                            checkpoint.taskId(), checkpoint.currentIndex(), checkpoint.stage());
                } else {
                    log.debug("Checkpoint for missing task {} ignored", checkpoint.taskId());
                }
                return written > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private static void bindCheckpoint(PreparedStatement ps, Checkpoint checkpoint, TaskStats stats, Timestamp now)
            throws SQLException {
        ps.setInt(1, checkpoint.currentIndex());
        ps.setInt(2, stats.success());
        ps.setInt(3, stats.failed());
        ps.setInt(4, stats.skipped());
        ps.setString(5, checkpoint.stage());
        ps.setTimestamp(6, now);
        ps.setString(7, checkpoint.taskId());
    }

    @Override
    public Optional<Checkpoint> findByTaskId(String taskId) {
        String sql = "SELECT * FROM task_checkpoints WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Checkpoint(
                            rs.getString("task_id"),
                            rs.getInt("current_index"),
                            new TaskStats(
                                    rs.getInt("stats_success"),
                                    rs.getInt("stats_failed"),
                                    rs.getInt("stats_skipped")),
                            rs.getString("stage"),
                            JdbcTaskRepository.toInstant(rs.getTimestamp("saved_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to load checkpoint: " + taskId, e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM task_checkpoints WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to delete checkpoint: " + taskId, e);
        }
    }
}
