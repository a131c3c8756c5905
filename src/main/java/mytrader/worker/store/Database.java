package mytrader.worker.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mytrader.worker.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(WorkerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("mytrader-task-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            task_type       VARCHAR(128) NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'pending',
                            progress        INT NOT NULL DEFAULT 0,
                            message         VARCHAR(1024),
                            result          CLOB,
                            error           VARCHAR(2048),
                            current_index   INT NOT NULL DEFAULT 0,
                            total_items     INT NOT NULL DEFAULT 0,
                            stats_success   INT NOT NULL DEFAULT 0,
                            stats_failed    INT NOT NULL DEFAULT 0,
                            stats_skipped   INT NOT NULL DEFAULT 0,
                            params          CLOB,
                            metadata        CLOB,
                            stop_requested  BOOLEAN NOT NULL DEFAULT FALSE,
                            pause_requested BOOLEAN NOT NULL DEFAULT FALSE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP
                        );
                    """);

            // ---------- CHECKPOINTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_checkpoints (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            current_index   INT NOT NULL,
                            stats_success   INT NOT NULL DEFAULT 0,
                            stats_failed    INT NOT NULL DEFAULT 0,
                            stats_skipped   INT NOT NULL DEFAULT 0,
                            stage           VARCHAR(64) NOT NULL DEFAULT 'default',
                            saved_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT fk_checkpoint_task FOREIGN KEY (task_id)
                                REFERENCES tasks(task_id) ON DELETE CASCADE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_created_at ON tasks(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_type ON tasks(task_type);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
