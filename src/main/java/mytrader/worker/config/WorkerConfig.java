package mytrader.worker.config;

import java.time.Duration;

/**
 * Configuration holder for the task worker process.
 * All settings have sensible defaults; they are read once at startup.
 */
public final class WorkerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/tasks;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Worker loop settings
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxConcurrent = 1;
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    // Handler settings
    private Duration pausePollInterval = Duration.ofSeconds(1);
    private int checkpointInterval = 10;

    // Maintenance settings
    private Duration taskRetention = Duration.ofDays(7);
    private Duration janitorInterval = Duration.ofHours(1);

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();

        // Override from environment variables
        String dbUrl = System.getenv("MYTRADER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poll = System.getenv("MYTRADER_POLL_INTERVAL_SECONDS");
        if (poll != null && !poll.isBlank()) {
            config.withPollInterval(Duration.ofSeconds(parseInt("MYTRADER_POLL_INTERVAL_SECONDS", poll)));
        }

        String maxConcurrent = System.getenv("MYTRADER_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config.withMaxConcurrent(parseInt("MYTRADER_MAX_CONCURRENT", maxConcurrent));
        }

        String grace = System.getenv("MYTRADER_SHUTDOWN_GRACE_SECONDS");
        if (grace != null && !grace.isBlank()) {
            config.withShutdownGracePeriod(Duration.ofSeconds(parseInt("MYTRADER_SHUTDOWN_GRACE_SECONDS", grace)));
        }

        String retention = System.getenv("MYTRADER_TASK_RETENTION_DAYS");
        if (retention != null && !retention.isBlank()) {
            config.withTaskRetention(Duration.ofDays(parseInt("MYTRADER_TASK_RETENTION_DAYS", retention)));
        }

        return config;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Duration requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Duration shutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public Duration pausePollInterval() {
        return pausePollInterval;
    }

    public int checkpointInterval() {
        return checkpointInterval;
    }

    public Duration taskRetention() {
        return taskRetention;
    }

    public Duration janitorInterval() {
        return janitorInterval;
    }

    // Fluent setters for testing/customization
    public WorkerConfig withDatabaseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("databaseUrl is required");
        }
        this.databaseUrl = url;
        return this;
    }

    public WorkerConfig withDatabasePoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("databasePoolSize must be >= 1, got " + poolSize);
        }
        this.databasePoolSize = poolSize;
        return this;
    }

    public WorkerConfig withPollInterval(Duration interval) {
        this.pollInterval = requirePositive("pollInterval", interval);
        return this;
    }

    public WorkerConfig withMaxConcurrent(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    public WorkerConfig withShutdownGracePeriod(Duration gracePeriod) {
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must not be negative, got " + gracePeriod);
        }
        this.shutdownGracePeriod = gracePeriod;
        return this;
    }

    public WorkerConfig withPausePollInterval(Duration interval) {
        this.pausePollInterval = requirePositive("pausePollInterval", interval);
        return this;
    }

    public WorkerConfig withCheckpointInterval(int items) {
        if (items < 1) {
            throw new IllegalArgumentException("checkpointInterval must be >= 1, got " + items);
        }
        this.checkpointInterval = items;
        return this;
    }

    public WorkerConfig withTaskRetention(Duration retention) {
        this.taskRetention = requirePositive("taskRetention", retention);
        return this;
    }

    public WorkerConfig withJanitorInterval(Duration interval) {
        this.janitorInterval = requirePositive("janitorInterval", interval);
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", pollInterval=" + pollInterval +
                ", maxConcurrent=" + maxConcurrent +
                ", shutdownGracePeriod=" + shutdownGracePeriod +
                ", checkpointInterval=" + checkpointInterval +
                ", taskRetention=" + taskRetention +
                '}';
    }
}
