package mytrader.worker.config;

import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerConfigTest {

    @Test
    void defaults() {
        WorkerConfig config = WorkerConfig.defaults();

        assertTrue(config.databaseUrl().startsWith("jdbc:h2:file:"));
        assertEquals(Duration.ofSeconds(5), config.pollInterval());
        assertEquals(1, config.maxConcurrent());
        assertEquals(Duration.ofSeconds(30), config.shutdownGracePeriod());
        assertEquals(Duration.ofSeconds(1), config.pausePollInterval());
        assertEquals(10, config.checkpointInterval());
        assertEquals(Duration.ofDays(7), config.taskRetention());
    }

    @Test
    void fluentSettersOverride() {
        WorkerConfig config = WorkerConfig.defaults()
                .withMaxConcurrent(4)
                .withPollInterval(Duration.ofMillis(250))
                .withCheckpointInterval(25)
                .withShutdownGracePeriod(Duration.ZERO);

        assertEquals(4, config.maxConcurrent());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(25, config.checkpointInterval());
        assertEquals(Duration.ZERO, config.shutdownGracePeriod());
    }

    @Test
    void rejectsInvalidValues() {
        WorkerConfig config = WorkerConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.withMaxConcurrent(0));
        assertThrows(IllegalArgumentException.class, () -> config.withPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.withCheckpointInterval(0));
        assertThrows(IllegalArgumentException.class, () -> config.withDatabaseUrl(" "));
        assertThrows(IllegalArgumentException.class, () -> config.withDatabasePoolSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withShutdownGracePeriod(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> config.withTaskRetention(null));
    }
}
