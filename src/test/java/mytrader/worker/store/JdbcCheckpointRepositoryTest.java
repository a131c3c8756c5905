package mytrader.worker.store;

import mytrader.worker.config.WorkerConfig;
import mytrader.worker.model.Checkpoint;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCheckpointRepositoryTest {

    private static Database db;
    private static JdbcTaskRepository tasks;
    private static JdbcCheckpointRepository checkpoints;

    @BeforeAll
    static void setup() {
        WorkerConfig config = WorkerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-checkpoints;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        tasks = new JdbcTaskRepository(db);
        checkpoints = new JdbcCheckpointRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_checkpoints");
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        tasks.save(Task.builder().id("t1").taskType("test_handler").params("{}").createdAt(Instant.now()).build());
    }

    @Test
    void saveAndLoad() {
        assertTrue(checkpoints.save(new Checkpoint("t1", 20, new TaskStats(18, 1, 1), "prices", null)));

        Checkpoint loaded = checkpoints.findByTaskId("t1").orElseThrow();
        assertEquals(20, loaded.currentIndex());
        assertEquals(new TaskStats(18, 1, 1), loaded.stats());
        assertEquals("prices", loaded.stage());
        assertNotNull(loaded.savedAt());
    }

    @Test
    void lastWriteWins() {
        checkpoints.save(Checkpoint.of("t1", 10, TaskStats.ofSuccess(10)));
        checkpoints.save(Checkpoint.of("t1", 20, TaskStats.ofSuccess(19)));

        Checkpoint loaded = checkpoints.findByTaskId("t1").orElseThrow();
        assertEquals(20, loaded.currentIndex());
        assertEquals(19, loaded.stats().success());
        assertEquals(Checkpoint.DEFAULT_STAGE, loaded.stage());
    }

    @Test
    void checkpointForMissingTaskIsIgnored() {
        assertFalse(checkpoints.save(Checkpoint.of("ghost", 5, TaskStats.ZERO)));
        assertTrue(checkpoints.findByTaskId("ghost").isEmpty());
    }

    @Test
    void deleteIsIdempotent() {
        checkpoints.save(Checkpoint.of("t1", 5, TaskStats.ZERO));

        assertTrue(checkpoints.delete("t1"));
        assertFalse(checkpoints.delete("t1"));
        assertTrue(checkpoints.findByTaskId("t1").isEmpty());
    }

    @Test
    void concurrentSavesLeaveOneConsistentRow() throws InterruptedException {
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            int index = i * 10;
            Thread t = new Thread(() -> {
                try {
                    go.await();
                    checkpoints.save(Checkpoint.of("t1", index, TaskStats.ofSuccess(index)));
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : threads) {
            t.join();
        }

        assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
        Checkpoint loaded = checkpoints.findByTaskId("t1").orElseThrow();
        assertEquals(loaded.currentIndex(), loaded.stats().success());
    }
}
