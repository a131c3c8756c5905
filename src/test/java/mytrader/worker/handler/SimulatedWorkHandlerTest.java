package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.config.WorkerConfig;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.service.TaskService;
import mytrader.worker.store.Database;
import mytrader.worker.store.JdbcCheckpointRepository;
import mytrader.worker.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedWorkHandlerTest {

    private static Database db;
    private static TaskService tasks;
    private static SimulatedWorkHandler handler;

    @BeforeAll
    static void setup() {
        WorkerConfig config = WorkerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-simulated;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        tasks = new TaskService(new JdbcTaskRepository(db), new JdbcCheckpointRepository(db));
        handler = new SimulatedWorkHandler(10, Duration.ofMillis(20));
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
    }

    private Task run(Map<String, Object> params) throws Exception {
        String id = tasks.create(SimulatedWorkHandler.TASK_TYPE, params);
        tasks.claim(id);
        Task created = tasks.get(id).orElseThrow();
        handler.handle(tasks, id, tasks.params(created));
        return tasks.get(id).orElseThrow();
    }

    @Test
    @DisplayName("Basic lifecycle: 5 items complete with full stats and no checkpoint")
    void basicLifecycle() throws Exception {
        Task task = run(Map.of("total_items", 5, "item_duration_ms", 0));

        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(100, task.progress());
        assertEquals(5, task.stats().success());
        assertEquals(0, task.stats().failed());
        assertEquals(5, task.currentIndex());
        assertTrue(tasks.loadCheckpoint(task.id()).isEmpty());

        JsonNode result = TaskService.mapper().readTree(task.result());
        assertEquals(5, result.get("success").intValue());
        assertEquals(5, result.get("total_items").intValue());
    }

    @Test
    @DisplayName("Invalid params: total_items=-1 fails without a checkpoint")
    void invalidTotalItems() throws Exception {
        Task task = run(Map.of("total_items", -1));

        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().contains("total_items"));
        assertTrue(tasks.loadCheckpoint(task.id()).isEmpty());
        assertEquals(0, task.stats().total());
    }

    @Test
    void rejectsOutOfRangeFailureRate() throws Exception {
        Task task = run(Map.of("total_items", 3, "failure_rate", 1.5));

        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().contains("failure_rate"));
    }

    @Test
    void rejectsWrongParamType() throws Exception {
        Task task = run(Map.of("total_items", "many"));

        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().contains("total_items"));
    }

    @Test
    void failureRateOneFailsEveryItemButCompletes() throws Exception {
        Task task = run(Map.of("total_items", 4, "item_duration_ms", 0, "failure_rate", 1.0));

        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(0, task.stats().success());
        assertEquals(4, task.stats().failed());
    }

    @Test
    @Timeout(10)
    void simulatedPauseWaitsForResume() throws Exception {
        String id = tasks.create(SimulatedWorkHandler.TASK_TYPE,
                Map.of("total_items", 6, "item_duration_ms", 0, "simulate_pause", true));
        tasks.claim(id);

        Thread resumer = new Thread(() -> {
            try {
                while (tasks.get(id).orElseThrow().status() != TaskStatus.PAUSED) {
                    Thread.sleep(10);
                }
                tasks.resumeTask(id);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        resumer.start();

        handler.handle(tasks, id, tasks.params(tasks.get(id).orElseThrow()));
        resumer.join();

        Task task = tasks.get(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(6, task.stats().success());
    }
}
