package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.config.WorkerConfig;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.service.TaskService;
import mytrader.worker.store.Database;
import mytrader.worker.store.JdbcCheckpointRepository;
import mytrader.worker.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SymbolSyncHandlerTest {

    private static final List<String> ALL = List.of(
            "600000", "600001", "600002", "600003", "600004",
            "600005", "600006", "600007", "600008", "600009");

    private static Database db;
    private static TaskService tasks;

    private final List<String> updated = new ArrayList<>();

    @BeforeAll
    static void setup() {
        WorkerConfig config = WorkerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-symbols;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        tasks = new TaskService(new JdbcTaskRepository(db), new JdbcCheckpointRepository(db));
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
        updated.clear();
    }

    private static SymbolUniverse universe(List<String> all, List<String> favorites) {
        return new SymbolUniverse() {
            @Override
            public List<String> allSymbols() {
                return all;
            }

            @Override
            public List<String> favoriteSymbols() {
                return favorites;
            }
        };
    }

    private SymbolSyncHandler handler(SymbolUpdater updater) {
        return new SymbolSyncHandler("stock prices", universe(ALL, List.of("600382", "600711")),
                updater, 3, Duration.ofMillis(20));
    }

    private SymbolUpdater recording() {
        return symbol -> {
            updated.add(symbol);
            return TaskStats.ofSuccess(1);
        };
    }

    private String createRunning(Map<String, Object> params) {
        String id = tasks.create(SymbolSyncHandler.UPDATE_STOCK_PRICES, params);
        tasks.claim(id);
        return id;
    }

    private Task run(SymbolSyncHandler handler, String id) throws Exception {
        JsonNode params = tasks.params(tasks.get(id).orElseThrow());
        handler.handle(tasks, id, params);
        return tasks.get(id).orElseThrow();
    }

    @Test
    void updatesEverySymbolByDefault() throws Exception {
        Task task = run(handler(recording()), createRunning(Map.of()));

        assertEquals(ALL, updated);
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(10, task.totalItems());
        assertEquals(10, task.stats().success());

        JsonNode result = TaskService.mapper().readTree(task.result());
        assertEquals(10, result.get("updated_symbols").intValue());
        assertEquals(10, result.get("total_symbols").intValue());
    }

    @Test
    void customRangeUsesGivenSymbols() throws Exception {
        run(handler(recording()), createRunning(Map.of("stock_range", "custom", "custom_stocks", List.of("000001", "000002"))));

        assertEquals(List.of("000001", "000002"), updated);
    }

    @Test
    void favoritesPreferExplicitList() throws Exception {
        run(handler(recording()), createRunning(Map.of("stock_range", "favorites", "stocks", List.of("000858"))));
        assertEquals(List.of("000858"), updated);

        updated.clear();
        run(handler(recording()), createRunning(Map.of("stock_range", "favorites")));
        assertEquals(List.of("600382", "600711"), updated);
    }

    @Test
    void customRangeWithoutSymbolsIsInvalid() throws Exception {
        Task task = run(handler(recording()), createRunning(Map.of("stock_range", "custom")));

        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().contains("custom_stocks"));
        assertTrue(updated.isEmpty());
    }

    @Test
    void unknownRangeIsInvalid() throws Exception {
        Task task = run(handler(recording()), createRunning(Map.of("stock_range", "sector")));

        assertEquals(TaskStatus.FAILED, task.status());
        assertTrue(task.error().contains("stock_range"));
    }

    @Test
    void emptyUniverseFails() throws Exception {
        SymbolSyncHandler handler = new SymbolSyncHandler("stock prices", universe(List.of(), List.of()),
                recording(), 3, Duration.ofMillis(20));

        Task task = run(handler, createRunning(Map.of()));

        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals("Unable to resolve stock list", task.error());
    }

    @Test
    @Timeout(10)
    void interruptedSymbolLookupPropagatesAndLeavesTaskRunning() throws Exception {
        CountDownLatch listing = new CountDownLatch(1);
        SymbolUniverse slow = new SymbolUniverse() {
            @Override
            public List<String> allSymbols() throws Exception {
                listing.countDown();
                Thread.sleep(10_000);
                return ALL;
            }

            @Override
            public List<String> favoriteSymbols() {
                return List.of();
            }
        };
        SymbolSyncHandler handler = new SymbolSyncHandler("stock prices", slow, recording(), 3, Duration.ofMillis(20));
        String id = createRunning(Map.of("stock_range", "all"));
        JsonNode params = tasks.params(tasks.get(id).orElseThrow());

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                handler.handle(tasks, id, params);
            } catch (Throwable e) {
                thrown.set(e);
            }
        });
        runner.start();
        assertTrue(listing.await(5, TimeUnit.SECONDS));
        runner.interrupt();
        runner.join(5000);

        assertInstanceOf(InterruptedException.class, thrown.get());
        Task task = tasks.get(id).orElseThrow();
        assertEquals(TaskStatus.RUNNING, task.status());
        assertNull(task.error());
        assertTrue(updated.isEmpty());
    }

    @Test
    void failingSymbolIsCountedAndRunContinues() throws Exception {
        SymbolUpdater updater = symbol -> {
            updated.add(symbol);
            if (symbol.equals("600003")) {
                throw new IllegalStateException("provider timeout");
            }
            return symbol.equals("600005") ? new TaskStats(0, 0, 1) : new TaskStats(2, 0, 0);
        };

        Task task = run(handler(updater), createRunning(Map.of()));

        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(ALL, updated);
        assertEquals(new TaskStats(16, 1, 1), task.stats());
    }

    @Test
    void stopMidRunThenResumeProcessesRemainingSymbolsOnce() throws Exception {
        String id = createRunning(Map.of());
        SymbolUpdater stopAfterFive = symbol -> {
            updated.add(symbol);
            if (updated.size() == 5) {
                tasks.requestStop(id);
            }
            return TaskStats.ofSuccess(1);
        };

        Task stopped = run(handler(stopAfterFive), id);
        assertEquals(TaskStatus.STOPPED, stopped.status());
        assertEquals(ALL.subList(0, 5), updated);
        assertEquals(5, tasks.loadCheckpoint(id).orElseThrow().currentIndex());

        // Put the row back to running as a restarted worker would find it
        try (var conn = db.getConnection();
                var ps = conn.prepareStatement("UPDATE tasks SET status = 'running', completed_at = NULL WHERE task_id = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
            conn.commit();
        }

        updated.clear();
        Task resumed = run(handler(recording()), id);

        assertEquals(ALL.subList(5, 10), updated);
        assertEquals(TaskStatus.COMPLETED, resumed.status());
        assertEquals(10, resumed.stats().success());
        assertTrue(tasks.loadCheckpoint(id).isEmpty());
    }

    @Test
    void registersStockPriceAliases() {
        HandlerRegistry registry = new HandlerRegistry();
        SymbolSyncHandler.registerStockPrices(registry, universe(ALL, List.of()), recording(), 10, Duration.ofSeconds(1));

        assertTrue(registry.find(SymbolSyncHandler.UPDATE_STOCK_PRICES).isPresent());
        assertTrue(registry.find(SymbolSyncHandler.UPDATE_ALL_STOCKS).isPresent());
        assertTrue(registry.find(SymbolSyncHandler.UPDATE_FAVORITES).isPresent());
    }

    @Test
    void financialReportsAndIndexDataShareTheLoop() throws Exception {
        HandlerRegistry registry = new HandlerRegistry();
        SymbolSyncHandler.registerFinancialReports(registry, universe(ALL, List.of()), recording(), 3, Duration.ofMillis(20));
        SymbolSyncHandler.registerIndexData(registry, universe(List.of("000001.SH", "399001.SZ"), List.of()),
                recording(), 3, Duration.ofMillis(20));

        String reports = tasks.create(SymbolSyncHandler.UPDATE_FINANCIAL_REPORTS,
                Map.of("stock_range", "custom", "custom_stocks", List.of("600382")));
        tasks.claim(reports);
        registry.find(SymbolSyncHandler.UPDATE_FINANCIAL_REPORTS).orElseThrow()
                .handle(tasks, reports, tasks.params(tasks.get(reports).orElseThrow()));

        String indices = tasks.create(SymbolSyncHandler.UPDATE_INDEX_DATA, Map.of());
        tasks.claim(indices);
        registry.find(SymbolSyncHandler.UPDATE_INDEX_DATA).orElseThrow()
                .handle(tasks, indices, tasks.params(tasks.get(indices).orElseThrow()));

        assertEquals(List.of("600382", "000001.SH", "399001.SZ"), updated);
        assertEquals(TaskStatus.COMPLETED, tasks.get(reports).orElseThrow().status());
        assertEquals(2, tasks.get(indices).orElseThrow().stats().success());
    }
}
