package mytrader.worker.config;

import mytrader.worker.handler.HandlerRegistry;
import mytrader.worker.handler.SimulatedWorkHandler;
import mytrader.worker.handler.SymbolSyncHandler;
import mytrader.worker.handler.SymbolUniverse;
import mytrader.worker.handler.SymbolUpdater;
import mytrader.worker.repository.CheckpointRepository;
import mytrader.worker.repository.TaskRepository;
import mytrader.worker.scheduler.Scheduler;
import mytrader.worker.scheduler.TaskWorker;
import mytrader.worker.service.TaskService;
import mytrader.worker.store.Database;
import mytrader.worker.store.JdbcCheckpointRepository;
import mytrader.worker.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container for the worker process.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(WorkerConfig.fromEnv());
 * deps.start();
 * deps.taskService().create("test_handler", Map.of("total_items", 5));
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkerConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final CheckpointRepository checkpointRepository;
    private final TaskService taskService;
    private final HandlerRegistry handlerRegistry;
    private final TaskWorker taskWorker;
    private final Scheduler scheduler;

    private Dependencies(WorkerConfig config, HandlerRegistry handlerRegistry) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);

        this.taskRepository = new JdbcTaskRepository(database);
        this.checkpointRepository = new JdbcCheckpointRepository(database);

        this.taskService = new TaskService(taskRepository, checkpointRepository);
        this.handlerRegistry = handlerRegistry;
        this.taskWorker = new TaskWorker(taskService, handlerRegistry, config);
        this.scheduler = new Scheduler(taskService, config);

        log.info("Dependencies initialized with {} task types", handlerRegistry.size());
    }

    /**
     * Create dependencies with only the built-in {@code test_handler} registered.
     */
    public static Dependencies create(WorkerConfig config) {
        return create(config, defaultRegistry(config));
    }

    public static Dependencies create(WorkerConfig config, HandlerRegistry handlerRegistry) {
        return new Dependencies(config, handlerRegistry);
    }

    public static Dependencies create() {
        return create(WorkerConfig.fromEnv());
    }

    public static HandlerRegistry defaultRegistry(WorkerConfig config) {
        return new HandlerRegistry().register(SimulatedWorkHandler.TASK_TYPE,
                new SimulatedWorkHandler(config.checkpointInterval(), config.pausePollInterval()));
    }

    /**
     * The default registry plus the per-symbol sync handlers backed by the given
     * market data sources.
     *
     * @param stocks    stock universe for prices and financial reports
     * @param indices   index codes for index data
     * @param prices    per-symbol price update
     * @param reports   per-symbol financial report update
     * @param indexData per-index update
     */
    public static HandlerRegistry symbolRegistry(WorkerConfig config, SymbolUniverse stocks, SymbolUniverse indices,
            SymbolUpdater prices, SymbolUpdater reports, SymbolUpdater indexData) {
        HandlerRegistry registry = defaultRegistry(config);
        SymbolSyncHandler.registerStockPrices(registry, stocks, prices,
                config.checkpointInterval(), config.pausePollInterval());
        SymbolSyncHandler.registerFinancialReports(registry, stocks, reports,
                config.checkpointInterval(), config.pausePollInterval());
        SymbolSyncHandler.registerIndexData(registry, indices, indexData,
                config.checkpointInterval(), config.pausePollInterval());
        return registry;
    }

    public WorkerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public CheckpointRepository checkpointRepository() {
        return checkpointRepository;
    }

    public TaskService taskService() {
        return taskService;
    }

    public HandlerRegistry handlerRegistry() {
        return handlerRegistry;
    }

    public TaskWorker taskWorker() {
        return taskWorker;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Start maintenance, then the worker loop (recovery runs first).
     */
    public void start() {
        scheduler.start();
        taskWorker.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Drain the worker before the pool goes away
        try {
            taskWorker.shutdown();
        } catch (Exception e) {
            log.warn("Error stopping task worker: {}", e.getMessage());
        }

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
