package mytrader;

import mytrader.worker.config.Dependencies;
import mytrader.worker.config.WorkerConfig;
import mytrader.worker.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task worker process entry point.
 * Runs until the JVM receives a termination signal, then drains running tasks.
 * <p>
 * {@link #main} registers only {@code test_handler}. The stock price, financial
 * report and index data handlers need market data sources; a launcher that has
 * them builds {@link Dependencies#symbolRegistry} and calls {@link #run}.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        WorkerConfig config;
        try {
            config = WorkerConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        run(config, Dependencies.defaultRegistry(config));
    }

    /**
     * Start the worker with the given handlers and block until shutdown.
     */
    public static void run(WorkerConfig config, HandlerRegistry registry) throws InterruptedException {
        Dependencies deps = Dependencies.create(config, registry);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Termination signal received, shutting down...");
            deps.close();
        }, "mytrader-shutdown"));

        deps.start();
        log.info("Task worker running; handlers: {}", deps.handlerRegistry().taskTypes());

        deps.taskWorker().awaitShutdown();
    }
}
