package mytrader.worker.scheduler;

import mytrader.worker.config.WorkerConfig;
import mytrader.worker.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs periodic maintenance next to the worker loop.
 * Currently only the {@link TaskJanitor}, on a single daemon thread.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskJanitor taskJanitor;
    private final WorkerConfig config;

    private volatile boolean running = false;

    public Scheduler(TaskService taskService, WorkerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mytrader-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskJanitor = new TaskJanitor(taskService, config);
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long intervalMs = config.janitorInterval().toMillis();
        executor.scheduleAtFixedRate(taskJanitor, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Task janitor scheduled every {}ms (retention {})", intervalMs, config.taskRetention());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The janitor, for a manual purge.
     */
    public TaskJanitor taskJanitor() {
        return taskJanitor;
    }
}
