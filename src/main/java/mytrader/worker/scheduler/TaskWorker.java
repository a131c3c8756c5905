package mytrader.worker.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.config.WorkerConfig;
import mytrader.worker.handler.HandlerRegistry;
import mytrader.worker.handler.TaskHandler;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.model.TaskUpdate;
import mytrader.worker.service.TaskService;
import mytrader.worker.store.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the task store for pending tasks and runs each one on its own thread.
 * <p>
 * On start, tasks left running or paused by a previous process are re-dispatched
 * before the first poll. Each tick claims at most one pending task, oldest first,
 * while fewer than {@code maxConcurrent} tracked tasks are alive. The claim
 * (pending to running) is what keeps two workers from running the same task.
 * <p>
 * Handlers report outcomes through the store. Anything a handler throws is caught
 * here and recorded as a failure; store errors during a tick are logged and the
 * next tick retries.
 */
public class TaskWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private static final int DISPATCH_PER_TICK = 1;
    private static final long DRAIN_POLL_MS = 200;

    private final TaskService tasks;
    private final HandlerRegistry registry;
    private final WorkerConfig config;

    private final Map<String, Future<?>> running = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final ScheduledExecutorService poller;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean started = false;
    private volatile boolean stopping = false;

    public TaskWorker(TaskService tasks, HandlerRegistry registry, WorkerConfig config) {
        this.tasks = tasks;
        this.registry = registry;
        this.config = config;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-exec");
            t.setDaemon(true);
            return t;
        });
        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mytrader-task-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Recover orphaned tasks, then start polling every {@code pollInterval}.
     */
    public synchronized void start() {
        if (started) {
            log.warn("Task worker already started");
            return;
        }
        started = true;

        log.info("Task worker starting (poll every {}s, max {} concurrent, handlers {})",
                config.pollInterval().toSeconds(), config.maxConcurrent(), registry.taskTypes());

        try {
            recoverUnfinished();
        } catch (Exception e) {
            log.error("Startup recovery failed", e);
        }

        long intervalMs = config.pollInterval().toMillis();
        poller.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Task poll failed, retrying next tick", e);
        }
    }

    /**
     * Re-dispatch tasks left running or paused by a previous process.
     * Paused tasks are put back to running since nobody is left to resume them.
     * Recovered tasks are not limited by {@code maxConcurrent}.
     *
     * @return number of tasks re-dispatched
     */
    public int recoverUnfinished() {
        List<Task> unfinished = tasks.unfinishedTasks();
        if (unfinished.isEmpty()) {
            log.debug("No unfinished tasks to recover");
            return 0;
        }

        log.info("Found {} unfinished tasks, recovering", unfinished.size());
        int recovered = 0;
        for (Task task : unfinished) {
            if (running.containsKey(task.id())) {
                continue;
            }
            if (task.status() == TaskStatus.PAUSED) {
                tasks.resumeTask(task.id());
            }
            tasks.update(task.id(), TaskUpdate.message("Recovered after worker restart"));
            if (spawn(task, "recovery")) {
                recovered++;
                log.info("Recovered task {} ({}, was {})", task.shortId(), task.taskType(), task.status().code());
            }
        }
        return recovered;
    }

    /**
     * One dispatch tick: forget finished threads, then claim and start pending
     * tasks while there is capacity.
     *
     * @return number of tasks dispatched
     */
    public int pollOnce() {
        if (stopping) {
            return 0;
        }
        reapFinished();

        int free = config.maxConcurrent() - running.size();
        if (free <= 0) {
            log.debug("At capacity ({} running), not dispatching", running.size());
            return 0;
        }

        int dispatched = 0;
        for (Task task : tasks.findPending(Math.min(free, DISPATCH_PER_TICK))) {
            if (running.containsKey(task.id())) {
                continue;
            }
            if (!tasks.claim(task.id())) {
                log.debug("Task {} was claimed or cancelled elsewhere", task.shortId());
                continue;
            }
            if (spawn(task, "task")) {
                dispatched++;
                log.info("Dispatched task {} ({})", task.shortId(), task.taskType());
            }
        }
        return dispatched;
    }

    private boolean spawn(Task task, String threadPrefix) {
        if (stopping) {
            return false;
        }
        String name = threadPrefix + "-" + task.shortId();
        try {
            Future<?> future = executor.submit(() -> {
                Thread.currentThread().setName(name);
                execute(task);
            });
            running.put(task.id(), future);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Worker is shutting down, task {} left for recovery", task.shortId());
            return false;
        }
    }

    private void reapFinished() {
        running.entrySet().removeIf(e -> e.getValue().isDone());
    }

    /**
     * Runs on the task's own thread. Nothing thrown here may escape.
     */
    private void execute(Task task) {
        String id = task.id();
        try {
            Optional<TaskHandler> handler = registry.find(task.taskType());
            if (handler.isEmpty()) {
                tasks.fail(id, "Unknown task type: " + task.taskType());
                return;
            }

            JsonNode params;
            try {
                params = tasks.params(task);
            } catch (TaskStoreException e) {
                tasks.fail(id, "Invalid params: " + e.getMessage());
                return;
            }

            handler.get().handle(tasks, id, params);

            if (!Thread.currentThread().isInterrupted()) {
                tasks.get(id)
                        .filter(t -> !t.isTerminal())
                        .ifPresent(t -> log.warn("Handler for {} returned but task {} is still {}",
                                t.taskType(), t.shortId(), t.status().code()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted, leaving it for recovery", task.shortId());
        } catch (Exception e) {
            log.error("Task {} ({}) failed with an exception", task.shortId(), task.taskType(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.toString();
            try {
                tasks.fail(id, error);
            } catch (Exception storeError) {
                log.error("Could not record failure of task {}", task.shortId(), storeError);
            }
        }
    }

    /** Number of tracked tasks whose thread is still alive. */
    public int activeCount() {
        reapFinished();
        return running.size();
    }

    public boolean isTracked(String taskId) {
        Future<?> future = running.get(taskId);
        return future != null && !future.isDone();
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Stop dispatching and wait up to the grace period for running tasks to finish.
     * Threads still alive afterwards are interrupted and abandoned; their tasks stay
     * running and are picked up by the next process's recovery. Idempotent.
     */
    public void shutdown() {
        synchronized (this) {
            if (stopping) {
                return;
            }
            stopping = true;
        }

        log.info("Task worker shutting down");
        poller.shutdown();
        executor.shutdown();

        Duration grace = config.shutdownGracePeriod();
        long deadline = System.nanoTime() + grace.toNanos();
        try {
            while (activeCount() > 0 && System.nanoTime() < deadline) {
                long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                Thread.sleep(Math.max(1, Math.min(DRAIN_POLL_MS, left)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int left = activeCount();
        if (left > 0) {
            log.warn("{} tasks still running after {}s grace period, abandoning: {}",
                    left, grace.toSeconds(), running.keySet());
            executor.shutdownNow();
        } else {
            log.info("Task worker stopped gracefully");
        }
        terminated.countDown();
    }

    /**
     * Block until {@link #shutdown()} has completed.
     */
    public void awaitShutdown() throws InterruptedException {
        terminated.await();
    }

    @Override
    public void close() {
        shutdown();
    }
}
