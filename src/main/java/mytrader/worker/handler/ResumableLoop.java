package mytrader.worker.handler;

import mytrader.worker.model.Checkpoint;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.model.TaskUpdate;
import mytrader.worker.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Sequential item loop shared by iterating handlers.
 * <p>
 * Resumes from the task's checkpoint, checks stop and pause between items only,
 * writes a checkpoint every {@code checkpointInterval} items and before stopping,
 * and keeps {@code current_index}/{@code progress} in the store up to date.
 * A checkpoint index is the number of items fully processed, so a resumed run
 * starts exactly at the first unprocessed item.
 * <p>
 * Stats are counted only through {@link TaskService#incrementStats}; on start the
 * row counters are reset to the checkpoint snapshot (or zero) so that items
 * re-processed after a crash are not counted twice.
 */
public final class ResumableLoop {

    private static final Logger log = LoggerFactory.getLogger(ResumableLoop.class);

    public enum Outcome {
        /** Every item was processed; the caller finalizes the task. */
        COMPLETED,
        /** Stop was honored: checkpoint written, task is {@code stopped}. */
        STOPPED,
        /** The thread was interrupted: checkpoint written, task left live for recovery. */
        INTERRUPTED
    }

    /**
     * Processes one item. Per-item failures the handler can tolerate should be
     * counted and swallowed inside; anything thrown aborts the whole run.
     */
    @FunctionalInterface
    public interface ItemProcessor {
        void process(int index) throws Exception;
    }

    private final TaskService tasks;
    private final String taskId;
    private final int totalItems;
    private final int checkpointInterval;
    private final Duration pausePollInterval;
    private final IntFunction<String> itemLabel;
    private final String logPrefix;

    private ResumableLoop(Builder builder) {
        this.tasks = Objects.requireNonNull(builder.tasks, "tasks is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.totalItems = builder.totalItems;
        this.checkpointInterval = builder.checkpointInterval;
        this.pausePollInterval = builder.pausePollInterval;
        this.itemLabel = builder.itemLabel;
        this.logPrefix = "[Task-" + Task.shortId(taskId) + "]";
    }

    public static Builder builder(TaskService tasks, String taskId) {
        return new Builder(tasks, taskId);
    }

    public Outcome run(ItemProcessor processor) throws Exception {
        int startIndex = prepareStart();

        for (int i = startIndex; i < totalItems; i++) {
            Outcome interruption = awaitBoundary(i);
            if (interruption != null) {
                return interruption;
            }

            if (i > startIndex && i % checkpointInterval == 0) {
                tasks.saveCheckpoint(taskId, i, currentStats());
                log.debug("{} Checkpoint saved at item {}", logPrefix, i);
            }

            try {
                processor.process(i);
            } catch (InterruptedException e) {
                tasks.saveCheckpoint(taskId, i, currentStats());
                Thread.currentThread().interrupt();
                log.warn("{} Interrupted during item {}", logPrefix, i);
                return Outcome.INTERRUPTED;
            }

            int done = i + 1;
            tasks.update(taskId, TaskUpdate.builder()
                    .currentIndex(done)
                    .progress(progressOf(done))
                    .message("Processed " + itemLabel.apply(i) + " (" + done + "/" + totalItems + ")")
                    .build());
        }
        return Outcome.COMPLETED;
    }

    private int prepareStart() {
        Optional<Checkpoint> checkpoint = tasks.loadCheckpoint(taskId);
        int startIndex = 0;
        TaskStats stats = TaskStats.ZERO;

        if (checkpoint.isPresent()) {
            startIndex = Math.min(checkpoint.get().currentIndex(), totalItems);
            stats = checkpoint.get().stats();
            log.info("{} Resuming from item {} of {}", logPrefix, startIndex, totalItems);
        }

        tasks.update(taskId, TaskUpdate.builder()
                .totalItems(totalItems)
                .currentIndex(startIndex)
                .progress(progressOf(startIndex))
                .stats(stats)
                .message(startIndex > 0
                        ? "Resuming at item " + (startIndex + 1) + " of " + totalItems
                        : "Processing " + totalItems + " items")
                .build());
        return startIndex;
    }

    /**
     * @return null to go on with item {@code index}, otherwise how the run ended
     */
    private Outcome awaitBoundary(int index) {
        if (tasks.isStopRequested(taskId)) {
            return stopAt(index);
        }
        if (!tasks.isPauseRequested(taskId)) {
            return null;
        }

        tasks.update(taskId, TaskUpdate.status(TaskStatus.PAUSED,
                "Paused before item " + (index + 1) + " of " + totalItems));
        log.info("{} Paused at item {}", logPrefix, index);

        while (true) {
            try {
                Thread.sleep(pausePollInterval.toMillis());
            } catch (InterruptedException e) {
                // Store calls happen before the interrupt flag is restored
                tasks.saveCheckpoint(taskId, index, currentStats());
                Thread.currentThread().interrupt();
                log.warn("{} Interrupted while paused at item {}", logPrefix, index);
                return Outcome.INTERRUPTED;
            }
            // Stop wins over pause.
            if (tasks.isStopRequested(taskId)) {
                tasks.clearPauseRequest(taskId);
                return stopAt(index);
            }
            if (!tasks.isPauseRequested(taskId)) {
                break;
            }
        }

        tasks.update(taskId, TaskUpdate.status(TaskStatus.RUNNING,
                "Resumed at item " + (index + 1) + " of " + totalItems));
        log.info("{} Resumed at item {}", logPrefix, index);
        return null;
    }

    private Outcome stopAt(int index) {
        tasks.saveCheckpoint(taskId, index, currentStats());
        tasks.update(taskId, TaskUpdate.status(TaskStatus.STOPPED,
                "Task stopped at item " + index + " of " + totalItems));
        tasks.clearStopRequest(taskId);
        log.info("{} Stopped at item {}", logPrefix, index);
        return Outcome.STOPPED;
    }

    private TaskStats currentStats() {
        return tasks.get(taskId).map(Task::stats).orElse(TaskStats.ZERO);
    }

    private int progressOf(int done) {
        if (totalItems <= 0) {
            return 100;
        }
        return (int) ((long) done * 100 / totalItems);
    }

    public static final class Builder {
        private final TaskService tasks;
        private final String taskId;
        private int totalItems;
        private int checkpointInterval = 10;
        private Duration pausePollInterval = Duration.ofSeconds(1);
        private IntFunction<String> itemLabel = i -> "item " + (i + 1);

        private Builder(TaskService tasks, String taskId) {
            this.tasks = tasks;
            this.taskId = taskId;
        }

        public Builder totalItems(int totalItems) {
            if (totalItems < 0) {
                throw new IllegalArgumentException("totalItems must be >= 0");
            }
            this.totalItems = totalItems;
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            if (checkpointInterval < 1) {
                throw new IllegalArgumentException("checkpointInterval must be >= 1");
            }
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder pausePollInterval(Duration pausePollInterval) {
            this.pausePollInterval = Objects.requireNonNull(pausePollInterval);
            return this;
        }

        public Builder itemLabel(IntFunction<String> itemLabel) {
            this.itemLabel = Objects.requireNonNull(itemLabel);
            return this;
        }

        public ResumableLoop build() {
            return new ResumableLoop(this);
        }
    }
}
