package mytrader.worker.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Resume point of a task.
 *
 * @param taskId       owning task
 * @param currentIndex number of items fully processed, i.e. the index to resume at
 * @param stats        stats snapshot as of {@code currentIndex}
 * @param stage        sub-phase of multi-phase handlers
 * @param savedAt      when the checkpoint was written, null before persisting
 */
public record Checkpoint(String taskId, int currentIndex, TaskStats stats, String stage, Instant savedAt) {

    public static final String DEFAULT_STAGE = "default";

    public Checkpoint {
        Objects.requireNonNull(taskId, "taskId is required");
        if (currentIndex < 0) {
            throw new IllegalArgumentException("currentIndex must be >= 0");
        }
        stats = stats != null ? stats : TaskStats.ZERO;
        stage = stage != null && !stage.isBlank() ? stage : DEFAULT_STAGE;
    }

    public static Checkpoint of(String taskId, int currentIndex, TaskStats stats) {
        return new Checkpoint(taskId, currentIndex, stats, DEFAULT_STAGE, null);
    }
}
