package mytrader.worker.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a task row.
 * The store owns the row; callers re-read instead of holding on to a snapshot.
 */
public final class Task {
    private final String id;
    private final String taskType;
    private final TaskStatus status;
    private final int progress;
    private final int currentIndex;
    private final int totalItems;
    private final TaskStats stats;
    private final String params; // JSON, handler specific
    private final String metadata; // JSON or null
    private final String result; // JSON or null
    private final String error;
    private final String message;
    private final boolean stopRequested;
    private final boolean pauseRequested;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.currentIndex = builder.currentIndex;
        this.totalItems = builder.totalItems;
        this.stats = builder.stats != null ? builder.stats : TaskStats.ZERO;
        this.params = builder.params;
        this.metadata = builder.metadata;
        this.result = builder.result;
        this.error = builder.error;
        this.message = builder.message;
        this.stopRequested = builder.stopRequested;
        this.pauseRequested = builder.pauseRequested;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String taskType() {
        return taskType;
    }

    public TaskStatus status() {
        return status;
    }

    public int progress() {
        return progress;
    }

    public int currentIndex() {
        return currentIndex;
    }

    public int totalItems() {
        return totalItems;
    }

    public TaskStats stats() {
        return stats;
    }

    public String params() {
        return params;
    }

    public String metadata() {
        return metadata;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    public String message() {
        return message;
    }

    public boolean stopRequested() {
        return stopRequested;
    }

    public boolean pauseRequested() {
        return pauseRequested;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Short id used in thread names and log lines */
    public String shortId() {
        return shortId(id);
    }

    public static String shortId(String taskId) {
        return taskId.length() > 8 ? taskId.substring(0, 8) : taskId;
    }

    /** Create a builder from this task (for tests and copies) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskType(taskType)
                .status(status)
                .progress(progress)
                .currentIndex(currentIndex)
                .totalItems(totalItems)
                .stats(stats)
                .params(params)
                .metadata(metadata)
                .result(result)
                .error(error)
                .message(message)
                .stopRequested(stopRequested)
                .pauseRequested(pauseRequested)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskType;
        private TaskStatus status = TaskStatus.PENDING;
        private int progress;
        private int currentIndex;
        private int totalItems;
        private TaskStats stats = TaskStats.ZERO;
        private String params;
        private String metadata;
        private String result;
        private String error;
        private String message;
        private boolean stopRequested;
        private boolean pauseRequested;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder currentIndex(int currentIndex) {
            this.currentIndex = currentIndex;
            return this;
        }

        public Builder totalItems(int totalItems) {
            this.totalItems = totalItems;
            return this;
        }

        public Builder stats(TaskStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder metadata(String metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder stopRequested(boolean stopRequested) {
            this.stopRequested = stopRequested;
            return this;
        }

        public Builder pauseRequested(boolean pauseRequested) {
            this.pauseRequested = pauseRequested;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + taskType + "', status=" + status
                + ", progress=" + progress + ", index=" + currentIndex + "/" + totalItems + "}";
    }
}
