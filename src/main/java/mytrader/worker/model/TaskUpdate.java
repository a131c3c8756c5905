package mytrader.worker.model;

/**
 * Partial update of a task row. Only the fields that were set are written,
 * everything else in the row is left untouched.
 * <p>
 * {@code stats} replaces all three counters at once and is meant for explicit
 * resets only; regular accounting goes through the store's increment operation.
 * {@code result} is already serialized JSON.
 */
public final class TaskUpdate {
    private final TaskStatus status;
    private final Integer progress;
    private final Integer currentIndex;
    private final Integer totalItems;
    private final TaskStats stats;
    private final String result;
    private final String error;
    private final String message;

    private TaskUpdate(Builder builder) {
        this.status = builder.status;
        this.progress = builder.progress;
        this.currentIndex = builder.currentIndex;
        this.totalItems = builder.totalItems;
        this.stats = builder.stats;
        this.result = builder.result;
        this.error = builder.error;
        this.message = builder.message;
    }

    public TaskStatus status() {
        return status;
    }

    public Integer progress() {
        return progress;
    }

    public Integer currentIndex() {
        return currentIndex;
    }

    public Integer totalItems() {
        return totalItems;
    }

    public TaskStats stats() {
        return stats;
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

    public boolean isEmpty() {
        return status == null && progress == null && currentIndex == null && totalItems == null
                && stats == null && result == null && error == null && message == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TaskUpdate message(String message) {
        return builder().message(message).build();
    }

    public static TaskUpdate status(TaskStatus status, String message) {
        return builder().status(status).message(message).build();
    }

    public static final class Builder {
        private TaskStatus status;
        private Integer progress;
        private Integer currentIndex;
        private Integer totalItems;
        private TaskStats stats;
        private String result;
        private String error;
        private String message;

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            if (progress < 0 || progress > 100) {
                throw new IllegalArgumentException("progress must be within 0..100, got " + progress);
            }
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

        public Builder result(String resultJson) {
            this.result = resultJson;
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

        public TaskUpdate build() {
            return new TaskUpdate(this);
        }
    }

    @Override
    public String toString() {
        return "TaskUpdate{status=" + status + ", progress=" + progress + ", index=" + currentIndex
                + ", message='" + message + "'}";
    }
}
