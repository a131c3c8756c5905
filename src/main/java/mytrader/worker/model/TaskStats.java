package mytrader.worker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Success/failed/skipped counters of a task run.
 */
public record TaskStats(
        @JsonProperty("success") int success,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped) {

    public static final TaskStats ZERO = new TaskStats(0, 0, 0);

    public TaskStats {
        if (success < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("stats must not be negative");
        }
    }

    public static TaskStats ofSuccess(int success) {
        return new TaskStats(success, 0, 0);
    }

    public int get(StatKey key) {
        return switch (key) {
            case SUCCESS -> success;
            case FAILED -> failed;
            case SKIPPED -> skipped;
        };
    }

    public TaskStats plus(StatKey key, int amount) {
        return switch (key) {
            case SUCCESS -> new TaskStats(success + amount, failed, skipped);
            case FAILED -> new TaskStats(success, failed + amount, skipped);
            case SKIPPED -> new TaskStats(success, failed, skipped + amount);
        };
    }

    public int total() {
        return success + failed + skipped;
    }
}
