package mytrader.worker.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle status.
 * Stored in the database by its lower-case code.
 */
public enum TaskStatus {
    /** Task created, waiting for the worker to claim it */
    PENDING("pending"),
    /** Task claimed by the worker and executing in a handler */
    RUNNING("running"),
    /** Handler is parked at an iteration boundary until resumed or stopped */
    PAUSED("paused"),
    /** Handler finished all items */
    COMPLETED("completed"),
    /** Configuration error or fatal handler error */
    FAILED("failed"),
    /** Stopped on request, a checkpoint is kept for inspection */
    STOPPED("stopped");

    private static final Set<TaskStatus> LIVE = EnumSet.of(PENDING, RUNNING, PAUSED);
    private static final Set<TaskStatus> UNFINISHED = EnumSet.of(RUNNING, PAUSED);

    private final String code;

    TaskStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return !LIVE.contains(this);
    }

    public static Set<TaskStatus> live() {
        return EnumSet.copyOf(LIVE);
    }

    /** Statuses left behind by a worker that died mid-run. */
    public static Set<TaskStatus> unfinished() {
        return EnumSet.copyOf(UNFINISHED);
    }

    public static TaskStatus fromCode(String code) {
        for (TaskStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + code);
    }
}
