package mytrader.worker.model;

/**
 * Named counters of {@link TaskStats}.
 */
public enum StatKey {
    SUCCESS("success", "stats_success"),
    FAILED("failed", "stats_failed"),
    SKIPPED("skipped", "stats_skipped");

    private final String key;
    private final String column;

    StatKey(String key, String column) {
        this.key = key;
        this.column = column;
    }

    public String key() {
        return key;
    }

    /** Backing column in both the tasks and the checkpoints table. */
    public String column() {
        return column;
    }

    public static StatKey of(String key) {
        for (StatKey k : values()) {
            if (k.key.equalsIgnoreCase(key)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown stat key: " + key);
    }
}
