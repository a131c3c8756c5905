package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.model.StatKey;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulated workload registered as {@code test_handler}.
 * Each item sleeps for {@code item_duration_ms} and then succeeds, or fails
 * with probability {@code failure_rate}. With {@code simulate_pause} the handler
 * asks for a pause of its own task once it is half-way through.
 */
public class SimulatedWorkHandler implements TaskHandler {

    public static final String TASK_TYPE = "test_handler";

    private static final Logger log = LoggerFactory.getLogger(SimulatedWorkHandler.class);

    private final int defaultCheckpointInterval;
    private final Duration pausePollInterval;

    public SimulatedWorkHandler(int defaultCheckpointInterval, Duration pausePollInterval) {
        this.defaultCheckpointInterval = defaultCheckpointInterval;
        this.pausePollInterval = pausePollInterval;
    }

    @Override
    public void handle(TaskService tasks, String taskId, JsonNode params) throws Exception {
        String prefix = "[Task-" + Task.shortId(taskId) + "]";

        int totalItems;
        long itemDurationMs;
        int checkpointInterval;
        double failureRate;
        boolean simulatePause;
        try {
            HandlerParams p = HandlerParams.of(params);
            totalItems = p.getInt("total_items", 100);
            itemDurationMs = p.getInt("item_duration_ms", 100);
            checkpointInterval = p.getInt("checkpoint_interval", defaultCheckpointInterval);
            failureRate = p.getDouble("failure_rate", 0.0);
            simulatePause = p.getBoolean("simulate_pause", false);

            if (totalItems <= 0) {
                throw new InvalidParamsException("total_items must be greater than 0, got " + totalItems);
            }
            if (itemDurationMs < 0) {
                throw new InvalidParamsException("item_duration_ms must not be negative, got " + itemDurationMs);
            }
            if (checkpointInterval <= 0) {
                throw new InvalidParamsException("checkpoint_interval must be greater than 0, got " + checkpointInterval);
            }
            if (failureRate < 0.0 || failureRate > 1.0) {
                throw new InvalidParamsException("failure_rate must be between 0 and 1, got " + failureRate);
            }
        } catch (InvalidParamsException e) {
            tasks.fail(taskId, "Invalid params: " + e.getMessage());
            return;
        }

        log.info("{} Simulating {} items ({} ms each, failure rate {})",
                prefix, totalItems, itemDurationMs, failureRate);

        int pauseAfter = totalItems / 2;
        ResumableLoop loop = ResumableLoop.builder(tasks, taskId)
                .totalItems(totalItems)
                .checkpointInterval(checkpointInterval)
                .pausePollInterval(pausePollInterval)
                .build();

        ResumableLoop.Outcome outcome = loop.run(index -> {
            if (itemDurationMs > 0) {
                Thread.sleep(itemDurationMs);
            }
            if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
                tasks.incrementStats(taskId, StatKey.FAILED);
                log.debug("{} Simulated failure at item {}", prefix, index);
            } else {
                tasks.incrementStats(taskId, StatKey.SUCCESS);
            }
            if (simulatePause && index == pauseAfter) {
                tasks.requestPause(taskId);
            }
        });

        if (outcome != ResumableLoop.Outcome.COMPLETED) {
            return;
        }

        TaskStats stats = tasks.get(taskId).map(Task::stats).orElse(TaskStats.ZERO);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_items", totalItems);
        result.put(StatKey.SUCCESS.key(), stats.success());
        result.put(StatKey.FAILED.key(), stats.failed());
        result.put(StatKey.SKIPPED.key(), stats.skipped());

        tasks.complete(taskId, totalItems, result,
                "Processed " + totalItems + " items: " + stats.success() + " succeeded, "
                        + stats.failed() + " failed");
    }
}
