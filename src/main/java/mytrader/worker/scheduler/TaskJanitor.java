package mytrader.worker.scheduler;

import mytrader.worker.config.WorkerConfig;
import mytrader.worker.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background cleanup of finished tasks.
 * <p>
 * Completed, failed and stopped tasks older than the retention period are deleted
 * together with any checkpoint they left behind. Live tasks are never touched.
 */
public class TaskJanitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskJanitor.class);

    private final TaskService taskService;
    private final WorkerConfig config;

    public TaskJanitor(TaskService taskService, WorkerConfig config) {
        this.taskService = taskService;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            purgeExpired();
        } catch (Exception e) {
            log.error("Task janitor error", e);
        }
    }

    /**
     * Delete tasks that finished before now minus the retention period.
     *
     * @return number of tasks deleted
     */
    public int purgeExpired() {
        Instant cutoff = Instant.now().minus(config.taskRetention());
        int purged = taskService.purgeFinishedBefore(cutoff);
        if (purged > 0) {
            log.info("Task janitor: purged {} tasks finished before {}", purged, cutoff);
        } else {
            log.debug("Task janitor: nothing to purge");
        }
        return purged;
    }
}
