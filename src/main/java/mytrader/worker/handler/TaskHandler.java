package mytrader.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import mytrader.worker.service.TaskService;

/**
 * Unit of work for one task type.
 * <p>
 * A handler reports everything through the task store: progress, stats, status,
 * result and error. It must fail its task (not throw) on invalid params, resume
 * from its checkpoint when one exists, honor stop/pause between items and drop
 * its checkpoint on success. Anything it throws is caught by the worker and turns
 * the task into {@code failed}.
 */
@FunctionalInterface
public interface TaskHandler {

    void handle(TaskService tasks, String taskId, JsonNode params) throws Exception;
}
