package mytrader.worker.service;

import mytrader.worker.model.Task;

/**
 * Raised by exclusive creation while another task is still pending, running or paused.
 */
public class TaskExistsException extends RuntimeException {

    private final Task existingTask;

    public TaskExistsException(Task existingTask) {
        super("Cannot create task: task " + existingTask.shortId() + " is still " + existingTask.status().code());
        this.existingTask = existingTask;
    }

    public Task existingTask() {
        return existingTask;
    }
}
