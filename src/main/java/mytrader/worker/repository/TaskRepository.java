package mytrader.worker.repository;

import mytrader.worker.model.StatKey;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.model.TaskUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Every mutating method leaves terminal tasks untouched and reports whether a row changed.
 */
public interface TaskRepository {

    /**
     * Insert a new task row.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * List tasks, newest first.
     *
     * @param status optional status filter, null for all
     * @param limit  maximum number of results, 0 or less for no limit
     * @return list of tasks
     */
    List<Task> findAll(TaskStatus status, int limit);

    /**
     * Find tasks with any of the given statuses, oldest first.
     *
     * @param statuses statuses to match
     * @param limit    maximum number of results, 0 or less for no limit
     * @return list of tasks
     */
    List<Task> findByStatusIn(Collection<TaskStatus> statuses, int limit);

    /**
     * Merge the set fields of {@code update} into a live task.
     * Sets {@code completed_at} when the update moves the task into a terminal status.
     *
     * @return true if a row was changed, false if the task is gone or already terminal
     */
    boolean update(String taskId, TaskUpdate update);

    /**
     * Apply a completing update and drop the task's checkpoint in one transaction.
     * The checkpoint is kept when the task is gone or already terminal.
     *
     * @return true if the task was completed
     */
    boolean complete(String taskId, TaskUpdate update);

    /**
     * Move a task from {@code expected} to {@code next}.
     *
     * @return true only for the caller whose statement changed the row
     */
    boolean transition(String taskId, TaskStatus expected, TaskStatus next, String message);

    /**
     * Atomically add {@code amount} to one counter of a live task.
     */
    boolean incrementStat(String taskId, StatKey key, int amount);

    /**
     * Set or clear the stop flag of a live task.
     */
    boolean setStopRequested(String taskId, boolean requested);

    /**
     * Set or clear the pause flag of a live task.
     */
    boolean setPauseRequested(String taskId, boolean requested);

    /**
     * Delete a task and its checkpoint.
     *
     * @return true if the task existed
     */
    boolean delete(String taskId);

    /**
     * Delete terminal tasks completed before the cutoff, together with their checkpoints.
     *
     * @return number of tasks deleted
     */
    int deleteTerminalBefore(Instant cutoff);
}
