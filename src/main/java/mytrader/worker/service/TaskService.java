package mytrader.worker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import mytrader.worker.model.Checkpoint;
import mytrader.worker.model.StatKey;
import mytrader.worker.model.Task;
import mytrader.worker.model.TaskStats;
import mytrader.worker.model.TaskStatus;
import mytrader.worker.model.TaskUpdate;
import mytrader.worker.repository.CheckpointRepository;
import mytrader.worker.repository.TaskRepository;
import mytrader.worker.store.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The task store used by producers, the worker loop and handlers.
 * Owns task and checkpoint persistence and the stop/pause control flags.
 * Safe to call from any thread; every operation goes straight to the database.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TaskRepository taskRepository;
    private final CheckpointRepository checkpointRepository;

    private final Object createLock = new Object();
    private final AtomicReference<Instant> lastCreatedAt = new AtomicReference<>(Instant.EPOCH);

    public TaskService(TaskRepository taskRepository, CheckpointRepository checkpointRepository) {
        this.taskRepository = taskRepository;
        this.checkpointRepository = checkpointRepository;
    }

    // ---------- Producer side ----------

    public String create(String taskType, Object params) {
        return create(taskType, params, null);
    }

    /**
     * Insert a new pending task with zeroed stats and progress.
     *
     * @param taskType handler key
     * @param params   JSON-serializable handler input; a String must already be JSON
     * @param metadata optional extras; {@code total_items} seeds the item count
     * @return the generated task ID
     */
    public String create(String taskType, Object params, Map<String, Object> metadata) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }

        int totalItems = 0;
        if (metadata != null && metadata.get("total_items") instanceof Number n) {
            totalItems = n.intValue();
        }

        Task task = Task.builder()
                .id(generateTaskId())
                .taskType(taskType)
                .status(TaskStatus.PENDING)
                .message("Task created")
                .totalItems(totalItems)
                .stats(TaskStats.ZERO)
                .params(toJson(params != null ? params : Map.of()))
                .metadata(metadata != null ? toJson(metadata) : null)
                .createdAt(nextCreationTime())
                .build();

        taskRepository.save(task);
        log.info("Created task {} (type: {})", task.shortId(), taskType);
        return task.id();
    }

    /**
     * Create a task only if no other task is pending, running or paused.
     *
     * @throws TaskExistsException carrying the blocking task
     */
    public String createExclusive(String taskType, Object params, Map<String, Object> metadata) {
        synchronized (createLock) {
            Optional<Task> active = activeTask();
            if (active.isPresent()) {
                throw new TaskExistsException(active.get());
            }
            return create(taskType, params, metadata);
        }
    }

    // ---------- Queries ----------

    public Optional<Task> get(String taskId) {
        return taskRepository.findById(taskId);
    }

    public List<Task> list() {
        return taskRepository.findAll(null, 0);
    }

    public List<Task> list(TaskStatus status) {
        return taskRepository.findAll(status, 0);
    }

    /**
     * Tasks newest first.
     *
     * @param status null for any status
     * @param limit  0 or less for no limit
     */
    public List<Task> list(TaskStatus status, int limit) {
        return taskRepository.findAll(status, limit);
    }

    /** Oldest pending tasks first, for dispatch. */
    public List<Task> findPending(int limit) {
        return taskRepository.findByStatusIn(List.of(TaskStatus.PENDING), limit);
    }

    /**
     * The most recently created pending, running or paused task, if any.
     */
    public Optional<Task> activeTask() {
        List<Task> live = taskRepository.findByStatusIn(TaskStatus.live(), 0);
        return live.isEmpty() ? Optional.empty() : Optional.of(live.get(live.size() - 1));
    }

    public boolean hasActiveTask() {
        return activeTask().isPresent();
    }

    /** Tasks left running or paused, oldest first. */
    public List<Task> unfinishedTasks() {
        return taskRepository.findByStatusIn(TaskStatus.unfinished(), 0);
    }

    // ---------- Updates ----------

    /**
     * Merge fields into a live task. Missing or finished tasks are left alone.
     *
     * @return true if the row changed
     */
    public boolean update(String taskId, TaskUpdate update) {
        return taskRepository.update(taskId, update);
    }

    /**
     * Claim a pending task for execution. Only one caller can win the claim.
     */
    public boolean claim(String taskId) {
        return taskRepository.transition(taskId, TaskStatus.PENDING, TaskStatus.RUNNING,
                "Worker is executing the task");
    }

    public boolean fail(String taskId, String error) {
        boolean updated = taskRepository.update(taskId, TaskUpdate.builder()
                .status(TaskStatus.FAILED)
                .error(error)
                .message("Task failed: " + error)
                .build());
        if (updated) {
            log.warn("Task {} failed: {}", Task.shortId(taskId), error);
        }
        return updated;
    }

    /**
     * Finish a task successfully: mark it completed at 100% and drop its checkpoint
     * in the same transaction.
     */
    public boolean complete(String taskId, int totalItems, Object result, String message) {
        boolean updated = taskRepository.complete(taskId, TaskUpdate.builder()
                .status(TaskStatus.COMPLETED)
                .progress(100)
                .currentIndex(totalItems)
                .result(result != null ? toJson(result) : null)
                .message(message)
                .build());
        if (updated) {
            log.info("Task {} completed: {}", Task.shortId(taskId), message);
        }
        return updated;
    }

    public boolean incrementStats(String taskId, StatKey key) {
        return incrementStats(taskId, key, 1);
    }

    public boolean incrementStats(String taskId, StatKey key, int amount) {
        if (amount == 0) {
            return false;
        }
        return taskRepository.incrementStat(taskId, key, amount);
    }

    public boolean incrementStats(String taskId, String key, int amount) {
        return incrementStats(taskId, StatKey.of(key), amount);
    }

    /** Overwrite all counters at once. Used when a run starts fresh or resumes from a checkpoint. */
    public boolean resetStats(String taskId, TaskStats stats) {
        return taskRepository.update(taskId, TaskUpdate.builder().stats(stats).build());
    }

    /**
     * Delete a task with its checkpoint and control flags. Idempotent.
     *
     * @return true if the task existed
     */
    public boolean delete(String taskId) {
        boolean deleted = taskRepository.delete(taskId);
        if (deleted) {
            log.info("Deleted task {}", Task.shortId(taskId));
        }
        return deleted;
    }

    /**
     * Delete finished tasks older than the cutoff along with their checkpoints.
     */
    public int purgeFinishedBefore(Instant cutoff) {
        return taskRepository.deleteTerminalBefore(cutoff);
    }

    // ---------- Checkpoints ----------

    public boolean saveCheckpoint(String taskId, int currentIndex, TaskStats stats) {
        return saveCheckpoint(taskId, currentIndex, stats, Checkpoint.DEFAULT_STAGE);
    }

    public boolean saveCheckpoint(String taskId, int currentIndex, TaskStats stats, String stage) {
        return checkpointRepository.save(new Checkpoint(taskId, currentIndex, stats, stage, null));
    }

    public Optional<Checkpoint> loadCheckpoint(String taskId) {
        return checkpointRepository.findByTaskId(taskId);
    }

    public boolean deleteCheckpoint(String taskId) {
        return checkpointRepository.delete(taskId);
    }

    // ---------- Control signals ----------

    /**
     * Ask a task to stop. A pending task is stopped on the spot since no handler
     * has started; a running or paused one is flagged for its handler.
     *
     * @return true if the task was stopped or flagged
     */
    public boolean requestStop(String taskId) {
        if (taskRepository.transition(taskId, TaskStatus.PENDING, TaskStatus.STOPPED, "Task cancelled")) {
            log.info("Pending task {} stopped before dispatch", Task.shortId(taskId));
            return true;
        }
        boolean flagged = taskRepository.setStopRequested(taskId, true);
        if (flagged) {
            log.info("Stop requested for task {}", Task.shortId(taskId));
        }
        return flagged;
    }

    /**
     * Ask a live task to pause at its next iteration boundary.
     */
    public boolean requestPause(String taskId) {
        boolean flagged = taskRepository.setPauseRequested(taskId, true);
        if (flagged) {
            log.info("Pause requested for task {}", Task.shortId(taskId));
        }
        return flagged;
    }

    /**
     * A task that no longer exists counts as stopped so its handler abandons the run.
     */
    public boolean isStopRequested(String taskId) {
        return taskRepository.findById(taskId).map(Task::stopRequested).orElse(true);
    }

    public boolean isPauseRequested(String taskId) {
        return taskRepository.findById(taskId).map(Task::pauseRequested).orElse(false);
    }

    public void clearStopRequest(String taskId) {
        taskRepository.setStopRequested(taskId, false);
    }

    public void clearPauseRequest(String taskId) {
        taskRepository.setPauseRequested(taskId, false);
    }

    /**
     * Withdraw a pause request, and put the task back to running if it is paused.
     *
     * @return true only if a paused task was resumed
     */
    public boolean resumeTask(String taskId) {
        taskRepository.setPauseRequested(taskId, false);
        boolean resumed = taskRepository.transition(taskId, TaskStatus.PAUSED, TaskStatus.RUNNING, "Task resumed");
        if (resumed) {
            log.info("Task {} resumed", Task.shortId(taskId));
        }
        return resumed;
    }

    // ---------- JSON ----------

    /**
     * Parse the stored params of a task. Absent params read as an empty object.
     *
     * @throws TaskStoreException if the stored text is not valid JSON
     */
    public JsonNode params(Task task) {
        if (task.params() == null || task.params().isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return MAPPER.readTree(task.params());
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Task " + task.id() + " has malformed params: " + e.getOriginalMessage(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialize a value for storage. A String is taken as JSON text and must parse.
     */
    static String toJson(Object value) {
        if (value instanceof String s) {
            try {
                if (s.isBlank() || MAPPER.readTree(s).isMissingNode()) {
                    throw new IllegalArgumentException("Blank string is not valid JSON");
                }
                return s;
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("String is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskStoreException("Value is not JSON-serializable: " + value.getClass().getName(), e);
        }
    }

    /**
     * Generate a new task ID.
     */
    public String generateTaskId() {
        return UUID.randomUUID().toString();
    }

    /** Strictly increasing creation times keep newest-first listings stable. */
    private Instant nextCreationTime() {
        return lastCreatedAt.updateAndGet(last -> {
            Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
            return now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS);
        });
    }
}
