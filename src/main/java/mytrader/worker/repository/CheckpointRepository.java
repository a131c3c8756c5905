package mytrader.worker.repository;

import mytrader.worker.model.Checkpoint;

import java.util.Optional;

/**
 * Repository interface for task checkpoints, at most one per task.
 */
public interface CheckpointRepository {

    /**
     * Insert or overwrite the checkpoint of a task (last write wins).
     *
     * @return false if the owning task does not exist, nothing is written then
     */
    boolean save(Checkpoint checkpoint);

    Optional<Checkpoint> findByTaskId(String taskId);

    /**
     * @return true if a checkpoint was removed
     */
    boolean delete(String taskId);
}
