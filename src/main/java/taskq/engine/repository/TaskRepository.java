package taskq.engine.repository;

import taskq.engine.model.Task;
import taskq.engine.model.TaskStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable task record store: task id to record.
 */
public interface TaskRepository {

    /**
     * Insert a new record.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a record by id.
     *
     * @param taskId the task id
     * @return the task if found
     * @throws taskq.engine.codec.MalformedTaskRecordException if the stored record cannot be decoded
     */
    Optional<Task> findById(String taskId);

    /**
     * Replace a record, but only if its stored status is still {@code expected}.
     *
     * @param task     new state of the record
     * @param expected status the caller believes is stored
     * @return true if the record was updated, false if it is missing or moved on
     */
    boolean update(Task task, TaskStatus expected);

    /**
     * Ids of records with the given status, oldest first.
     */
    List<String> findIdsByStatus(TaskStatus status);

    /**
     * Ids of records in one of {@code statuses} that completed before {@code cutoff}.
     */
    List<String> findCompletedBefore(Collection<TaskStatus> statuses, Instant cutoff);

    /**
     * Delete a record.
     *
     * @return true if a record was removed
     */
    boolean delete(String taskId);

    /**
     * Total number of stored records.
     */
    int count();
}
