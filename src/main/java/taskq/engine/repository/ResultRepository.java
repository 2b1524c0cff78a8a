package taskq.engine.repository;

import taskq.engine.model.TaskResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Time-limited store of terminal outcomes.
 */
public interface ResultRepository {

    /**
     * Store (or replace) the outcome of a task.
     *
     * @param result    the outcome
     * @param expiresAt the entry is ignored by reads from this instant on
     */
    void put(TaskResult result, Instant expiresAt);

    /**
     * Find a live result.
     *
     * @param taskId the task id
     * @param now    entries with {@code expiresAt <= now} are treated as absent
     */
    Optional<TaskResult> find(String taskId, Instant now);

    /**
     * Ids of results that completed before {@code cutoff}.
     */
    List<String> findCompletedBefore(Instant cutoff);

    boolean delete(String taskId);

    int size();
}
