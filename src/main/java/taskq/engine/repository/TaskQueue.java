package taskq.engine.repository;

import taskq.engine.model.QueueEntry;
import taskq.engine.model.TaskPriority;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Priority queue of task ids awaiting execution.
 *
 * <p>
 * Ranking: priority descending, then eligibility time ascending, then
 * insertion order. An id is handed to at most one caller of {@link #pop} or
 * {@link #remove}: removal is the ownership decision.
 */
public interface TaskQueue {

    /**
     * Insert (or re-insert) a task id. Re-inserting an id that is already queued
     * replaces its rank.
     *
     * @param taskId     the task id
     * @param priority   ranking tier
     * @param eligibleAt the id is not handed out before this instant
     */
    void enqueue(String taskId, TaskPriority priority, Instant eligibleAt);

    /**
     * Atomically remove and return the best-ranked eligible id, without waiting.
     */
    Optional<String> pop();

    /**
     * Like {@link #pop()} but waits up to {@code timeout} for an eligible id.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<String> poll(Duration timeout) throws InterruptedException;

    /**
     * Remove an id if it is still queued.
     *
     * @return true if this call removed it
     */
    boolean remove(String taskId);

    /**
     * Snapshot of all queued entries in rank order.
     */
    List<QueueEntry> entries();

    int size();
}
