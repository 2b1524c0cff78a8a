package taskq.engine.model;

import java.time.Instant;

/**
 * A task id waiting in the priority queue.
 *
 * @param taskId     queued task
 * @param priority   ranking tier (higher first)
 * @param eligibleAt earliest dequeue time (later than submission for retries)
 * @param seq        insertion sequence, FIFO tie-breaker within a tier
 */
public record QueueEntry(String taskId, TaskPriority priority, Instant eligibleAt, long seq) {
}
