package taskq.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Detailed view of queue contents for observability.
 *
 * @param queued             pending tasks in dequeue order
 * @param inFlight           tasks currently in the processing set
 * @param registeredHandlers handler types known to this engine
 */
public record QueueInfo(
        List<QueuedTask> queued,
        List<Task> inFlight,
        Set<String> registeredHandlers) {

    /**
     * A queued task with its position in the ranking (0 = next to dequeue once eligible).
     */
    public record QueuedTask(int rank, TaskPriority priority, Instant eligibleAt, Task task) {
    }
}
