package taskq.engine.model;

/**
 * What a worker did with a popped task.
 */
public enum ProcessOutcome {
    /** Handler returned a result */
    COMPLETED,

    /** Handler failed, task re-queued with backoff */
    RETRIED,

    /** Handler failed permanently or no handler registered */
    FAILED,

    /** Interrupted by shutdown, put back on the queue without spending a retry */
    REQUEUED,

    /** Task was stale when popped */
    EXPIRED,

    /** Record missing, malformed or not PENDING - nothing executed */
    SKIPPED
}
