package taskq.engine.model;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Task waiting in the queue (fresh or waiting out a retry backoff) */
    PENDING,
    /** Task owned by a worker and being executed */
    RUNNING,
    /** Handler returned a result */
    COMPLETED,
    /** Retries exhausted or no handler registered */
    FAILED,
    /** Removed from the queue by the caller before execution */
    CANCELLED,
    /** Sat in the queue longer than its timeout */
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
