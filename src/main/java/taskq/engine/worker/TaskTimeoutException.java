package taskq.engine.worker;

import java.time.Duration;

/**
 * A handler did not finish within the task timeout. The handler invocation may
 * still be running; only the bookkeeping has moved on.
 */
public class TaskTimeoutException extends Exception {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }
}
