package taskq.engine.handler;

/**
 * No handler is registered for a task type. Never retried.
 */
public class NoHandlerException extends RuntimeException {

    public NoHandlerException(String type) {
        super("No handler registered for task type: " + type);
    }
}
