package taskq.engine.store;

/**
 * The backing store could not complete an operation (connection failure,
 * pool exhaustion, SQL error). Always carries the underlying cause.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
