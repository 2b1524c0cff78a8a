package taskq.engine.codec;

/**
 * A stored record could not be decoded: unknown schema version, missing field,
 * unknown enum constant or unparsable timestamp.
 */
public class MalformedTaskRecordException extends RuntimeException {

    private final String taskId;

    public MalformedTaskRecordException(String taskId, String message) {
        super("Malformed record for task " + taskId + ": " + message);
        this.taskId = taskId;
    }

    public MalformedTaskRecordException(String taskId, String message, Throwable cause) {
        super("Malformed record for task " + taskId + ": " + message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
