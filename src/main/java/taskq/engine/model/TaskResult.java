package taskq.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Terminal outcome kept in the result store, separate from the task record.
 * Exactly one of {@code result} and {@code error} is set.
 */
public record TaskResult(
        String taskId,
        JsonNode result,
        String error,
        String errorDetail,
        Instant completedAt) {

    public static TaskResult success(String taskId, JsonNode result, Instant completedAt) {
        return new TaskResult(taskId, result, null, null, completedAt);
    }

    public static TaskResult failure(String taskId, String error, String errorDetail, Instant completedAt) {
        return new TaskResult(taskId, null, error, errorDetail, completedAt);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
