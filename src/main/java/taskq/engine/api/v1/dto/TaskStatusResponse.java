package taskq.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import taskq.engine.model.Task;

import java.time.Instant;

/**
 * Response DTO for a single task.
 * GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("errorDetail") String errorDetail,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("timeoutMs") long timeoutMs,
        @JsonProperty("correlationId") String correlationId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static TaskStatusResponse from(Task task) {
        return new TaskStatusResponse(
                task.id(),
                task.type(),
                task.status().name(),
                task.priority().name(),
                task.payload(),
                task.result(),
                task.error(),
                task.errorDetail(),
                task.retryCount(),
                task.maxRetries(),
                task.timeout().toMillis(),
                task.correlationId(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt());
    }
}
