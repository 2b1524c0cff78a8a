package taskq.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Arguments for submitting a task. Unset optional fields fall back to the
 * engine defaults.
 */
public final class SubmitRequest {
    private final String type;
    private final JsonNode payload;
    private final TaskPriority priority;
    private final Duration timeout;
    private final Integer maxRetries;
    private final String correlationId;

    private SubmitRequest(Builder builder) {
        this.type = builder.type;
        this.payload = builder.payload;
        this.priority = builder.priority;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.correlationId = builder.correlationId;
    }

    public String type() {
        return type;
    }

    public JsonNode payload() {
        return payload;
    }

    public TaskPriority priority() {
        return priority;
    }

    public Duration timeout() {
        return timeout;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    public String correlationId() {
        return correlationId;
    }

    public static Builder builder(String type, JsonNode payload) {
        return new Builder(type, payload);
    }

    public static final class Builder {
        private final String type;
        private final JsonNode payload;
        private TaskPriority priority = TaskPriority.NORMAL;
        private Duration timeout;
        private Integer maxRetries;
        private String correlationId;

        private Builder(String type, JsonNode payload) {
            this.type = type;
            this.payload = payload;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public SubmitRequest build() {
            return new SubmitRequest(this);
        }
    }
}
