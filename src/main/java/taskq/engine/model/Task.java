package taskq.engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a unit of queued work.
 * Status transitions produce a new instance via {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String type;
    private final JsonNode payload;
    private final TaskStatus status;
    private final TaskPriority priority;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final JsonNode result;
    private final String error;
    private final String errorDetail; // stack trace of a terminal failure
    private final int retryCount;
    private final int maxRetries;
    private final Duration timeout;
    private final String correlationId; // opaque caller tag (session/user)

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.result = builder.result;
        this.error = builder.error;
        this.errorDetail = builder.errorDetail;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout is required");
        this.correlationId = builder.correlationId;
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public JsonNode payload() {
        return payload;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskPriority priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public JsonNode result() {
        return result;
    }

    public String error() {
        return error;
    }

    public String errorDetail() {
        return errorDetail;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration timeout() {
        return timeout;
    }

    public String correlationId() {
        return correlationId;
    }

    /** Another failed attempt still fits in the retry budget */
    public boolean canRetry() {
        return retryCount + 1 <= maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * A task is stale once it has existed longer than its timeout.
     * A zero timeout never goes stale.
     */
    public boolean isStale(Instant now) {
        if (timeout.isZero() || timeout.isNegative()) {
            return false;
        }
        return Duration.between(createdAt, now).compareTo(timeout) > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .payload(payload)
                .status(status)
                .priority(priority)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .result(result)
                .error(error)
                .errorDetail(errorDetail)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .timeout(timeout)
                .correlationId(correlationId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String type;
        private JsonNode payload;
        private TaskStatus status = TaskStatus.PENDING;
        private TaskPriority priority = TaskPriority.NORMAL;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private JsonNode result;
        private String error;
        private String errorDetail;
        private int retryCount = 0;
        private int maxRetries = 3;
        private Duration timeout = Duration.ofSeconds(300);
        private String correlationId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', status=" + status + ", priority=" + priority
                + ", retryCount=" + retryCount + "}";
    }
}
