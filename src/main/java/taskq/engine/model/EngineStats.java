package taskq.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only snapshot of engine counters and store sizes.
 */
public record EngineStats(
        @JsonProperty("processed") long processed,
        @JsonProperty("failed") long failed,
        @JsonProperty("retried") long retried,
        @JsonProperty("expired") long expired,
        @JsonProperty("cancelled") long cancelled,
        @JsonProperty("averageProcessingMs") double averageProcessingMs,
        @JsonProperty("activeWorkers") int activeWorkers,
        @JsonProperty("workersRunning") int workersRunning,
        @JsonProperty("running") boolean running,
        @JsonProperty("queueSize") int queueSize,
        @JsonProperty("processingSize") int processingSize,
        @JsonProperty("totalTasks") int totalTasks) {
}
