package taskq.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskq.engine.model.QueueInfo;
import taskq.engine.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for queue contents.
 * GET /api/v1/queue
 */
public record QueueInfoResponse(
        @JsonProperty("queued") List<QueuedTaskDto> queued,
        @JsonProperty("inFlight") List<InFlightTaskDto> inFlight,
        @JsonProperty("registeredHandlers") Set<String> registeredHandlers) {

    public static QueueInfoResponse from(QueueInfo info) {
        List<QueuedTaskDto> queued = info.queued().stream()
                .map(q -> new QueuedTaskDto(q.rank(), q.task().id(), q.task().type(), q.priority().name(),
                        q.eligibleAt(), q.task().retryCount()))
                .toList();
        List<InFlightTaskDto> inFlight = info.inFlight().stream()
                .map(InFlightTaskDto::from)
                .toList();
        return new QueueInfoResponse(queued, inFlight, info.registeredHandlers());
    }

    public record QueuedTaskDto(
            @JsonProperty("rank") int rank,
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("priority") String priority,
            @JsonProperty("eligibleAt") Instant eligibleAt,
            @JsonProperty("retryCount") int retryCount) {
    }

    public record InFlightTaskDto(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("status") String status,
            @JsonProperty("startedAt") Instant startedAt,
            @JsonProperty("retryCount") int retryCount) {

        static InFlightTaskDto from(Task task) {
            return new InFlightTaskDto(task.id(), task.type(), task.status().name(), task.startedAt(),
                    task.retryCount());
        }
    }
}
