package taskq.engine.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import taskq.engine.model.Task;
import taskq.engine.model.TaskPriority;
import taskq.engine.model.TaskResult;
import taskq.engine.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Versioned JSON encoding of task and result records.
 *
 * <p>
 * Every record carries {@code "v": 1}. Enums are written by name, timestamps as
 * UTC ISO-8601 with millisecond precision, the timeout as milliseconds.
 * Anything that does not match the contract is rejected with
 * {@link MalformedTaskRecordException} instead of being half-read.
 */
public final class TaskRecordCodec {

    public static final int SCHEMA_VERSION = 1;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TaskRecordCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ---------- tasks ----------

    public static String encode(Task task) {
        return write(task.id(), toNode(task));
    }

    public static ObjectNode toNode(Task task) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("v", SCHEMA_VERSION);
        node.put("id", task.id());
        node.put("type", task.type());
        node.set("payload", task.payload());
        node.put("status", task.status().name());
        node.put("priority", task.priority().name());
        node.put("createdAt", formatTimestamp(task.createdAt()));
        node.put("startedAt", formatTimestamp(task.startedAt()));
        node.put("completedAt", formatTimestamp(task.completedAt()));
        node.set("result", task.result());
        node.put("error", task.error());
        node.put("errorDetail", task.errorDetail());
        node.put("retryCount", task.retryCount());
        node.put("maxRetries", task.maxRetries());
        node.put("timeoutMs", task.timeout().toMillis());
        node.put("correlationId", task.correlationId());
        return node;
    }

    public static Task decode(String taskId, String json) {
        JsonNode node = read(taskId, json);
        checkVersion(taskId, node);

        return Task.builder()
                .id(requiredText(taskId, node, "id"))
                .type(requiredText(taskId, node, "type"))
                .payload(present(taskId, node, "payload"))
                .status(parseEnum(taskId, TaskStatus.class, requiredText(taskId, node, "status")))
                .priority(parseEnum(taskId, TaskPriority.class, requiredText(taskId, node, "priority")))
                .createdAt(parseTimestamp(taskId, requiredText(taskId, node, "createdAt")))
                .startedAt(parseTimestamp(taskId, optionalText(node, "startedAt")))
                .completedAt(parseTimestamp(taskId, optionalText(node, "completedAt")))
                .result(optionalNode(node, "result"))
                .error(optionalText(node, "error"))
                .errorDetail(optionalText(node, "errorDetail"))
                .retryCount(requiredInt(taskId, node, "retryCount"))
                .maxRetries(requiredInt(taskId, node, "maxRetries"))
                .timeout(Duration.ofMillis(requiredLong(taskId, node, "timeoutMs")))
                .correlationId(optionalText(node, "correlationId"))
                .build();
    }

    // ---------- results ----------

    public static String encodeResult(TaskResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("v", SCHEMA_VERSION);
        node.put("taskId", result.taskId());
        node.set("result", result.result());
        node.put("error", result.error());
        node.put("errorDetail", result.errorDetail());
        node.put("completedAt", formatTimestamp(result.completedAt()));
        return write(result.taskId(), node);
    }

    public static TaskResult decodeResult(String taskId, String json) {
        JsonNode node = read(taskId, json);
        checkVersion(taskId, node);
        return new TaskResult(
                requiredText(taskId, node, "taskId"),
                optionalNode(node, "result"),
                optionalText(node, "error"),
                optionalText(node, "errorDetail"),
                parseTimestamp(taskId, requiredText(taskId, node, "completedAt")));
    }

    // ---------- timestamps ----------

    public static String formatTimestamp(Instant instant) {
        return instant != null ? TIMESTAMP.format(instant) : null;
    }

    private static Instant parseTimestamp(String taskId, String text) {
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedTaskRecordException(taskId, "bad timestamp '" + text + "'", e);
        }
    }

    // ---------- helpers ----------

    private static String write(String taskId, JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode record for task " + taskId, e);
        }
    }

    private static JsonNode read(String taskId, String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedTaskRecordException(taskId, "empty record");
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new MalformedTaskRecordException(taskId, "record is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedTaskRecordException(taskId, "invalid JSON", e);
        }
    }

    private static void checkVersion(String taskId, JsonNode node) {
        JsonNode v = node.get("v");
        if (v == null || !v.isInt()) {
            throw new MalformedTaskRecordException(taskId, "missing schema version");
        }
        if (v.asInt() != SCHEMA_VERSION) {
            throw new MalformedTaskRecordException(taskId, "unsupported schema version " + v.asInt());
        }
    }

    private static JsonNode required(String taskId, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedTaskRecordException(taskId, "missing field '" + field + "'");
        }
        return value;
    }

    private static JsonNode present(String taskId, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new MalformedTaskRecordException(taskId, "missing field '" + field + "'");
        }
        return value;
    }

    private static String requiredText(String taskId, JsonNode node, String field) {
        JsonNode value = required(taskId, node, field);
        if (!value.isTextual()) {
            throw new MalformedTaskRecordException(taskId, "field '" + field + "' is not a string");
        }
        return value.asText();
    }

    private static int requiredInt(String taskId, JsonNode node, String field) {
        JsonNode value = required(taskId, node, field);
        if (!value.isInt()) {
            throw new MalformedTaskRecordException(taskId, "field '" + field + "' is not an integer");
        }
        return value.asInt();
    }

    private static long requiredLong(String taskId, JsonNode node, String field) {
        JsonNode value = required(taskId, node, field);
        if (!value.isIntegralNumber()) {
            throw new MalformedTaskRecordException(taskId, "field '" + field + "' is not an integer");
        }
        return value.asLong();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode optionalNode(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private static <E extends Enum<E>> E parseEnum(String taskId, Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new MalformedTaskRecordException(taskId,
                    "unknown " + type.getSimpleName() + " '" + name + "'", e);
        }
    }
}
