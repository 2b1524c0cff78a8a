package taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied function executed for tasks of one type.
 * Throwing fails the attempt; the engine decides whether to retry.
 */
@FunctionalInterface
public interface TaskHandler {

    JsonNode handle(JsonNode payload) throws Exception;
}
