package taskq.engine.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process mapping from task type to handler.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public void register(String type, TaskHandler handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        TaskHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.warn("Replaced handler for task type: {}", type);
        } else {
            log.info("Registered handler for task type: {}", type);
        }
    }

    public boolean unregister(String type) {
        boolean removed = handlers.remove(type) != null;
        if (removed) {
            log.info("Unregistered handler for task type: {}", type);
        }
        return removed;
    }

    public Optional<TaskHandler> find(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /** Registered types, sorted. */
    public Set<String> types() {
        return new TreeSet<>(handlers.keySet());
    }
}
