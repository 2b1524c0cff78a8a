package taskq.engine.repository;

import java.util.List;

/**
 * Ids currently held by a worker. Observability only; ownership is decided by
 * the queue pop.
 */
public interface ProcessingSet {

    void add(String taskId);

    void remove(String taskId);

    List<String> members();

    int size();
}
