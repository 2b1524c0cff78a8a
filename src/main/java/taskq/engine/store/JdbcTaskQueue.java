package taskq.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.model.QueueEntry;
import taskq.engine.model.TaskPriority;
import taskq.engine.repository.TaskQueue;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * JDBC implementation of TaskQueue.
 *
 * <p>
 * A pop selects a handful of eligible candidates in rank order and deletes them
 * one by one; the first delete that affects exactly one row wins the id. A
 * concurrent popper deleting the same row sees zero rows and moves on to the
 * next candidate, so no id is handed out twice.
 */
public class JdbcTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private static final int POP_CANDIDATES = 8;

    private static final String RANK_ORDER = "ORDER BY priority DESC, eligible_at, seq";

    private final Database db;
    private final Clock clock;
    private final Duration pollInterval;

    public JdbcTaskQueue(Database db, Clock clock, Duration pollInterval) {
        this.db = db;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    @Override
    public void enqueue(String taskId, TaskPriority priority, Instant eligibleAt) {
        String deleteSql = "DELETE FROM task_queue WHERE task_id = ?";
        String insertSql = """
                    INSERT INTO task_queue (task_id, priority, eligible_at, seq)
                    VALUES (?, ?, ?, NEXT VALUE FOR task_queue_seq)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement del = conn.prepareStatement(deleteSql);
                    PreparedStatement ins = conn.prepareStatement(insertSql)) {

                del.setString(1, taskId);
                del.executeUpdate();

                ins.setString(1, taskId);
                ins.setInt(2, priority.weight());
                ins.setLong(3, eligibleAt.toEpochMilli());
                ins.executeUpdate();

                conn.commit();
                log.debug("Enqueued task {} ({}, eligible at {})", taskId, priority, eligibleAt);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to enqueue task: " + taskId, e);
        }
    }

    @Override
    public Optional<String> pop() {
        String selectSql = "SELECT task_id FROM task_queue WHERE eligible_at <= ? " + RANK_ORDER + " LIMIT ?";
        String deleteSql = "DELETE FROM task_queue WHERE task_id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement deletePs = conn.prepareStatement(deleteSql)) {

                while (true) {
                    selectPs.setLong(1, clock.millis());
                    selectPs.setInt(2, POP_CANDIDATES);

                    List<String> candidates = new ArrayList<>();
                    try (ResultSet rs = selectPs.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(rs.getString(1));
                        }
                    }
                    conn.commit();

                    if (candidates.isEmpty()) {
                        return Optional.empty();
                    }

                    for (String candidate : candidates) {
                        deletePs.setString(1, candidate);
                        int deleted = deletePs.executeUpdate();
                        conn.commit();
                        if (deleted == 1) {
                            return Optional.of(candidate);
                        }
                    }
                    // every candidate was taken by someone else; look again
                }
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to pop from task queue", e);
        }
    }

    @Override
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<String> popped = pop();
            if (popped.isPresent()) {
                return popped;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollInterval.toNanos()));
        }
    }

    @Override
    public boolean remove(String taskId) {
        String sql = "DELETE FROM task_queue WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove task from queue: " + taskId, e);
        }
    }

    @Override
    public List<QueueEntry> entries() {
        String sql = "SELECT task_id, priority, eligible_at, seq FROM task_queue " + RANK_ORDER;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<QueueEntry> entries = new ArrayList<>();
            while (rs.next()) {
                entries.add(new QueueEntry(
                        rs.getString("task_id"),
                        TaskPriority.fromWeight(rs.getInt("priority")),
                        Instant.ofEpochMilli(rs.getLong("eligible_at")),
                        rs.getLong("seq")));
            }
            return entries;
        } catch (SQLException e) {
            throw new StoreException("Failed to list task queue", e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM task_queue");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count task queue", e);
        }
    }
}
