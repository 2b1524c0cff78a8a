package taskq.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.codec.TaskRecordCodec;
import taskq.engine.model.Task;
import taskq.engine.model.TaskStatus;
import taskq.engine.repository.TaskRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of TaskRepository.
 * The JSON record is authoritative; status and timestamp columns mirror it for scans.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO task_records (id, type, status, created_at, completed_at, record)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.type());
            ps.setString(3, task.status().name());
            setTimestamp(ps, 4, task.createdAt());
            setTimestamp(ps, 5, task.completedAt());
            ps.setString(6, TaskRecordCodec.encode(task));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT record FROM task_records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(TaskRecordCodec.decode(taskId, rs.getString("record")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public boolean update(Task task, TaskStatus expected) {
        String sql = """
                    UPDATE task_records
                    SET status = ?, completed_at = ?, record = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.status().name());
            setTimestamp(ps, 2, task.completedAt());
            ps.setString(3, TaskRecordCodec.encode(task));
            ps.setString(4, task.id());
            ps.setString(5, expected.name());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} {} -> {}", task.id(), expected, task.status());
            } else {
                log.debug("Task {} not updated: stored status is no longer {}", task.id(), expected);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update task: " + task.id(), e);
        }
    }

    @Override
    public List<String> findIdsByStatus(TaskStatus status) {
        String sql = "SELECT id FROM task_records WHERE status = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return queryIds(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find tasks by status: " + status, e);
        }
    }

    @Override
    public List<String> findCompletedBefore(Collection<TaskStatus> statuses, Instant cutoff) {
        if (statuses.isEmpty()) {
            return List.of();
        }

        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT id FROM task_records WHERE status IN (" + placeholders + ")"
                + " AND completed_at < ? ORDER BY completed_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            for (TaskStatus status : statuses) {
                ps.setString(index++, status.name());
            }
            ps.setTimestamp(index, Timestamp.from(cutoff));
            return queryIds(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find completed tasks", e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM task_records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM task_records");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    // Helper methods

    private static List<String> queryIds(PreparedStatement ps) throws SQLException {
        List<String> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        }
        return ids;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
