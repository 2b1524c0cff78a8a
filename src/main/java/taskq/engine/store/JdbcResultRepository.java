package taskq.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.codec.TaskRecordCodec;
import taskq.engine.model.TaskResult;
import taskq.engine.repository.ResultRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ResultRepository.
 */
public class JdbcResultRepository implements ResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResultRepository.class);

    private final Database db;

    public JdbcResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void put(TaskResult result, Instant expiresAt) {
        String deleteSql = "DELETE FROM task_results WHERE task_id = ?";
        String insertSql = """
                    INSERT INTO task_results (task_id, completed_at, expires_at, result)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement del = conn.prepareStatement(deleteSql);
                    PreparedStatement ins = conn.prepareStatement(insertSql)) {
                del.setString(1, result.taskId());
                del.executeUpdate();

                ins.setString(1, result.taskId());
                ins.setTimestamp(2, Timestamp.from(result.completedAt()));
                ins.setTimestamp(3, Timestamp.from(expiresAt));
                ins.setString(4, TaskRecordCodec.encodeResult(result));
                ins.executeUpdate();

                conn.commit();
                log.debug("Stored {} result for task {} until {}",
                        result.isSuccess() ? "success" : "error", result.taskId(), expiresAt);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to store result for task: " + result.taskId(), e);
        }
    }

    @Override
    public Optional<TaskResult> find(String taskId, Instant now) {
        String sql = "SELECT result FROM task_results WHERE task_id = ? AND expires_at > ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            ps.setTimestamp(2, Timestamp.from(now));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(TaskRecordCodec.decodeResult(taskId, rs.getString("result")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find result for task: " + taskId, e);
        }
    }

    @Override
    public List<String> findCompletedBefore(Instant cutoff) {
        String sql = "SELECT task_id FROM task_results WHERE completed_at < ? ORDER BY completed_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find old results", e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM task_results WHERE task_id = ?")) {
            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete result for task: " + taskId, e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM task_results");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count results", e);
        }
    }
}
