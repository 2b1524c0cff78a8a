package taskq.engine.store;

import taskq.engine.repository.ProcessingSet;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of ProcessingSet.
 */
public class JdbcProcessingSet implements ProcessingSet {

    private final Database db;
    private final Clock clock;

    public JdbcProcessingSet(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void add(String taskId) {
        String deleteSql = "DELETE FROM task_processing WHERE task_id = ?";
        String insertSql = "INSERT INTO task_processing (task_id, added_at) VALUES (?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement del = conn.prepareStatement(deleteSql);
                    PreparedStatement ins = conn.prepareStatement(insertSql)) {
                del.setString(1, taskId);
                del.executeUpdate();
                ins.setString(1, taskId);
                ins.setTimestamp(2, Timestamp.from(clock.instant()));
                ins.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to add task to processing set: " + taskId, e);
        }
    }

    @Override
    public void remove(String taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM task_processing WHERE task_id = ?")) {
            ps.setString(1, taskId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to remove task from processing set: " + taskId, e);
        }
    }

    @Override
    public List<String> members() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT task_id FROM task_processing ORDER BY added_at");
                ResultSet rs = ps.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to list processing set", e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM task_processing");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count processing set", e);
        }
    }
}
