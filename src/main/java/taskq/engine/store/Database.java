package taskq.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.config.EngineConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 *
 * <p>
 * Four collections back the engine: task records, the priority queue, the
 * processing set and the result store.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskq-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASK RECORDS ----------
            // record holds the versioned JSON; the other columns exist for scans
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_records (
                            id              VARCHAR(64) PRIMARY KEY,
                            type            VARCHAR(256) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            completed_at    TIMESTAMP,
                            record          CLOB NOT NULL
                        );
                    """);

            // ---------- PRIORITY QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_queue (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            priority        INT NOT NULL,
                            eligible_at     BIGINT NOT NULL,
                            seq             BIGINT NOT NULL
                        );
                    """);
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS task_queue_seq START WITH 1;");

            // ---------- PROCESSING SET ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_processing (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            added_at        TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_results (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            completed_at    TIMESTAMP NOT NULL,
                            expires_at      TIMESTAMP NOT NULL,
                            result          CLOB NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_rank ON task_queue(priority DESC, eligible_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_status ON task_records(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_completed ON task_records(status, completed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_completed ON task_results(completed_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
