package gpuhub.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import gpuhub.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled, so every writer commits explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("gpuhub-db-pool");
        hikariConfig.setAutoCommit(false);

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

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            user_id             VARCHAR(64) NOT NULL,
                            title               VARCHAR(200) NOT NULL,
                            description         VARCHAR(4000),
                            job_type            VARCHAR(64) NOT NULL,
                            priority            INT DEFAULT 1,
                            config              CLOB,
                            status              VARCHAR(20) DEFAULT 'PENDING',
                            progress            DOUBLE PRECISION DEFAULT 0,
                            assigned_worker_id  VARCHAR(64),
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at          TIMESTAMP,
                            completed_at        TIMESTAMP,
                            result              CLOB,
                            error_message       VARCHAR(4000)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(128),
                            host            VARCHAR(255) NOT NULL,
                            port            INT DEFAULT 22,
                            gpu_count       INT DEFAULT 1,
                            gpu_model       VARCHAR(128),
                            status          VARCHAR(20) DEFAULT 'OFFLINE',
                            active          BOOLEAN DEFAULT TRUE,
                            last_probed_at  TIMESTAMP,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_priority ON jobs(status, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_user_status ON jobs(user_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_worker_status ON jobs(assigned_worker_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_active ON workers(active, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
