package attesta.coordinator.store;

import attesta.coordinator.config.CoordinatorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
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
        hikariConfig.setPoolName("attesta-db-pool");
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

            // ---------- GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_groups (
                            id                  VARCHAR(64) PRIMARY KEY,
                            job_ids             CLOB NOT NULL,
                            dataset_ref         VARCHAR(1024) NOT NULL,
                            algorithm_ref       VARCHAR(1024),
                            environment_name    VARCHAR(128) NOT NULL,
                            requested_metrics   CLOB,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            group_id            VARCHAR(64) NOT NULL,
                            partition_index     INT NOT NULL,
                            partition_json      CLOB NOT NULL,
                            environment_name    VARCHAR(128) NOT NULL,
                            status              VARCHAR(20) DEFAULT 'PENDING',
                            failure_reason      VARCHAR(32),
                            message             VARCHAR(2048),
                            worker_handle       VARCHAR(256),
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            start_time          TIMESTAMP,
                            end_time            TIMESTAMP,
                            attestation         CLOB,
                            result_handle       VARCHAR(1024),
                            metrics             CLOB,
                            compute_time_ms     BIGINT,
                            output              CLOB,
                            verification_conf   DOUBLE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_group ON jobs(group_id, partition_index);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_groups_created ON job_groups(created_at);");

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
