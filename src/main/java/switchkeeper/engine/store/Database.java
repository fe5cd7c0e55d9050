package switchkeeper.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import switchkeeper.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
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
        hikariConfig.setPoolName("switchkeeper-db-pool");
        hikariConfig.setAutoCommit(false);

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

    public DataSource getDataSource() {
        return dataSource;
    }

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

            // ---------- REBOOT SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedules (
                            id                    VARCHAR(64) PRIMARY KEY,
                            name                  VARCHAR(255) NOT NULL,
                            description           VARCHAR(2048),
                            device_ids            CLOB NOT NULL,
                            site_name             VARCHAR(255),
                            frequency             VARCHAR(32) NOT NULL,
                            time_of_day           VARCHAR(8),
                            day_of_week           INT,
                            day_of_month          INT,
                            mode                  VARCHAR(20) DEFAULT 'ROLLING',
                            delay_between_devices INT DEFAULT 300,
                            max_wait_time         INT DEFAULT 300,
                            continue_on_failure   BOOLEAN DEFAULT FALSE,
                            enabled               BOOLEAN DEFAULT TRUE,
                            created_at            TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at            TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            last_run_at           TIMESTAMP
                        );
                    """);

            // ---------- PORT SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS port_schedules (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(255) NOT NULL,
                            description     VARCHAR(2048),
                            device_id       VARCHAR(64) NOT NULL,
                            site_name       VARCHAR(255),
                            port_idx        INT NOT NULL,
                            frequency       VARCHAR(32) NOT NULL,
                            time_of_day     VARCHAR(8),
                            day_of_week     INT,
                            day_of_month    INT,
                            poe_only        BOOLEAN DEFAULT TRUE,
                            off_duration    INT DEFAULT 15,
                            enabled         BOOLEAN DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            last_run_at     TIMESTAMP
                        );
                    """);

            // ---------- RUN RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS run_records (
                            id               VARCHAR(64) PRIMARY KEY,
                            schedule_id      VARCHAR(64),
                            kind             VARCHAR(20) NOT NULL,
                            device_id        VARCHAR(64) NOT NULL,
                            device_name      VARCHAR(255),
                            port_idx         INT,
                            status           VARCHAR(20) DEFAULT 'RUNNING',
                            started_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            completed_at     TIMESTAMP,
                            duration_seconds BIGINT,
                            error_message    VARCHAR(2048),
                            metadata         CLOB
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_started ON run_records(started_at DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_schedule ON run_records(schedule_id, started_at DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status ON run_records(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_port_schedules_site ON port_schedules(site_name, enabled);");

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
