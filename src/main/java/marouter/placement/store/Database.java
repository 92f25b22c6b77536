package marouter.placement.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import marouter.placement.config.PlacementConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

    public Database(PlacementConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("marouter-db-pool");
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

            // ---------- NODES (owned by the node directory) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id                  BIGINT PRIMARY KEY,
                            name                VARCHAR(256) NOT NULL,
                            category            VARCHAR(32) NOT NULL,
                            region              VARCHAR(64),
                            latitude            DOUBLE,
                            longitude           DOUBLE,
                            vram_total_gb       DOUBLE NOT NULL,
                            vram_free_gb        DOUBLE NOT NULL,
                            ram_total_gb        DOUBLE DEFAULT 0,
                            ram_free_gb         DOUBLE DEFAULT 0,
                            bandwidth_gbps      DOUBLE DEFAULT 0,
                            latency_ms          DOUBLE DEFAULT 0,
                            price_per_hour      DOUBLE DEFAULT 0,
                            reliability         DOUBLE DEFAULT 99,
                            is_active           BOOLEAN DEFAULT TRUE,
                            last_telemetry_at   TIMESTAMP
                        );
                    """);

            // ---------- MODEL PROFILES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS model_profiles (
                            name                    VARCHAR(256) PRIMARY KEY,
                            suggested_min_vram_gb   DOUBLE NOT NULL,
                            category                VARCHAR(20) DEFAULT 'OTHER'
                        );
                    """);

            // ---------- PLACEMENT REQUESTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS placement_requests (
                            id                  VARCHAR(64) PRIMARY KEY,
                            requester_id        VARCHAR(128),
                            model_name          VARCHAR(256),
                            required_vram_gb    DOUBLE NOT NULL,
                            required_ram_gb     DOUBLE,
                            preferred_region    VARCHAR(64),
                            latitude            DOUBLE,
                            longitude           DOUBLE,
                            max_distance_km     DOUBLE,
                            max_price_per_hour  DOUBLE,
                            min_reliability     DOUBLE,
                            priority            VARCHAR(10) DEFAULT 'NORMAL',
                            prefer_local        BOOLEAN DEFAULT FALSE,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- PLACEMENT DECISIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS placement_decisions (
                            request_id          VARCHAR(64) PRIMARY KEY,
                            chosen_node_id      BIGINT,
                            chosen_node_name    VARCHAR(256),
                            policy              VARCHAR(32) NOT NULL,
                            fit_score           DOUBLE NOT NULL,
                            raw_score           DOUBLE NOT NULL,
                            sub_scores          CLOB NOT NULL,
                            headroom_gb         DOUBLE,
                            justification       CLOB NOT NULL,
                            created_at          TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_active_region ON nodes(is_active, region);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_decisions_created ON placement_decisions(created_at);");

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
