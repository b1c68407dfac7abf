package agora.market.store;

import agora.market.config.MarketConfig;
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

    public Database(MarketConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("agora-db-pool");
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

            // ---------- ACCOUNTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS accounts (
                            owner_id            VARCHAR(128) PRIMARY KEY,
                            balance             DECIMAL(38, 8) NOT NULL,
                            total_deposited     DECIMAL(38, 8) NOT NULL,
                            total_withdrawn     DECIMAL(38, 8) NOT NULL,
                            total_earned        DECIMAL(38, 8) NOT NULL,
                            total_spent         DECIMAL(38, 8) NOT NULL,
                            locked_in_channels  DECIMAL(38, 8) NOT NULL,
                            created_at          TIMESTAMP,
                            updated_at          TIMESTAMP
                        );
                    """);

            // ---------- CHANNELS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS channels (
                            id                  VARCHAR(64) PRIMARY KEY,
                            payer_id            VARCHAR(128) NOT NULL,
                            payee_id            VARCHAR(128) NOT NULL,
                            auction_ref         VARCHAR(64),
                            state               VARCHAR(20) NOT NULL,
                            total_deposit       DECIMAL(38, 8) NOT NULL,
                            current_balance     DECIMAL(38, 8) NOT NULL,
                            escrowed_amount     DECIMAL(38, 8) NOT NULL,
                            total_settled       DECIMAL(38, 8) NOT NULL,
                            total_refunded      DECIMAL(38, 8) DEFAULT 0 NOT NULL,
                            escrow_task_id      VARCHAR(128),
                            escrow_locked_at    TIMESTAMP,
                            escrow_released     BOOLEAN DEFAULT FALSE,
                            last_release        CLOB,
                            seq                 BIGINT DEFAULT 0,
                            transactions        CLOB NOT NULL,
                            created_at          TIMESTAMP,
                            updated_at          TIMESTAMP,
                            closed_at           TIMESTAMP
                        );
                    """);

            // ---------- AUCTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS auctions (
                            id                  VARCHAR(64) PRIMARY KEY,
                            task_id             VARCHAR(128) NOT NULL,
                            requester_id        VARCHAR(128),
                            kind                VARCHAR(20) NOT NULL,
                            status              VARCHAR(32) NOT NULL,
                            reserve_price       DECIMAL(38, 8) NOT NULL,
                            max_price           DECIMAL(38, 8) NOT NULL,
                            min_reputation      DOUBLE DEFAULT 0,
                            capabilities        CLOB,
                            task_timeout_ms     BIGINT DEFAULT 0,
                            created_at          TIMESTAMP,
                            expires_at          TIMESTAMP,
                            closed_at           TIMESTAMP,
                            bids                CLOB NOT NULL,
                            winning_bid_id      VARCHAR(64),
                            final_price         DECIMAL(38, 8)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_channels_payer ON channels(payer_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_channels_payee ON channels(payee_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_channels_state ON channels(state);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_auctions_task ON auctions(task_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_auctions_status ON auctions(status);");

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
