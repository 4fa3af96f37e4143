package sh.nebula.registry.store.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import sh.nebula.registry.config.PostgresSettings;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * HikariCP pool for the registry table. The registry issues a handful of short
 * queries per heartbeat interval, so the pool stays small.
 */
public class PostgresConnectionAdapter implements AutoCloseable {

    private final HikariDataSource dataSource;
    private final String databaseName;

    public PostgresConnectionAdapter(PostgresSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.databaseName = settings.databaseName();

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.username());
        config.setPassword(settings.password());
        config.setDriverClassName("org.postgresql.Driver");

        config.setMaximumPoolSize(settings.maximumPoolSize());
        config.setMinimumIdle(1);
        config.setIdleTimeout(300_000);
        config.setConnectionTimeout(settings.connectionTimeoutMillis());
        config.setMaxLifetime(1_800_000);

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "64");
        config.setConnectionTestQuery("SELECT 1");
        config.setPoolName("NebulaRegistryPool-" + databaseName);

        this.dataSource = new HikariDataSource(config);
    }

    /**
     * Borrows a pooled connection; callers close it to return it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getPoolStats() {
        if (dataSource.getHikariPoolMXBean() == null) {
            return "Pool not initialized";
        }
        return String.format("Active: %d, Idle: %d, Total: %d, Waiting: %d",
                dataSource.getHikariPoolMXBean().getActiveConnections(),
                dataSource.getHikariPoolMXBean().getIdleConnections(),
                dataSource.getHikariPoolMXBean().getTotalConnections(),
                dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection());
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }
}
