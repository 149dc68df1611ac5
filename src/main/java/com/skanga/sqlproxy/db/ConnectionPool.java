package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ConfigParams;
import com.skanga.sqlproxy.config.ResourceManager;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Bounded pool of database connections backed by
 * <a href="https://github.com/brettwooldridge/HikariCP">HikariCP</a>.
 *
 * <p>At most {@code poolMaxSize} connections are checked out at once. Callers beyond that block
 * inside HikariCP without spinning until a connection is released or the acquisition timeout
 * elapses, at which point {@link PoolExhaustedException} is thrown.
 *
 * <p>Connections are handed out as {@link PooledConnection}s, which must be used in
 * try-with-resources so they are released exactly once on every exit path. A connection marked
 * broken is evicted on release and HikariCP opens a replacement on demand.
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);
    private final ConfigParams configParams;
    private final HikariDataSource dataSource;

    /**
     * Creates the pool and verifies that a first connection can be opened.
     *
     * @param configParams Database and pool configuration
     * @throws IllegalStateException if the driver cannot be loaded or the database is unreachable
     */
    public ConnectionPool(ConfigParams configParams) {
        this.configParams = configParams;
        loadDriver(configParams.dbDriver());

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(configParams.dbUrl());
        poolConfig.setUsername(configParams.dbUser());
        poolConfig.setPassword(configParams.dbPass());
        poolConfig.setDriverClassName(configParams.dbDriver());
        poolConfig.setMinimumIdle(configParams.poolMinSize());
        poolConfig.setMaximumPoolSize(configParams.poolMaxSize());
        poolConfig.setConnectionTimeout(configParams.poolTimeoutMs());
        poolConfig.setIdleTimeout(configParams.idleTimeoutMs());
        poolConfig.setMaxLifetime(configParams.maxLifetimeMs());
        poolConfig.setLeakDetectionThreshold(configParams.leakDetectionThresholdMs());
        poolConfig.setValidationTimeout(Math.min(5000, configParams.poolTimeoutMs()));
        poolConfig.setInitializationFailTimeout(10000);
        poolConfig.setReadOnly(true);
        poolConfig.setPoolName("SqlProxyPool-" + System.currentTimeMillis());

        configureDatabaseSpecificSettings(poolConfig);

        logger.info("Initializing connection pool with settings - Min: {}, Max: {}, Acquire timeout: {}ms",
                configParams.poolMinSize(), configParams.poolMaxSize(), configParams.poolTimeoutMs());

        try {
            this.dataSource = new HikariDataSource(poolConfig);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize connection pool: {}", configParams.maskSensitive(configParams.dbUrl()), e);
            throw new IllegalStateException(ResourceManager.getErrorMessage("database.pool.init.failed.detailed",
                    configParams.maskSensitive(configParams.dbUrl())), e);
        }
        logger.info("Database connection pool initialized for: {}", configParams.maskSensitive(configParams.dbUrl()));
    }

    /**
     * Creates a pool around an existing HikariDataSource.
     * Useful for testing or when the data source is managed externally.
     *
     * @param configParams Database and pool configuration
     * @param dataSource   Pre-configured data source
     */
    public ConnectionPool(ConfigParams configParams, HikariDataSource dataSource) {
        this.configParams = configParams;
        this.dataSource = dataSource;
    }

    /**
     * Checks out a connection, waiting at most the configured acquisition timeout.
     *
     * @return A pooled connection that must be closed by the caller
     * @throws PoolExhaustedException if no connection became available in time
     * @throws SQLException if the pool is closed or the driver fails to connect
     */
    public PooledConnection acquire() throws SQLException {
        Connection dbConn;
        try {
            dbConn = dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            logger.warn("{}: {}", ResourceManager.getErrorMessage("pool.exhausted", configParams.poolTimeoutMs()), e.getMessage());
            logPoolStatistics();
            throw new PoolExhaustedException(e);
        }
        if (dbConn == null) {
            throw new SQLException("Database connection is null");
        }
        return new PooledConnection(dbConn, this);
    }

    /**
     * Returns a connection to the pool, or evicts it when it failed during use.
     * Called by {@link PooledConnection#close()}; not intended to be called directly.
     */
    void release(Connection dbConn, boolean broken) {
        if (broken) {
            logger.info("Evicting connection that failed during use");
            dataSource.evictConnection(dbConn);
            return;
        }
        try {
            dbConn.close();
        } catch (SQLException e) {
            logger.warn("Error returning connection to pool: {}", e.getMessage());
        }
    }

    public ConfigParams getConfigParams() {
        return configParams;
    }

    public int getActiveConnections() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        return poolBean != null ? poolBean.getActiveConnections() : 0;
    }

    public int getIdleConnections() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        return poolBean != null ? poolBean.getIdleConnections() : 0;
    }

    public int getTotalConnections() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        return poolBean != null ? poolBean.getTotalConnections() : 0;
    }

    public int getThreadsAwaitingConnection() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        return poolBean != null ? poolBean.getThreadsAwaitingConnection() : 0;
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /**
     * Closes the pool and all idle connections. Safe to call more than once.
     */
    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            try {
                dataSource.close();
                logger.info("Database connection pool closed");
            } catch (RuntimeException e) {
                logger.warn("Error closing database connection pool: {}", e.getMessage(), e);
            }
        }
    }

    private void logPoolStatistics() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        if (poolBean != null) {
            logger.debug("Pool stats - Active: {}, Idle: {}, Total: {}, Waiting: {}",
                    poolBean.getActiveConnections(),
                    poolBean.getIdleConnections(),
                    poolBean.getTotalConnections(),
                    poolBean.getThreadsAwaitingConnection());
        }
    }

    private static void loadDriver(String driverClass) {
        try {
            Class.forName(driverClass);
            logger.info("Database driver loaded successfully: {}", driverClass);
        } catch (ClassNotFoundException e) {
            logger.error("Failed to load database driver '{}'. {}", driverClass,
                    ResourceManager.getErrorMessage("database.driver.suggestions"), e);
            throw new IllegalStateException(ResourceManager.getErrorMessage("database.driver.not.found.detailed", driverClass)
                    + " " + ResourceManager.getErrorMessage("database.driver.suggestions"), e);
        } catch (LinkageError e) {
            logger.error("Database driver '{}' failed to initialize: {}", driverClass, e.getMessage(), e);
            throw new IllegalStateException("Database driver failed to initialize: " + driverClass, e);
        }
    }

    private void configureDatabaseSpecificSettings(HikariConfig poolConfig) {
        String dbType = configParams.getDatabaseType();

        switch (dbType) {
            case "postgresql" -> {
                poolConfig.addDataSourceProperty("ApplicationName", "sql-query-proxy");
                // Read-only sessions even in autocommit mode
                poolConfig.addDataSourceProperty("readOnlyMode", "always");
            }
            case "h2" -> {
                if (configParams.dbUrl().contains(":mem:") && !configParams.dbUrl().contains("DB_CLOSE_DELAY")) {
                    logger.info("H2 in-memory database without DB_CLOSE_DELAY; contents live only while a connection is open");
                }
            }
            default -> logger.info("Using generic pool configuration for database type: {}", dbType);
        }
    }
}
