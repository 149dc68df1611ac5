package com.skanga.sqlproxy.config;

import com.skanga.sqlproxy.SecurityUtils;

import java.util.List;
import java.util.Locale;

/**
 * Immutable configuration for the gateway.
 * Values are resolved by {@link CliUtils} and handed to the core as plain values;
 * nothing in the core reads environment or system state directly.
 *
 * @param dbUrl                    JDBC URL of the target database
 * @param dbUser                   Database user
 * @param dbPass                   Database password
 * @param dbDriver                 JDBC driver class name
 * @param dbSchema                 Schema whose tables are listed and described
 * @param poolMinSize              Minimum number of idle pooled connections
 * @param poolMaxSize              Maximum number of concurrently checked-out connections
 * @param poolTimeoutMs            How long a caller waits for a pooled connection
 * @param queryTimeoutSeconds      Per-statement timeout
 * @param maxSqlLength             Longest query text accepted by the validator
 * @param forbiddenKeywords        Keywords rejected in addition to the built-in blacklist
 * @param idleTimeoutMs            Idle time after which surplus connections are retired
 * @param maxLifetimeMs            Maximum lifetime of a pooled connection
 * @param leakDetectionThresholdMs Checkout time after which a leak warning is logged (0 disables)
 */
public record ConfigParams(
        String dbUrl,
        String dbUser,
        String dbPass,
        String dbDriver,
        String dbSchema,
        int poolMinSize,
        int poolMaxSize,
        int poolTimeoutMs,
        int queryTimeoutSeconds,
        int maxSqlLength,
        List<String> forbiddenKeywords,
        int idleTimeoutMs,
        int maxLifetimeMs,
        int leakDetectionThresholdMs) {

    public static final String DEFAULT_SCHEMA = "public";
    public static final int DEFAULT_POOL_MIN_SIZE = 5;
    public static final int DEFAULT_POOL_MAX_SIZE = 20;
    public static final int DEFAULT_POOL_TIMEOUT_MS = 30000;
    public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_SQL_LENGTH = 10000;
    public static final int MAX_POOL_SIZE_LIMIT = 100;
    public static final int MIN_POOL_TIMEOUT_MS = 250;

    public ConfigParams {
        if (dbUrl == null || dbUrl.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.url.required"));
        }
        if (poolMinSize < 1 || poolMinSize > MAX_POOL_SIZE_LIMIT) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.pool.min.range", poolMinSize));
        }
        if (poolMaxSize < 1 || poolMaxSize > MAX_POOL_SIZE_LIMIT) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.pool.max.range", poolMaxSize));
        }
        if (poolMinSize > poolMaxSize) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.pool.min.exceeds.max", poolMinSize, poolMaxSize));
        }
        if (poolTimeoutMs < MIN_POOL_TIMEOUT_MS) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.pool.timeout.range", poolTimeoutMs));
        }
        if (queryTimeoutSeconds < 1) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.query.timeout.range", queryTimeoutSeconds));
        }
        if (maxSqlLength < 1) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.max.sql.range", maxSqlLength));
        }
        if (dbDriver == null || dbDriver.isBlank()) {
            dbDriver = CliUtils.defaultDriverFor(dbUrl);
        }
        if (dbSchema == null || dbSchema.isBlank()) {
            dbSchema = DEFAULT_SCHEMA;
        }
        dbPass = dbPass == null ? "" : dbPass;
        forbiddenKeywords = forbiddenKeywords == null ? List.of() : List.copyOf(forbiddenKeywords);
    }

    /**
     * Creates a configuration with default pool and query settings.
     */
    public static ConfigParams defaultConfig(String dbUrl, String dbUser, String dbPass, String dbDriver) {
        return new ConfigParams(dbUrl, dbUser, dbPass, dbDriver, DEFAULT_SCHEMA,
                DEFAULT_POOL_MIN_SIZE, DEFAULT_POOL_MAX_SIZE, DEFAULT_POOL_TIMEOUT_MS,
                DEFAULT_QUERY_TIMEOUT_SECONDS, DEFAULT_MAX_SQL_LENGTH, List.of(),
                600000, 1800000, 20000);
    }

    /**
     * Creates a configuration with explicit pool sizing and timeouts, useful for tests.
     */
    public static ConfigParams customConfig(String dbUrl, String dbUser, String dbPass, String dbDriver,
                                            int poolMinSize, int poolMaxSize, int poolTimeoutMs,
                                            int queryTimeoutSeconds) {
        return new ConfigParams(dbUrl, dbUser, dbPass, dbDriver, DEFAULT_SCHEMA,
                poolMinSize, poolMaxSize, poolTimeoutMs, queryTimeoutSeconds,
                DEFAULT_MAX_SQL_LENGTH, List.of(), 600000, 1800000, 0);
    }

    /**
     * Extracts the database type from the JDBC URL, e.g. {@code jdbc:postgresql://...} gives "postgresql".
     *
     * @return Lowercase database type, or "unknown" when the URL is not a JDBC URL
     */
    public String getDatabaseType() {
        String lowerUrl = dbUrl.toLowerCase(Locale.ROOT);
        if (!lowerUrl.startsWith("jdbc:")) {
            return "unknown";
        }
        int typeEnd = lowerUrl.indexOf(':', 5);
        return typeEnd > 5 ? lowerUrl.substring(5, typeEnd) : "unknown";
    }

    /**
     * Masks credentials embedded in a URL so it can be logged or returned safely.
     *
     * @param sensitiveText Text that may contain a password
     * @return The text with user-info and password parameters replaced by "***"
     */
    public String maskSensitive(String sensitiveText) {
        return SecurityUtils.maskUrl(sensitiveText);
    }

    @Override
    public String toString() {
        return "ConfigParams[dbUrl=" + maskSensitive(dbUrl) + ", dbUser=" + dbUser + ", dbPass=***"
                + ", dbDriver=" + dbDriver + ", dbSchema=" + dbSchema
                + ", poolMinSize=" + poolMinSize + ", poolMaxSize=" + poolMaxSize
                + ", poolTimeoutMs=" + poolTimeoutMs + ", queryTimeoutSeconds=" + queryTimeoutSeconds
                + ", maxSqlLength=" + maxSqlLength + ", forbiddenKeywords=" + forbiddenKeywords + "]";
    }
}
