package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.SecurityUtils;
import com.skanga.sqlproxy.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Runs work against pooled connections and translates driver failures into the gateway's
 * exception taxonomy.
 *
 * <p>Both user queries and catalog reads go through {@link #withConnection(ConnectionCallback)},
 * which guarantees that the connection is released on every exit path and evicted when it
 * failed in a way that may have left it unusable.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    // SQLState classes that point at the query text rather than the server
    private static final Set<String> CLIENT_ERROR_CLASSES = Set.of("42", "22", "23", "0A", "2B", "21");
    private static final String QUERY_CANCELED_STATE = "57014";
    private static final int LOG_SQL_LENGTH = 200;

    private final ConnectionPool connectionPool;
    private final ResultMarshaller resultMarshaller;
    private final Duration defaultTimeout;

    /**
     * Work performed with a checked-out connection.
     *
     * @param <T> Result type
     */
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doInConnection(Connection dbConn) throws SQLException;
    }

    public QueryExecutor(ConnectionPool connectionPool, ResultMarshaller resultMarshaller) {
        this.connectionPool = connectionPool;
        this.resultMarshaller = resultMarshaller;
        this.defaultTimeout = Duration.ofSeconds(connectionPool.getConfigParams().queryTimeoutSeconds());
    }

    /**
     * Executes a validated query with the configured statement timeout.
     *
     * @see #execute(String, Duration)
     */
    public QueryResult execute(String validatedSql) throws SQLException {
        return execute(validatedSql, defaultTimeout);
    }

    /**
     * Executes a validated query and fetches the complete result.
     * The statement is cancelled by the driver once the timeout elapses; no partial rows are returned.
     *
     * @param validatedSql Query text that already passed {@link QueryValidator}
     * @param timeout      Statement timeout, rounded up to whole seconds
     * @return Rows and column labels of the query
     * @throws QueryTimeoutException     if the statement ran past its timeout
     * @throws PoolExhaustedException    if no connection became available in time
     * @throws QueryExecutionException   if the database rejected or failed the statement
     * @throws SQLException              for other driver failures
     */
    public QueryResult execute(String validatedSql, Duration timeout) throws SQLException {
        long startTime = System.currentTimeMillis();
        int timeoutSeconds = toTimeoutSeconds(timeout);

        QueryResult queryResult = withConnection(dbConn -> {
            // Plain statement so '?' operators in user SQL are not taken for bind markers
            try (Statement stmt = dbConn.createStatement()) {
                stmt.setQueryTimeout(timeoutSeconds);
                logger.debug("Executing query with {}s timeout: {}", timeoutSeconds,
                        SecurityUtils.truncateForLog(validatedSql, LOG_SQL_LENGTH));

                boolean isResultSet = stmt.execute(validatedSql);
                if (!isResultSet) {
                    throw new QueryExecutionException(ResourceManager.getErrorMessage("query.execution.no.result"),
                            null, true, null);
                }
                try (ResultSet resultSet = stmt.getResultSet()) {
                    return resultMarshaller.marshal(resultSet);
                }
            }
        });

        long executionTime = System.currentTimeMillis() - startTime;
        logger.debug("Query completed in {}ms, returned {} rows", executionTime, queryResult.rowCount());
        return queryResult.withExecutionTime(executionTime);
    }

    /**
     * Runs the callback with a connection from the pool.
     * The connection is released when the callback returns or throws. Driver exceptions are
     * translated; exceptions that are already {@link DatabaseException}s pass through unchanged.
     *
     * @param connectionCallback Work to perform
     * @return Whatever the callback returns
     * @throws SQLException a {@link DatabaseException} subclass for every translated failure
     */
    public <T> T withConnection(ConnectionCallback<T> connectionCallback) throws SQLException {
        try (PooledConnection pooledConnection = connectionPool.acquire()) {
            try {
                return connectionCallback.doInConnection(pooledConnection.connection());
            } catch (DatabaseException e) {
                throw e;
            } catch (SQLException e) {
                DatabaseException translated = translate(e);
                if (shouldEvict(e, translated)) {
                    pooledConnection.markBroken();
                }
                throw translated;
            } catch (RuntimeException e) {
                pooledConnection.markBroken();
                throw e;
            }
        }
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Maps a driver exception onto the gateway's exception taxonomy.
     * Only sanitized text reaches the message of the returned exception.
     */
    DatabaseException translate(SQLException e) {
        String sqlState = e.getSQLState();

        if (isTimeout(e)) {
            logger.warn("Query cancelled after exceeding its timeout (SQLState {})", sqlState);
            return new QueryTimeoutException(e);
        }
        if (isConnectionError(e)) {
            logger.warn("Connection failure during query (SQLState {}): {}", sqlState,
                    SecurityUtils.sanitizeDriverMessage(e.getMessage()));
            return new DatabaseUnavailableException(e);
        }

        String sanitizedMessage = SecurityUtils.sanitizeDriverMessage(e.getMessage());
        boolean clientError = isClientError(sqlState);
        logger.warn("Query execution failed (SQLState {}, client error: {}): {}", sqlState, clientError, sanitizedMessage);
        return new QueryExecutionException(
                ResourceManager.getErrorMessage("query.execution.failed", sanitizedMessage), sqlState, clientError, e);
    }

    private static boolean shouldEvict(SQLException original, DatabaseException translated) {
        if (translated instanceof DatabaseUnavailableException) {
            return true;
        }
        if (translated instanceof QueryExecutionException executionException && executionException.isClientError()) {
            return false;
        }
        return !leavesSessionIntact(original.getSQLState());
    }

    // Resource limits and transaction-state errors do not damage the session
    private static boolean leavesSessionIntact(String sqlState) {
        return sqlState != null
                && (sqlState.startsWith("53") || sqlState.startsWith("54") || sqlState.startsWith("25"));
    }

    private static boolean isTimeout(SQLException e) {
        return e instanceof SQLTimeoutException || QUERY_CANCELED_STATE.equals(e.getSQLState());
    }

    private static boolean isConnectionError(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException || e instanceof SQLTransientConnectionException) {
            return true;
        }
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }

    static boolean isClientError(String sqlState) {
        return sqlState != null && sqlState.length() >= 2
                && CLIENT_ERROR_CLASSES.contains(sqlState.substring(0, 2).toUpperCase(Locale.ROOT));
    }

    private static int toTimeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Query timeout must be positive");
        }
        long millis = timeout.toMillis();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (millis + 999) / 1000));
    }
}
