package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.SecurityUtils;
import com.skanga.sqlproxy.config.ConfigParams;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Entry point of the gateway core used by the HTTP layer.
 * Wires the {@link ConnectionPool}, {@link QueryValidator}, {@link QueryExecutor},
 * {@link SchemaIntrospector} and {@link ResultMarshaller} together.
 * This class is thread-safe; every operation checks out its own connection.
 */
public class DatabaseService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);
    private static final int LOG_SQL_LENGTH = 100;

    private final ConfigParams configParams;
    private final ConnectionPool connectionPool;
    private final QueryValidator queryValidator;
    private final QueryExecutor queryExecutor;
    private final SchemaIntrospector schemaIntrospector;
    private final ResultMarshaller resultMarshaller;
    private volatile String databaseProductName;

    /**
     * Creates the service and its connection pool.
     *
     * @param configParams Gateway configuration
     * @throws IllegalStateException if the driver cannot be loaded or the database is unreachable
     */
    public DatabaseService(ConfigParams configParams) {
        this(new ConnectionPool(configParams));
    }

    /**
     * Creates a service around an existing HikariDataSource.
     * Useful for testing or when the connection pool is managed externally.
     *
     * @param configParams Gateway configuration
     * @param dataSource   Pre-configured data source
     */
    public DatabaseService(ConfigParams configParams, HikariDataSource dataSource) {
        this(new ConnectionPool(configParams, dataSource));
    }

    DatabaseService(ConnectionPool connectionPool) {
        this.configParams = connectionPool.getConfigParams();
        this.connectionPool = connectionPool;
        this.resultMarshaller = new ResultMarshaller();
        this.queryValidator = new QueryValidator(configParams.forbiddenKeywords(), configParams.maxSqlLength());
        this.queryExecutor = new QueryExecutor(connectionPool, resultMarshaller);
        this.schemaIntrospector = new SchemaIntrospector(queryExecutor, configParams);
    }

    /**
     * Lists tables, views and materialized views of the configured schema.
     *
     * @see SchemaIntrospector#listTables(int, int)
     */
    public TablePage listTables(int page, int pageSize) throws SQLException {
        return schemaIntrospector.listTables(page, pageSize);
    }

    /**
     * Describes one table.
     *
     * @see SchemaIntrospector#getTableSchema(String)
     */
    public TableSchema getTableSchema(String tableName) throws SQLException {
        return schemaIntrospector.getTableSchema(tableName);
    }

    /**
     * Validates and executes a read query with the configured statement timeout.
     *
     * @param sqlQuery Query text from the caller
     * @return Rows and columns of the query
     * @throws QueryValidationException if the text is not an acceptable read query
     * @throws SQLException             see {@link QueryExecutor#execute(String, Duration)}
     */
    public QueryResult executeQuery(String sqlQuery) throws SQLException {
        return executeQuery(sqlQuery, queryExecutor.getDefaultTimeout());
    }

    /**
     * Validates and executes a read query with an explicit statement timeout.
     */
    public QueryResult executeQuery(String sqlQuery, Duration timeout) throws SQLException {
        ValidationVerdict validationVerdict = queryValidator.validate(sqlQuery);
        if (validationVerdict.rejected()) {
            logger.warn("Rejected query ({}): {}", validationVerdict.reason(),
                    SecurityUtils.truncateForLog(sqlQuery, LOG_SQL_LENGTH));
            validationVerdict.throwIfRejected();
        }
        return queryExecutor.execute(sqlQuery, timeout);
    }

    /**
     * Product name reported by the driver, looked up once and then cached.
     *
     * @return e.g. "PostgreSQL" or "H2"
     * @throws SQLException if the database cannot be reached on first lookup
     */
    public String getDatabaseProductName() throws SQLException {
        String productName = databaseProductName;
        if (productName == null) {
            productName = queryExecutor.withConnection(dbConn -> {
                DatabaseMetaData metaData = dbConn.getMetaData();
                return metaData.getDatabaseProductName();
            });
            databaseProductName = productName;
        }
        return productName;
    }

    public ConfigParams getDatabaseConfig() {
        return configParams;
    }

    public QueryValidator getQueryValidator() {
        return queryValidator;
    }

    public ResultMarshaller getResultMarshaller() {
        return resultMarshaller;
    }

    public int getActiveConnections() {
        return connectionPool.getActiveConnections();
    }

    public int getIdleConnections() {
        return connectionPool.getIdleConnections();
    }

    public int getTotalConnections() {
        return connectionPool.getTotalConnections();
    }

    public int getThreadsAwaitingConnection() {
        return connectionPool.getThreadsAwaitingConnection();
    }

    /**
     * Closes the connection pool. This method is idempotent and safe to call multiple times.
     */
    @Override
    public void close() {
        connectionPool.close();
    }
}
