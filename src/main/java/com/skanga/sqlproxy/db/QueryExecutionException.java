package com.skanga.sqlproxy.db;

/**
 * The database rejected or failed a statement that passed validation.
 * The message is sanitized and never contains connection details or driver internals.
 */
public class QueryExecutionException extends DatabaseException {
    private final boolean clientError;

    public QueryExecutionException(String sanitizedMessage, String sqlState, boolean clientError, Throwable cause) {
        super(sanitizedMessage, sqlState, cause);
        this.clientError = clientError;
    }

    /**
     * @return true if the failure is attributable to the query text rather than the server
     */
    public boolean isClientError() {
        return clientError;
    }
}
