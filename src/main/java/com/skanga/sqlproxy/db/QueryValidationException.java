package com.skanga.sqlproxy.db;

/**
 * Thrown when query text is rejected before reaching the database.
 */
public class QueryValidationException extends DatabaseException {
    public QueryValidationException(String reason) {
        super(reason);
    }
}
