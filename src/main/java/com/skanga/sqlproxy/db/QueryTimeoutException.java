package com.skanga.sqlproxy.db;

/**
 * A statement ran past its timeout and was cancelled. No partial rows are returned.
 */
public class QueryTimeoutException extends DatabaseUnavailableException {
    public QueryTimeoutException(Throwable cause) {
        super(cause);
    }
}
