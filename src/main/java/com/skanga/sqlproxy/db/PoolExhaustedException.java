package com.skanga.sqlproxy.db;

/**
 * No pooled connection became available within the acquisition timeout.
 */
public class PoolExhaustedException extends DatabaseUnavailableException {
    public PoolExhaustedException(Throwable cause) {
        super(cause);
    }
}
