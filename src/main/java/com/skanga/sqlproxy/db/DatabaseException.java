package com.skanga.sqlproxy.db;

import java.sql.SQLException;

/**
 * Base class for every failure the gateway reports to its callers.
 * Messages carried by subclasses are safe to return to clients as-is.
 */
public class DatabaseException extends SQLException {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }
}
