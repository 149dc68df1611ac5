package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ResourceManager;

/**
 * The database could not serve the request in time. Callers may retry.
 * The message is deliberately generic; the cause holds the detail for logging.
 */
public class DatabaseUnavailableException extends DatabaseException {
    public DatabaseUnavailableException(Throwable cause) {
        super(ResourceManager.getErrorMessage("database.unavailable"), cause);
    }
}
