package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ResourceManager;

/**
 * Thrown when a requested table does not exist in the configured schema.
 */
public class TableNotFoundException extends DatabaseException {
    private final String tableName;

    public TableNotFoundException(String tableName) {
        super(ResourceManager.getErrorMessage("table.not.found", tableName));
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
