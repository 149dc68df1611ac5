package com.skanga.sqlproxy.db;

import java.util.List;

/**
 * Full schema of one table: its metadata, columns in declared order and indexes.
 */
public record TableSchema(TableMetadata table, List<ColumnMetadata> columns, List<IndexMetadata> indexes) {
    public TableSchema {
        columns = List.copyOf(columns);
        indexes = List.copyOf(indexes);
    }
}
