package com.skanga.sqlproxy.db;

import java.util.List;

/**
 * Catalog metadata for one index.
 *
 * @param name      Index name
 * @param columns   Indexed columns in key order
 * @param isUnique  Whether the index enforces uniqueness
 * @param isPrimary Whether the index backs the primary key
 */
public record IndexMetadata(String name, List<String> columns, boolean isUnique, boolean isPrimary) {
    public IndexMetadata {
        columns = List.copyOf(columns);
    }
}
