package com.skanga.sqlproxy.db;

/**
 * Catalog metadata for one table or view.
 *
 * @param name        Table name, unique within the schema
 * @param type        Relation kind
 * @param sizeBytes   Storage size in bytes, or null when the database exposes no statistics
 * @param columnCount Number of columns
 * @param comment     Table comment, may be null
 */
public record TableMetadata(String name, TableType type, Long sizeBytes, int columnCount, String comment) {
}
