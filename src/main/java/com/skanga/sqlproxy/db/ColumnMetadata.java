package com.skanga.sqlproxy.db;

/**
 * Catalog metadata for one column.
 *
 * @param name            Column name
 * @param dataType        Database-native type name including length or precision modifiers
 * @param nullable        Whether the column accepts NULL
 * @param isPrimaryKey    Whether the column takes part in the primary key
 * @param isForeignKey    Whether the column takes part in any foreign key
 * @param comment         Column comment, may be null
 * @param ordinalPosition 1-based declared position
 * @param defaultValue    Default expression, may be null
 */
public record ColumnMetadata(String name, String dataType, boolean nullable, boolean isPrimaryKey,
                             boolean isForeignKey, String comment, int ordinalPosition, String defaultValue) {
}
