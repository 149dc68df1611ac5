package com.skanga.sqlproxy.db;

import java.util.Locale;

/**
 * Kinds of relation exposed by the gateway.
 */
public enum TableType {
    BASE_TABLE("BASE TABLE"),
    VIEW("VIEW"),
    MATERIALIZED_VIEW("MATERIALIZED VIEW");

    private final String displayName;

    TableType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Maps a JDBC {@code TABLE_TYPE} value onto a relation kind.
     *
     * @param jdbcTableType Value reported by {@link java.sql.DatabaseMetaData#getTables}
     * @return The relation kind, or null for types that are not exposed (indexes, sequences, system tables)
     */
    public static TableType fromJdbcTableType(String jdbcTableType) {
        if (jdbcTableType == null) {
            return null;
        }
        return switch (jdbcTableType.toUpperCase(Locale.ROOT)) {
            case "TABLE", "BASE TABLE" -> BASE_TABLE;
            case "VIEW" -> VIEW;
            case "MATERIALIZED VIEW" -> MATERIALIZED_VIEW;
            default -> null;
        };
    }
}
