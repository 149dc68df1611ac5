package com.skanga.sqlproxy.db;

import com.skanga.sqlproxy.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads table, column and index metadata from the database catalog.
 *
 * <p>All reads use {@link DatabaseMetaData} on a connection obtained through
 * {@link QueryExecutor#withConnection}, so catalog access shares the pool, the timeouts and
 * the error translation of user queries. Only relations in the configured schema are visible.
 */
public class SchemaIntrospector {
    private static final Logger logger = LoggerFactory.getLogger(SchemaIntrospector.class);
    private static final String POSTGRES_TABLE_SIZES =
            "SELECT c.relname, pg_total_relation_size(c.oid) FROM pg_catalog.pg_class c"
                    + " JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace"
                    + " WHERE n.nspname = ? AND c.relkind IN ('r', 'p', 'v', 'm')";
    // Drivers report this for unbounded text and varchar columns
    private static final int UNBOUNDED_SIZE = Integer.MAX_VALUE;
    private static final int MAX_NUMERIC_PRECISION = 1000;

    private final QueryExecutor queryExecutor;
    private final String configuredSchema;

    public SchemaIntrospector(QueryExecutor queryExecutor, ConfigParams configParams) {
        this.queryExecutor = queryExecutor;
        this.configuredSchema = configParams.dbSchema();
    }

    /**
     * Lists base tables, views and materialized views ordered by name.
     * The total count and the page slice come from one catalog read, so the two always agree.
     *
     * @param page     1-based page number
     * @param pageSize Tables per page, 1 to {@value PaginationInfo#MAX_PAGE_SIZE}
     * @return The requested page and its pagination info
     * @throws IllegalArgumentException if the page coordinates are out of range
     * @throws SQLException if the catalog cannot be read
     */
    public TablePage listTables(int page, int pageSize) throws SQLException {
        // Reject bad coordinates before touching the pool
        new PaginationInfo(page, pageSize, 0);

        return queryExecutor.withConnection(dbConn -> {
            DatabaseMetaData metaData = dbConn.getMetaData();
            String schemaName = resolveSchema(metaData);

            List<TableEntry> allTables = readTables(metaData, schemaName, "%");
            allTables.sort(Comparator.comparing(TableEntry::name));

            PaginationInfo pagination = new PaginationInfo(page, pageSize, allTables.size());
            int fromIndex = (int) Math.min(pagination.offset(), allTables.size());
            int toIndex = Math.min(fromIndex + pageSize, allTables.size());
            List<TableEntry> pageSlice = allTables.subList(fromIndex, toIndex);

            Map<String, Integer> columnCounts = pageSlice.isEmpty() ? Map.of() : countColumns(metaData, schemaName);
            Map<String, Long> tableSizes = pageSlice.isEmpty() ? Map.of() : readTableSizes(dbConn, metaData, schemaName);

            List<TableMetadata> tableList = new ArrayList<>(pageSlice.size());
            for (TableEntry tableEntry : pageSlice) {
                tableList.add(new TableMetadata(tableEntry.name(), tableEntry.type(),
                        tableSizes.get(tableEntry.name()),
                        columnCounts.getOrDefault(tableEntry.name(), 0),
                        tableEntry.comment()));
            }

            logger.debug("Listed {} of {} tables in schema '{}' (page {})",
                    tableList.size(), allTables.size(), schemaName, page);
            return new TablePage(tableList, pagination);
        });
    }

    /**
     * Describes one table: its columns in declared order, key flags and indexes.
     * The name must match the catalog exactly, including case.
     *
     * @param tableName Table to describe
     * @return The table's schema
     * @throws TableNotFoundException if no such table or view exists in the schema
     * @throws SQLException if the catalog cannot be read
     */
    public TableSchema getTableSchema(String tableName) throws SQLException {
        if (tableName == null || tableName.isBlank()) {
            throw new TableNotFoundException(tableName);
        }

        return queryExecutor.withConnection(dbConn -> {
            DatabaseMetaData metaData = dbConn.getMetaData();
            String schemaName = resolveSchema(metaData);

            List<TableEntry> matchingTables = readTables(metaData, schemaName,
                    escapePattern(tableName, metaData.getSearchStringEscape()));
            TableEntry tableEntry = matchingTables.stream()
                    .filter(t -> t.name().equals(tableName))
                    .findFirst()
                    .orElse(null);
            if (tableEntry == null) {
                logger.debug("Table '{}' not found in schema '{}'", tableName, schemaName);
                throw new TableNotFoundException(tableName);
            }

            PrimaryKey primaryKey = readPrimaryKey(metaData, schemaName, tableName);
            Set<String> foreignKeyColumns = readForeignKeyColumns(metaData, schemaName, tableName);
            List<ColumnMetadata> columnList = readColumns(metaData, schemaName, tableName,
                    primaryKey.columns(), foreignKeyColumns);
            List<IndexMetadata> indexList = tableEntry.type() == TableType.VIEW
                    ? List.of()
                    : readIndexes(metaData, schemaName, tableName, primaryKey);
            Long sizeBytes = readTableSizes(dbConn, metaData, schemaName).get(tableName);

            TableMetadata tableMetadata = new TableMetadata(tableName, tableEntry.type(), sizeBytes,
                    columnList.size(), tableEntry.comment());
            return new TableSchema(tableMetadata, columnList, indexList);
        });
    }

    private record TableEntry(String name, TableType type, String comment) {
    }

    private record PrimaryKey(String name, List<String> columns) {
    }

    /**
     * Finds the catalog spelling of the configured schema; identifiers are folded differently
     * by different databases.
     */
    private String resolveSchema(DatabaseMetaData metaData) throws SQLException {
        try (ResultSet resultSet = metaData.getSchemas()) {
            while (resultSet.next()) {
                String schemaName = resultSet.getString("TABLE_SCHEM");
                if (schemaName != null && schemaName.equalsIgnoreCase(configuredSchema)) {
                    return schemaName;
                }
            }
        }
        return configuredSchema;
    }

    private List<TableEntry> readTables(DatabaseMetaData metaData, String schemaName, String tableNamePattern)
            throws SQLException {
        List<TableEntry> tableEntries = new ArrayList<>();
        String schemaPattern = escapePattern(schemaName, metaData.getSearchStringEscape());
        // Types are filtered here because drivers disagree on the names ("TABLE" vs "BASE TABLE")
        try (ResultSet resultSet = metaData.getTables(null, schemaPattern, tableNamePattern, null)) {
            while (resultSet.next()) {
                TableType tableType = TableType.fromJdbcTableType(resultSet.getString("TABLE_TYPE"));
                if (tableType == null || !schemaName.equals(resultSet.getString("TABLE_SCHEM"))) {
                    continue;
                }
                tableEntries.add(new TableEntry(resultSet.getString("TABLE_NAME"), tableType,
                        blankToNull(resultSet.getString("REMARKS"))));
            }
        }
        return tableEntries;
    }

    private Map<String, Integer> countColumns(DatabaseMetaData metaData, String schemaName) throws SQLException {
        Map<String, Integer> columnCounts = new HashMap<>();
        String schemaPattern = escapePattern(schemaName, metaData.getSearchStringEscape());
        try (ResultSet resultSet = metaData.getColumns(null, schemaPattern, "%", null)) {
            while (resultSet.next()) {
                if (schemaName.equals(resultSet.getString("TABLE_SCHEM"))) {
                    columnCounts.merge(resultSet.getString("TABLE_NAME"), 1, Integer::sum);
                }
            }
        }
        return columnCounts;
    }

    /**
     * Storage sizes are only exposed by PostgreSQL; other databases get an empty map.
     */
    private Map<String, Long> readTableSizes(Connection dbConn, DatabaseMetaData metaData, String schemaName)
            throws SQLException {
        if (!"PostgreSQL".equalsIgnoreCase(metaData.getDatabaseProductName())) {
            return Map.of();
        }
        Map<String, Long> tableSizes = new HashMap<>();
        try (PreparedStatement prepStmt = dbConn.prepareStatement(POSTGRES_TABLE_SIZES)) {
            prepStmt.setString(1, schemaName);
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                while (resultSet.next()) {
                    tableSizes.put(resultSet.getString(1), resultSet.getLong(2));
                }
            }
        }
        return tableSizes;
    }

    private PrimaryKey readPrimaryKey(DatabaseMetaData metaData, String schemaName, String tableName)
            throws SQLException {
        Map<Short, String> keyColumns = new TreeMap<>();
        String pkName = null;
        try (ResultSet resultSet = metaData.getPrimaryKeys(null, schemaName, tableName)) {
            while (resultSet.next()) {
                keyColumns.put(resultSet.getShort("KEY_SEQ"), resultSet.getString("COLUMN_NAME"));
                pkName = resultSet.getString("PK_NAME");
            }
        }
        return new PrimaryKey(pkName, List.copyOf(keyColumns.values()));
    }

    private Set<String> readForeignKeyColumns(DatabaseMetaData metaData, String schemaName, String tableName)
            throws SQLException {
        Set<String> fkColumns = new HashSet<>();
        try (ResultSet resultSet = metaData.getImportedKeys(null, schemaName, tableName)) {
            while (resultSet.next()) {
                fkColumns.add(resultSet.getString("FKCOLUMN_NAME"));
            }
        }
        return fkColumns;
    }

    private List<ColumnMetadata> readColumns(DatabaseMetaData metaData, String schemaName, String tableName,
                                             List<String> pkColumns, Set<String> fkColumns) throws SQLException {
        List<ColumnMetadata> columnList = new ArrayList<>();
        String escapeString = metaData.getSearchStringEscape();
        try (ResultSet resultSet = metaData.getColumns(null, escapePattern(schemaName, escapeString),
                escapePattern(tableName, escapeString), null)) {
            while (resultSet.next()) {
                if (!tableName.equals(resultSet.getString("TABLE_NAME"))
                        || !schemaName.equals(resultSet.getString("TABLE_SCHEM"))) {
                    continue;
                }
                String columnName = resultSet.getString("COLUMN_NAME");
                String dataType = formatDataType(resultSet.getString("TYPE_NAME"), resultSet.getInt("DATA_TYPE"),
                        resultSet.getInt("COLUMN_SIZE"), resultSet.getInt("DECIMAL_DIGITS"));
                boolean nullable = !"NO".equalsIgnoreCase(resultSet.getString("IS_NULLABLE"));

                columnList.add(new ColumnMetadata(columnName, dataType, nullable,
                        pkColumns.contains(columnName), fkColumns.contains(columnName),
                        blankToNull(resultSet.getString("REMARKS")),
                        resultSet.getInt("ORDINAL_POSITION"),
                        blankToNull(resultSet.getString("COLUMN_DEF"))));
            }
        }
        columnList.sort(Comparator.comparingInt(ColumnMetadata::ordinalPosition));
        return columnList;
    }

    private List<IndexMetadata> readIndexes(DatabaseMetaData metaData, String schemaName, String tableName,
                                            PrimaryKey primaryKey) throws SQLException {
        Map<String, TreeMap<Short, String>> indexColumns = new LinkedHashMap<>();
        Map<String, Boolean> uniqueIndexes = new HashMap<>();

        try (ResultSet resultSet = metaData.getIndexInfo(null, schemaName, tableName, false, false)) {
            while (resultSet.next()) {
                String indexName = resultSet.getString("INDEX_NAME");
                String columnName = resultSet.getString("COLUMN_NAME");
                if (indexName == null || columnName == null
                        || resultSet.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                    continue;
                }
                indexColumns.computeIfAbsent(indexName, k -> new TreeMap<>())
                        .put(resultSet.getShort("ORDINAL_POSITION"), columnName);
                uniqueIndexes.put(indexName, !resultSet.getBoolean("NON_UNIQUE"));
            }
        }

        String primaryIndexName = findPrimaryIndex(indexColumns, uniqueIndexes, primaryKey);
        List<IndexMetadata> indexList = new ArrayList<>();
        for (Map.Entry<String, TreeMap<Short, String>> indexEntry : indexColumns.entrySet()) {
            String indexName = indexEntry.getKey();
            indexList.add(new IndexMetadata(indexName, List.copyOf(indexEntry.getValue().values()),
                    uniqueIndexes.getOrDefault(indexName, false), indexName.equals(primaryIndexName)));
        }
        indexList.sort(Comparator.comparing(IndexMetadata::name));
        return indexList;
    }

    /**
     * PostgreSQL names the backing index after the constraint. Databases that do not are matched
     * on the first unique index covering exactly the key columns.
     */
    private static String findPrimaryIndex(Map<String, TreeMap<Short, String>> indexColumns,
                                           Map<String, Boolean> uniqueIndexes, PrimaryKey primaryKey) {
        if (primaryKey.columns().isEmpty()) {
            return null;
        }
        if (primaryKey.name() != null && indexColumns.containsKey(primaryKey.name())) {
            return primaryKey.name();
        }
        return indexColumns.entrySet().stream()
                .filter(e -> uniqueIndexes.getOrDefault(e.getKey(), false))
                .filter(e -> List.copyOf(e.getValue().values()).equals(primaryKey.columns()))
                .map(Map.Entry::getKey)
                .sorted(Comparator.comparing((String name) -> !name.toLowerCase(Locale.ROOT).contains("primary"))
                        .thenComparing(Comparator.naturalOrder()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Formats data type with size and precision information.
     */
    static String formatDataType(String typeName, int jdbcType, int size, int decimalDigits) {
        if (typeName == null) return "UNKNOWN";
        if (size <= 0 || size >= UNBOUNDED_SIZE) return typeName;

        switch (jdbcType) {
            case Types.NUMERIC, Types.DECIMAL -> {
                if (size >= MAX_NUMERIC_PRECISION) {
                    return typeName;
                }
                return decimalDigits > 0
                        ? String.format("%s(%d,%d)", typeName, size, decimalDigits)
                        : String.format("%s(%d)", typeName, size);
            }
            case Types.CHAR, Types.VARCHAR, Types.NCHAR, Types.NVARCHAR,
                    Types.BINARY, Types.VARBINARY -> {
                // pgjdbc reports text as VARCHAR with an unbounded size, handled above
                return String.format("%s(%d)", typeName, size);
            }
            default -> {
                return typeName;
            }
        }
    }

    /**
     * Escapes LIKE wildcards so a name is matched literally by catalog pattern arguments.
     */
    static String escapePattern(String identifier, String escapeString) {
        if (identifier == null || escapeString == null || escapeString.isEmpty()) {
            return identifier;
        }
        return identifier.replace(escapeString, escapeString + escapeString)
                .replace("_", escapeString + "_")
                .replace("%", escapeString + "%");
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}
