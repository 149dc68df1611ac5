package com.skanga.sqlproxy.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Turns JDBC result sets into {@link QueryResult}s made only of JSON-safe values, and builds the
 * JSON envelopes returned to HTTP callers.
 *
 * <p>Cell conversion rules:
 * <ul>
 *   <li>NULL stays null; strings, booleans and integral numbers pass through.</li>
 *   <li>{@link BigDecimal} becomes its plain string form so no precision is lost in JSON.</li>
 *   <li>Non-finite floating point values (NaN, infinities) become strings.</li>
 *   <li>Dates, times and timestamps become ISO-8601 strings, with an offset when the column has one.</li>
 *   <li>Binary values become Base64 strings.</li>
 *   <li>SQL arrays become JSON arrays of converted elements.</li>
 *   <li>Anything else (UUID, json, interval, geometry, ...) becomes its string representation.</li>
 * </ul>
 */
public class ResultMarshaller {
    private static final Logger logger = LoggerFactory.getLogger(ResultMarshaller.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final DateTimeFormatter ISO_TIME = DateTimeFormatter.ISO_LOCAL_TIME;

    /**
     * Reads every remaining row of the result set.
     * Column labels are taken from the result's declared output columns, so computed
     * expressions and duplicate names are kept as the database reports them.
     *
     * @param resultSet An open result set positioned before the first row
     * @return The converted result, with execution time left at zero
     * @throws SQLException if reading from the result set fails
     */
    public QueryResult marshal(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> resultColumns = new ArrayList<>(columnCount);
        int[] columnTypes = new int[columnCount];
        String[] columnTypeNames = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            String columnLabel = metaData.getColumnLabel(i);
            resultColumns.add(columnLabel != null && !columnLabel.isEmpty() ? columnLabel : metaData.getColumnName(i));
            columnTypes[i - 1] = metaData.getColumnType(i);
            columnTypeNames[i - 1] = metaData.getColumnTypeName(i);
        }

        List<List<Object>> resultRows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> currRow = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                currRow.add(readCell(resultSet, i, columnTypes[i - 1], columnTypeNames[i - 1]));
            }
            resultRows.add(currRow);
        }

        logger.debug("Marshalled {} rows with {} columns", resultRows.size(), columnCount);
        return new QueryResult(resultColumns, resultRows, resultRows.size(), 0);
    }

    private Object readCell(ResultSet resultSet, int columnIndex, int sqlType, String typeName) throws SQLException {
        boolean hasTimeZone = typeName != null && (typeName.toLowerCase(Locale.ROOT).contains("tz")
                || typeName.toLowerCase(Locale.ROOT).contains("time zone"));

        Object cellValue = switch (sqlType) {
            case Types.TIMESTAMP_WITH_TIMEZONE -> resultSet.getObject(columnIndex, OffsetDateTime.class);
            case Types.TIMESTAMP -> hasTimeZone
                    ? resultSet.getObject(columnIndex, OffsetDateTime.class)
                    : resultSet.getObject(columnIndex, LocalDateTime.class);
            case Types.DATE -> resultSet.getObject(columnIndex, LocalDate.class);
            case Types.TIME_WITH_TIMEZONE -> resultSet.getObject(columnIndex, OffsetTime.class);
            case Types.TIME -> hasTimeZone
                    ? resultSet.getObject(columnIndex, OffsetTime.class)
                    : resultSet.getObject(columnIndex, LocalTime.class);
            default -> resultSet.getObject(columnIndex);
        };
        return toJsonSafe(cellValue);
    }

    /**
     * Converts a single driver value into a JSON-safe value.
     *
     * @param cellValue Value as returned by the driver
     * @return null, String, Boolean, an integral or finite floating point number, or a List
     * @throws SQLException if a LOB or array cannot be read
     */
    public Object toJsonSafe(Object cellValue) throws SQLException {
        if (cellValue == null) {
            return null;
        }
        if (cellValue instanceof String || cellValue instanceof Boolean) {
            return cellValue;
        }
        if (cellValue instanceof Integer || cellValue instanceof Long || cellValue instanceof Short
                || cellValue instanceof Byte || cellValue instanceof BigInteger) {
            return cellValue;
        }
        if (cellValue instanceof BigDecimal decimalValue) {
            return decimalValue.toPlainString();
        }
        if (cellValue instanceof Double doubleValue) {
            return Double.isFinite(doubleValue) ? doubleValue : doubleValue.toString();
        }
        if (cellValue instanceof Float floatValue) {
            return Float.isFinite(floatValue) ? floatValue : floatValue.toString();
        }
        if (cellValue instanceof Character) {
            return cellValue.toString();
        }
        if (cellValue instanceof LocalDateTime localDateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(localDateTime);
        }
        if (cellValue instanceof OffsetDateTime offsetDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(offsetDateTime);
        }
        if (cellValue instanceof ZonedDateTime zonedDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zonedDateTime);
        }
        if (cellValue instanceof LocalDate localDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(localDate);
        }
        if (cellValue instanceof LocalTime localTime) {
            return ISO_TIME.format(localTime);
        }
        if (cellValue instanceof OffsetTime offsetTime) {
            return DateTimeFormatter.ISO_OFFSET_TIME.format(offsetTime);
        }
        if (cellValue instanceof java.sql.Timestamp timestamp) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp.toLocalDateTime());
        }
        if (cellValue instanceof java.sql.Date sqlDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(sqlDate.toLocalDate());
        }
        if (cellValue instanceof java.sql.Time sqlTime) {
            return ISO_TIME.format(sqlTime.toLocalTime());
        }
        if (cellValue instanceof java.util.Date utilDate) {
            return DateTimeFormatter.ISO_INSTANT.format(utilDate.toInstant());
        }
        if (cellValue instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (cellValue instanceof Blob blob) {
            try {
                return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) blob.length()));
            } finally {
                blob.free();
            }
        }
        if (cellValue instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } finally {
                clob.free();
            }
        }
        if (cellValue instanceof SQLXML sqlXml) {
            try {
                return sqlXml.getString();
            } finally {
                sqlXml.free();
            }
        }
        if (cellValue instanceof Array sqlArray) {
            try {
                return toJsonSafeList(sqlArray.getArray());
            } finally {
                sqlArray.free();
            }
        }
        if (cellValue.getClass().isArray()) {
            return toJsonSafeList(cellValue);
        }
        return cellValue.toString();
    }

    // Drivers may hand back primitive arrays, so elements are read reflectively.
    private List<Object> toJsonSafeList(Object arrayValue) throws SQLException {
        if (arrayValue == null || !arrayValue.getClass().isArray()) {
            return arrayValue == null ? null : List.of(toJsonSafe(arrayValue));
        }
        int arrayLength = java.lang.reflect.Array.getLength(arrayValue);
        List<Object> listValues = new ArrayList<>(arrayLength);
        for (int i = 0; i < arrayLength; i++) {
            listValues.add(toJsonSafe(java.lang.reflect.Array.get(arrayValue, i)));
        }
        return listValues;
    }

    /**
     * Builds {@code {columns, rows, row_count, execution_time_ms}}.
     */
    public ObjectNode toJson(QueryResult queryResult) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        ArrayNode columnsNode = responseNode.putArray("columns");
        queryResult.columns().forEach(columnsNode::add);
        responseNode.set("rows", objectMapper.valueToTree(queryResult.rows()));
        responseNode.put("row_count", queryResult.rowCount());
        responseNode.put("execution_time_ms", queryResult.executionTimeMs());
        return responseNode;
    }

    /**
     * Builds {@code {tables: [...], pagination: {...}}}.
     */
    public ObjectNode toJson(TablePage tablePage) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        ArrayNode tablesNode = responseNode.putArray("tables");
        for (TableMetadata tableMetadata : tablePage.tables()) {
            tablesNode.add(toJson(tableMetadata));
        }
        PaginationInfo pagination = tablePage.pagination();
        ObjectNode paginationNode = responseNode.putObject("pagination");
        paginationNode.put("page", pagination.page());
        paginationNode.put("page_size", pagination.pageSize());
        paginationNode.put("total_count", pagination.totalCount());
        paginationNode.put("total_pages", pagination.totalPages());
        return responseNode;
    }

    /**
     * Builds {@code {table_name, table_type, table_comment, column_count, columns: [...], indexes: [...]}}.
     */
    public ObjectNode toJson(TableSchema tableSchema) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        TableMetadata tableMetadata = tableSchema.table();
        responseNode.put("table_name", tableMetadata.name());
        responseNode.put("table_type", tableMetadata.type().displayName());
        responseNode.put("table_comment", tableMetadata.comment());
        responseNode.put("column_count", tableSchema.columns().size());

        ArrayNode columnsNode = responseNode.putArray("columns");
        for (ColumnMetadata columnMetadata : tableSchema.columns()) {
            ObjectNode columnNode = columnsNode.addObject();
            columnNode.put("column_name", columnMetadata.name());
            columnNode.put("data_type", columnMetadata.dataType());
            columnNode.put("is_nullable", columnMetadata.nullable());
            columnNode.put("is_primary_key", columnMetadata.isPrimaryKey());
            columnNode.put("is_foreign_key", columnMetadata.isForeignKey());
            columnNode.put("column_comment", columnMetadata.comment());
            columnNode.put("ordinal_position", columnMetadata.ordinalPosition());
            columnNode.put("default_value", columnMetadata.defaultValue());
        }

        ArrayNode indexesNode = responseNode.putArray("indexes");
        for (IndexMetadata indexMetadata : tableSchema.indexes()) {
            ObjectNode indexNode = indexesNode.addObject();
            indexNode.put("index_name", indexMetadata.name());
            ArrayNode indexColumnsNode = indexNode.putArray("columns");
            indexMetadata.columns().forEach(indexColumnsNode::add);
            indexNode.put("is_unique", indexMetadata.isUnique());
            indexNode.put("is_primary", indexMetadata.isPrimary());
        }
        return responseNode;
    }

    private ObjectNode toJson(TableMetadata tableMetadata) {
        ObjectNode tableNode = objectMapper.createObjectNode();
        tableNode.put("table_name", tableMetadata.name());
        tableNode.put("table_type", tableMetadata.type().displayName());
        if (tableMetadata.sizeBytes() != null) {
            tableNode.put("table_size_bytes", tableMetadata.sizeBytes());
        } else {
            tableNode.putNull("table_size_bytes");
        }
        tableNode.put("column_count", tableMetadata.columnCount());
        tableNode.put("table_comment", tableMetadata.comment());
        return tableNode;
    }
}
