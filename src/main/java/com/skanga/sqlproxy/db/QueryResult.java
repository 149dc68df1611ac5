package com.skanga.sqlproxy.db;

import java.util.Collections;
import java.util.List;

/**
 * Tabular result of a query. Every cell is a JSON-safe value: null, String, Boolean,
 * a boxed number or a List of such values.
 *
 * @param columns         Output column labels in execution order, duplicates allowed
 * @param rows            Rows aligned positionally with {@code columns}
 * @param rowCount        Number of rows
 * @param executionTimeMs Wall-clock time spent executing and fetching
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, int rowCount, long executionTimeMs) {
    public QueryResult {
        columns = List.copyOf(columns);
        rows = Collections.unmodifiableList(rows);
    }

    public QueryResult withExecutionTime(long executionTimeMs) {
        return new QueryResult(columns, rows, rowCount, executionTimeMs);
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }
}
