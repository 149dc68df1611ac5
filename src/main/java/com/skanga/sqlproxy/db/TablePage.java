package com.skanga.sqlproxy.db;

import java.util.List;

/**
 * One page of a table listing together with its pagination envelope.
 */
public record TablePage(List<TableMetadata> tables, PaginationInfo pagination) {
    public TablePage {
        tables = List.copyOf(tables);
    }
}
