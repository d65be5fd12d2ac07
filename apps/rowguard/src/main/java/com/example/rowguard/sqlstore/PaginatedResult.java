package com.example.rowguard.sqlstore;

import java.util.List;
import java.util.Map;

/**
 * A page of rows.
 *
 * @param data    rows of this page, in query order
 * @param hasMore whether the query had rows beyond the limit
 */
public record PaginatedResult(
        List<Map<String, Object>> data,
        boolean hasMore
) {

    public PaginatedResult {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
