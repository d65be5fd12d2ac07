package com.example.rowguard.sqlstore;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read criteria for {@link SqlStore#fetchAll}.
 *
 * @param where              column equality conditions; a {@code null} value matches SQL NULL
 * @param whereSql           additional SQL condition, AND-ed with {@code where}
 * @param whereSqlParameters named parameters referenced by {@code whereSql}
 * @param limit              maximum number of rows, {@code null} for no limit
 * @param orderBy            sort keys in priority order
 * @param cursorColumn       column the cursor compares on
 * @param cursorId           {@code id} of the last row of the previous page; the page starts
 *                           strictly after that row's {@code cursorColumn} value
 */
@Builder(toBuilder = true)
public record FetchQuery(
        Map<String, Object> where,
        @Nullable String whereSql,
        Map<String, Object> whereSqlParameters,
        @Nullable Integer limit,
        List<OrderBy> orderBy,
        @Nullable String cursorColumn,
        @Nullable String cursorId
) {

    public FetchQuery {
        where = where == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(where));
        whereSqlParameters = whereSqlParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(whereSqlParameters));
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (cursorId != null && cursorColumn == null) {
            throw new IllegalArgumentException("cursorId requires cursorColumn");
        }
    }

    public static FetchQuery all() {
        return builder().build();
    }

    public static FetchQuery matching(Map<String, Object> where) {
        return builder().where(where).build();
    }

    /**
     * Error for a {@code cursorId} that names no row the caller may see. Missing and hidden rows
     * report the same message.
     */
    public static IllegalArgumentException cursorNotFound(String table, String cursorId) {
        return new IllegalArgumentException("Record with id '" + cursorId + "' not found in table '" + table + "'");
    }
}
