package com.example.rowguard.sqlstore;

import java.util.Objects;

public record OrderBy(String column, SortDirection direction) {

    public OrderBy {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(direction, "direction");
    }

    public static OrderBy asc(String column) {
        return new OrderBy(column, SortDirection.ASC);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, SortDirection.DESC);
    }

    /**
     * @param direction {@code asc} or {@code desc}
     */
    public static OrderBy of(String column, String direction) {
        return new OrderBy(column, SortDirection.from(direction));
    }
}
