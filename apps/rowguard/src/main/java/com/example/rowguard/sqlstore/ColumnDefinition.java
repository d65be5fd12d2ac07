package com.example.rowguard.sqlstore;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Column of a table created through {@link SqlStore#createTable}.
 *
 * @param type         column type
 * @param primaryKey   part of the primary key
 * @param nullable     whether NULL is accepted
 * @param defaultValue value used on insert when the column is not supplied
 */
public record ColumnDefinition(
        ColumnType type,
        boolean primaryKey,
        boolean nullable,
        @Nullable Object defaultValue
) {

    public ColumnDefinition {
        Objects.requireNonNull(type, "type");
    }

    public static ColumnDefinition of(ColumnType type) {
        return new ColumnDefinition(type, false, true, null);
    }

    public static ColumnDefinition primaryKey(ColumnType type) {
        return new ColumnDefinition(type, true, false, null);
    }

    public static ColumnDefinition required(ColumnType type) {
        return new ColumnDefinition(type, false, false, null);
    }

    public ColumnDefinition withDefault(@Nullable Object value) {
        return new ColumnDefinition(type, primaryKey, nullable, value);
    }
}
