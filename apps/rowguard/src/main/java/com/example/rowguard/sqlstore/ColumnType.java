package com.example.rowguard.sqlstore;

import java.util.Locale;

/**
 * Portable column types. Each {@link com.example.rowguard.sqlstore.dialect.SqlDialect} maps them
 * to a concrete database type.
 */
public enum ColumnType {
    INTEGER,
    STRING,
    TEXT,
    FLOAT,
    BOOLEAN,
    /**
     * Structured value (maps, lists, scalars) stored as a JSON document.
     */
    JSON,
    /**
     * Point in time, read back as {@link java.time.Instant}.
     */
    DATETIME;

    /**
     * @throws IllegalArgumentException if the name is not a known column type
     */
    public static ColumnType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Column type must not be blank");
        }
        try {
            return ColumnType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported column type '" + value + "'", e);
        }
    }
}
