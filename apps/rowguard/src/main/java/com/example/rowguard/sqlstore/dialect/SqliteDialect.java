package com.example.rowguard.sqlstore.dialect;

import com.example.rowguard.sqlstore.ColumnType;

import java.util.Locale;

/**
 * SQLite with the JSON1 functions (built into the xerial driver).
 */
public class SqliteDialect implements SqlDialect {

    public static final String NAME = "sqlite";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String columnType(ColumnType type) {
        return switch (type) {
            case INTEGER -> "INTEGER";
            case STRING -> "VARCHAR";
            case TEXT -> "TEXT";
            case FLOAT -> "FLOAT";
            case BOOLEAN -> "BOOLEAN";
            case JSON -> "JSON";
            case DATETIME -> "DATETIME";
        };
    }

    @Override
    public String jsonParameter(String parameterName) {
        return ":" + parameterName;
    }

    @Override
    public String jsonIsEmptyObject(String column) {
        return "(" + column + " IS NULL OR " + column + " = 'null' OR " + column + " = '{}')";
    }

    @Override
    public String jsonIsObject(String column) {
        return "json_type(" + column + ") = 'object'";
    }

    @Override
    public String jsonKeyMissingOrEmpty(String column, String key) {
        String extract = "json_extract(" + column + ", '$." + key + "')";
        return "(" + extract + " IS NULL OR " + extract + " = '[]')";
    }

    @Override
    public String jsonArrayContainsAny(String column, String key, String collectionParameterName) {
        return "EXISTS (SELECT 1 FROM json_each(" + column + ", '$." + key + "') WHERE json_each.value IN (:"
                + collectionParameterName + "))";
    }

    @Override
    public boolean isDuplicateColumnError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("duplicate column")) {
                return true;
            }
        }
        return false;
    }
}
