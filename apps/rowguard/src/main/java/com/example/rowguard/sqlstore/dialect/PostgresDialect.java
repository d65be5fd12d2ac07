package com.example.rowguard.sqlstore.dialect;

import com.example.rowguard.sqlstore.ColumnType;

import java.util.Locale;

/**
 * PostgreSQL, with JSON columns stored as {@code jsonb}.
 */
public class PostgresDialect implements SqlDialect {

    public static final String NAME = "postgres";

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
            case FLOAT -> "DOUBLE PRECISION";
            case BOOLEAN -> "BOOLEAN";
            case JSON -> "JSONB";
            case DATETIME -> "TIMESTAMP WITH TIME ZONE";
        };
    }

    @Override
    public String jsonParameter(String parameterName) {
        return "CAST(:" + parameterName + " AS jsonb)";
    }

    @Override
    public String jsonIsEmptyObject(String column) {
        return "(" + column + " IS NULL OR " + column + " = 'null'::jsonb OR " + column + " = '{}'::jsonb)";
    }

    @Override
    public String jsonIsObject(String column) {
        return "jsonb_typeof(" + column + ") = 'object'";
    }

    @Override
    public String jsonKeyMissingOrEmpty(String column, String key) {
        String field = column + " -> '" + key + "'";
        return "(" + field + " IS NULL OR " + field + " = 'null'::jsonb OR " + field + " = '[]'::jsonb)";
    }

    @Override
    public String jsonArrayContainsAny(String column, String key, String collectionParameterName) {
        String field = column + " -> '" + key + "'";
        return "(CASE jsonb_typeof(" + field + ")"
                + " WHEN 'array' THEN EXISTS (SELECT 1 FROM jsonb_array_elements_text(" + field
                + ") AS elem(value) WHERE elem.value IN (:" + collectionParameterName + "))"
                + " WHEN 'string' THEN (" + field + " #>> '{}') IN (:" + collectionParameterName + ")"
                + " ELSE FALSE END)";
    }

    @Override
    public boolean isDuplicateColumnError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("already exists")) {
                return true;
            }
        }
        return false;
    }
}
