package com.example.rowguard.sqlstore.dialect;

import com.example.rowguard.sqlstore.ColumnType;

/**
 * Database-specific SQL fragments.
 *
 * <p>JSON fragments take a column holding a JSON object and a key of that object. Keys are
 * plain identifiers and may be written into SQL text; values are always bound parameters.
 */
public interface SqlDialect {

    String name();

    String columnType(ColumnType type);

    /**
     * Placeholder for a JSON value bound as a string parameter.
     */
    String jsonParameter(String parameterName);

    /**
     * Row carries no attribute object: SQL NULL, JSON {@code null} or {@code {}}.
     */
    String jsonIsEmptyObject(String column);

    /**
     * Column holds a JSON object. Rows failing this carry no usable attributes and match no
     * user.
     */
    String jsonIsObject(String column);

    /**
     * The key is absent from the object, or holds {@code null} or an empty array.
     */
    String jsonKeyMissingOrEmpty(String column, String key);

    /**
     * The array under the key contains at least one of the values bound to the collection
     * parameter. A string stored under the key counts as a single-element array.
     */
    String jsonArrayContainsAny(String column, String key, String collectionParameterName);

    /**
     * Whether an exception message reports an already existing column.
     */
    boolean isDuplicateColumnError(Throwable error);
}
