package com.example.rowguard.sqlstore;

import com.example.rowguard.sqlstore.dialect.SqlDialect;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Minimal relational store: one table at a time, rows as column-name maps.
 *
 * <p>Implementations are safe for concurrent use. Database failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface SqlStore {

    /**
     * Column a {@link FetchQuery#cursorId()} refers to.
     */
    String CURSOR_KEY_COLUMN = "id";

    /**
     * Create the table if it does not exist and register its schema with this store.
     *
     * @throws IllegalArgumentException if the schema is empty or names an invalid identifier
     */
    void createTable(String table, Map<String, ColumnDefinition> schema);

    void insert(String table, Map<String, Object> data);

    PaginatedResult fetchAll(String table, FetchQuery query);

    /**
     * First row matching the query, or {@code null}.
     */
    @Nullable
    Map<String, Object> fetchOne(String table, FetchQuery query);

    /**
     * @return number of rows updated
     * @throws IllegalArgumentException if {@code where} is null or empty
     */
    int update(String table, Map<String, Object> data, Map<String, Object> where);

    /**
     * @return number of rows deleted
     * @throws IllegalArgumentException if {@code where} is null or empty
     */
    int delete(String table, Map<String, Object> where);

    /**
     * Add a column to an existing table. Does nothing when the table does not exist or already
     * has the column.
     */
    void addColumnIfNotExists(String table, String column, ColumnType type, boolean nullable);

    SqlDialect dialect();
}
