package com.example.rowguard.sqlstore;

import com.example.rowguard.sqlstore.dialect.SqlDialect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SqlStore} over Spring JDBC.
 *
 * <p>Schemas passed to {@link #createTable} are remembered so values can be converted by column
 * type: JSON columns are written as JSON text and read back as maps, lists or scalars; BOOLEAN
 * columns read back as {@link Boolean}; DATETIME columns read back as {@link Instant}. Using a
 * table this store has not created is an {@link IllegalStateException}.
 */
@Slf4j
public class JdbcSqlStore implements SqlStore {

    private static final String VALUE_PREFIX = "v_";
    private static final String SET_PREFIX = "s_";
    private static final String WHERE_PREFIX = "w_";
    private static final String CURSOR_ID_PARAM = "cursor_id";
    private static final String CURSOR_VALUE_PARAM = "cursor_value";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final SqlDialect dialect;

    private final Map<String, Map<String, ColumnDefinition>> schemas = new ConcurrentHashMap<>();

    public JdbcSqlStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, SqlDialect dialect) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public void createTable(String table, Map<String, ColumnDefinition> schema) {
        SqlIdentifiers.requireValid(table, "table");
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("No columns defined for table '" + table + "'");
        }

        Map<String, ColumnDefinition> columns = new LinkedCaseInsensitiveMap<>(schema.size(), Locale.ROOT);
        List<String> primaryKey = new ArrayList<>();
        schema.forEach((column, definition) -> {
            SqlIdentifiers.requireValid(column, "column");
            Objects.requireNonNull(definition, () -> "Missing definition for column '" + column + "'");
            columns.put(column, definition);
            if (definition.primaryKey()) {
                primaryKey.add(column);
            }
        });

        List<String> columnSql = new ArrayList<>();
        columns.forEach((column, definition) -> {
            StringBuilder sql = new StringBuilder(column).append(' ').append(dialect.columnType(definition.type()));
            if (primaryKey.size() == 1 && definition.primaryKey()) {
                sql.append(" PRIMARY KEY");
            }
            if (!definition.nullable()) {
                sql.append(" NOT NULL");
            }
            columnSql.add(sql.toString());
        });
        if (primaryKey.size() > 1) {
            columnSql.add("PRIMARY KEY (" + String.join(", ", primaryKey) + ")");
        }

        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " (" + String.join(", ", columnSql) + ")";
        log.debug("Creating table {}: {}", table, ddl);
        jdbc.getJdbcOperations().execute(ddl);

        schemas.merge(table, Collections.synchronizedMap(columns), (existing, added) -> {
            added.forEach(existing::putIfAbsent);
            return existing;
        });
    }

    @Override
    public void insert(String table, Map<String, Object> data) {
        Map<String, ColumnDefinition> schema = schemaOf(table);
        Map<String, Object> row = new LinkedCaseInsensitiveMap<>(Locale.ROOT);
        if (data != null) {
            data.forEach((column, value) -> {
                requireColumn(table, schema, column);
                row.put(column, value);
            });
        }
        schema.forEach((column, definition) -> {
            if (definition.defaultValue() != null && !row.containsKey(column)) {
                row.put(column, definition.defaultValue());
            }
        });

        if (row.isEmpty()) {
            jdbc.getJdbcOperations().update("INSERT INTO " + table + " DEFAULT VALUES");
            return;
        }

        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        row.forEach((column, value) -> {
            ColumnDefinition definition = schema.get(column);
            String parameter = VALUE_PREFIX + column;
            columns.add(column);
            placeholders.add(placeholder(definition, parameter));
            params.addValue(parameter, toDatabase(definition, value));
        });

        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", placeholders) + ")";
        jdbc.update(sql, params);
    }

    @Override
    public PaginatedResult fetchAll(String table, FetchQuery query) {
        Map<String, ColumnDefinition> schema = schemaOf(table);
        FetchQuery effective = query != null ? query : FetchQuery.all();

        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>(equalityConditions(table, schema, effective.where(), WHERE_PREFIX, params));

        if (effective.whereSql() != null && !effective.whereSql().isBlank()) {
            conditions.add("(" + effective.whereSql() + ")");
            effective.whereSqlParameters().forEach((name, value) -> {
                if (params.hasValue(name)) {
                    throw new IllegalArgumentException("Parameter '" + name + "' is reserved");
                }
                params.addValue(name, value);
            });
        }

        if (effective.cursorId() != null) {
            conditions.add(cursorCondition(table, schema, effective, params));
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (!effective.orderBy().isEmpty()) {
            List<String> keys = new ArrayList<>();
            for (OrderBy order : effective.orderBy()) {
                requireColumn(table, schema, order.column());
                keys.add(order.column() + " " + order.direction().name());
            }
            sql.append(" ORDER BY ").append(String.join(", ", keys));
        }
        Integer limit = effective.limit();
        if (limit != null) {
            // one extra row tells whether another page exists
            sql.append(" LIMIT ").append((long) limit + 1);
        }

        List<Map<String, Object>> rows = jdbc.queryForList(sql.toString(), params);
        boolean hasMore = limit != null && rows.size() > limit;
        List<Map<String, Object>> page = hasMore ? rows.subList(0, limit) : rows;

        List<Map<String, Object>> data = new ArrayList<>(page.size());
        for (Map<String, Object> row : page) {
            data.add(fromDatabase(schema, row));
        }
        return new PaginatedResult(data, hasMore);
    }

    @Override
    @Nullable
    public Map<String, Object> fetchOne(String table, FetchQuery query) {
        FetchQuery single = (query != null ? query.toBuilder() : FetchQuery.builder()).limit(1).build();
        List<Map<String, Object>> rows = fetchAll(table, single).data();
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public int update(String table, Map<String, Object> data, Map<String, Object> where) {
        if (where == null || where.isEmpty()) {
            throw new IllegalArgumentException("where is required for update");
        }
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("data is required for update");
        }
        Map<String, ColumnDefinition> schema = schemaOf(table);

        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> assignments = new ArrayList<>();
        data.forEach((column, value) -> {
            ColumnDefinition definition = requireColumn(table, schema, column);
            String parameter = SET_PREFIX + column;
            assignments.add(column + " = " + placeholder(definition, parameter));
            params.addValue(parameter, toDatabase(definition, value));
        });
        List<String> conditions = equalityConditions(table, schema, where, WHERE_PREFIX, params);

        String sql = "UPDATE " + table + " SET " + String.join(", ", assignments)
                + " WHERE " + String.join(" AND ", conditions);
        return jdbc.update(sql, params);
    }

    @Override
    public int delete(String table, Map<String, Object> where) {
        if (where == null || where.isEmpty()) {
            throw new IllegalArgumentException("where is required for delete");
        }
        Map<String, ColumnDefinition> schema = schemaOf(table);

        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = equalityConditions(table, schema, where, WHERE_PREFIX, params);
        return jdbc.update("DELETE FROM " + table + " WHERE " + String.join(" AND ", conditions), params);
    }

    @Override
    public void addColumnIfNotExists(String table, String column, ColumnType type, boolean nullable) {
        SqlIdentifiers.requireValid(table, "table");
        SqlIdentifiers.requireValid(column, "column");
        Objects.requireNonNull(type, "type");

        ColumnState state = jdbc.getJdbcOperations().execute((ConnectionCallback<ColumnState>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            String actualTable = findTable(metaData, table);
            if (actualTable == null) {
                return ColumnState.NO_TABLE;
            }
            return hasColumn(metaData, actualTable, column) ? ColumnState.PRESENT : ColumnState.ABSENT;
        });

        if (state == ColumnState.NO_TABLE) {
            log.debug("Table {} does not exist, not adding column {}", table, column);
            return;
        }
        if (state == ColumnState.ABSENT) {
            String ddl = "ALTER TABLE " + table + " ADD COLUMN " + column + " " + dialect.columnType(type)
                    + (nullable ? "" : " NOT NULL");
            log.info("Adding column {} to table {}", column, table);
            jdbc.getJdbcOperations().execute(ddl);
        }

        ColumnDefinition definition = new ColumnDefinition(type, false, nullable, null);
        schemas.computeIfPresent(table, (name, columns) -> {
            columns.putIfAbsent(column, definition);
            return columns;
        });
    }

    private enum ColumnState {
        NO_TABLE,
        ABSENT,
        PRESENT
    }

    private Map<String, ColumnDefinition> schemaOf(String table) {
        SqlIdentifiers.requireValid(table, "table");
        Map<String, ColumnDefinition> schema = schemas.get(table);
        if (schema == null) {
            throw new IllegalStateException("Table '" + table + "' has not been created through this store");
        }
        return schema;
    }

    private static ColumnDefinition requireColumn(String table, Map<String, ColumnDefinition> schema, String column) {
        SqlIdentifiers.requireValid(column, "column");
        ColumnDefinition definition = schema.get(column);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown column '" + column + "' for table '" + table + "'");
        }
        return definition;
    }

    private List<String> equalityConditions(
            String table,
            Map<String, ColumnDefinition> schema,
            Map<String, Object> where,
            String prefix,
            MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        where.forEach((column, value) -> {
            ColumnDefinition definition = requireColumn(table, schema, column);
            if (value == null) {
                conditions.add(column + " IS NULL");
                return;
            }
            String parameter = prefix + column;
            conditions.add(column + " = " + placeholder(definition, parameter));
            params.addValue(parameter, toDatabase(definition, value));
        });
        return conditions;
    }

    private String cursorCondition(
            String table,
            Map<String, ColumnDefinition> schema,
            FetchQuery query,
            MapSqlParameterSource params) {
        String cursorColumn = query.cursorColumn();
        requireColumn(table, schema, cursorColumn);
        requireColumn(table, schema, CURSOR_KEY_COLUMN);

        List<Object> cursorValues = jdbc.queryForList(
                "SELECT " + cursorColumn + " FROM " + table + " WHERE " + CURSOR_KEY_COLUMN + " = :" + CURSOR_ID_PARAM,
                new MapSqlParameterSource(CURSOR_ID_PARAM, query.cursorId()),
                Object.class);
        if (cursorValues.isEmpty()) {
            throw FetchQuery.cursorNotFound(table, query.cursorId());
        }

        SortDirection direction = query.orderBy().stream()
                .filter(order -> order.column().equalsIgnoreCase(cursorColumn))
                .map(OrderBy::direction)
                .findFirst()
                .orElse(SortDirection.ASC);

        params.addValue(CURSOR_VALUE_PARAM, cursorValues.get(0));
        return cursorColumn + (direction == SortDirection.DESC ? " < :" : " > :") + CURSOR_VALUE_PARAM;
    }

    private String placeholder(ColumnDefinition definition, String parameter) {
        if (definition.type() == ColumnType.JSON) {
            return dialect.jsonParameter(parameter);
        }
        return ":" + parameter;
    }

    @Nullable
    private Object toDatabase(ColumnDefinition definition, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        return switch (definition.type()) {
            case JSON -> writeJson(value);
            case DATETIME -> Timestamp.from(toInstant(value));
            default -> value;
        };
    }

    private Map<String, Object> fromDatabase(Map<String, ColumnDefinition> schema, Map<String, Object> row) {
        Map<String, Object> converted = new LinkedCaseInsensitiveMap<>(row.size(), Locale.ROOT);
        row.forEach((column, value) -> {
            ColumnDefinition definition = schema.get(column);
            converted.put(column, definition == null || value == null ? value : fromDatabase(definition, value));
        });
        return converted;
    }

    private Object fromDatabase(ColumnDefinition definition, Object value) {
        return switch (definition.type()) {
            case JSON -> readJson(value.toString());
            case BOOLEAN -> toBoolean(value);
            case DATETIME -> toInstant(value);
            default -> value;
        };
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SqlStoreException("Failed to serialize JSON column value", e);
        }
    }

    @Nullable
    private Object readJson(String json) {
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new SqlStoreException("Failed to parse JSON column value", e);
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        String text = value.toString().trim();
        return text.equals("1") || text.equalsIgnoreCase("true");
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof java.util.Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = value.toString().trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new SqlStoreException("Unsupported DATETIME value '" + text + "'", nested);
            }
        }
    }

    @Nullable
    private static String findTable(DatabaseMetaData metaData, String table) throws SQLException {
        Set<String> candidates = new LinkedHashSet<>(List.of(
                table, table.toLowerCase(Locale.ROOT), table.toUpperCase(Locale.ROOT)));
        for (String candidate : candidates) {
            try (ResultSet tables = metaData.getTables(null, null, candidate, null)) {
                while (tables.next()) {
                    String name = tables.getString("TABLE_NAME");
                    if (table.equalsIgnoreCase(name)) {
                        return name;
                    }
                }
            }
        }
        return null;
    }

    private static boolean hasColumn(DatabaseMetaData metaData, String table, String column) throws SQLException {
        try (ResultSet columns = metaData.getColumns(null, null, table, "%")) {
            while (columns.next()) {
                if (column.equalsIgnoreCase(columns.getString("COLUMN_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }
}
