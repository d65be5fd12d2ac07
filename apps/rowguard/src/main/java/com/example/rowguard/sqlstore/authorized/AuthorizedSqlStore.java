package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.engine.AccessPolicyEngine;
import com.example.rowguard.authz.exception.AccessDeniedException;
import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Action;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.common.util.StringSanitizer;
import com.example.rowguard.observability.metrics.AccessMetrics;
import com.example.rowguard.sqlstore.ColumnDefinition;
import com.example.rowguard.sqlstore.ColumnType;
import com.example.rowguard.sqlstore.FetchQuery;
import com.example.rowguard.sqlstore.PaginatedResult;
import com.example.rowguard.sqlstore.SqlStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row-level access control on top of a {@link SqlStore}.
 *
 * <p>Every row carries the attributes of the user who inserted it in the
 * {@value #ACCESS_ATTRIBUTES_COLUMN} JSON column. Reads run in two stages: a SQL pre-filter from
 * {@link AccessControlWhereClauseBuilder}, then {@link AccessPolicyEngine} on each fetched row.
 * The second stage only drops rows; order and paging come from the first.
 *
 * <p>The requesting user is passed on every call. {@code null} means unauthenticated, which sees
 * public rows only.
 */
@Slf4j
public class AuthorizedSqlStore {

    public static final String ACCESS_ATTRIBUTES_COLUMN = "access_attributes";

    private final SqlStore sqlStore;
    private final AccessControlWhereClauseBuilder whereClauseBuilder;
    private final List<AccessRule> policy;
    @Nullable
    private final AccessMetrics metrics;

    public AuthorizedSqlStore(
            SqlStore sqlStore,
            AccessControlWhereClauseBuilder whereClauseBuilder,
            List<AccessRule> policy,
            @Nullable AccessMetrics metrics) {
        this.sqlStore = Objects.requireNonNull(sqlStore, "sqlStore");
        this.whereClauseBuilder = Objects.requireNonNull(whereClauseBuilder, "whereClauseBuilder");
        this.policy = List.copyOf(policy);
        this.metrics = metrics;
    }

    /**
     * The policy used by the overloads that take none.
     */
    public List<AccessRule> policy() {
        return policy;
    }

    /**
     * Create the table with the access column, or add the column to an existing table.
     * Safe to repeat and to call concurrently.
     */
    public void createTableWithAccessControl(String table, Map<String, ColumnDefinition> schema) {
        Map<String, ColumnDefinition> withAccessColumn = new LinkedHashMap<>(schema);
        withAccessColumn.put(ACCESS_ATTRIBUTES_COLUMN, ColumnDefinition.of(ColumnType.JSON));
        sqlStore.createTable(table, withAccessColumn);

        try {
            sqlStore.addColumnIfNotExists(table, ACCESS_ATTRIBUTES_COLUMN, ColumnType.JSON, true);
        } catch (DataAccessException e) {
            if (sqlStore.dialect().isDuplicateColumnError(e)) {
                log.debug("Access column already added to {} concurrently", table);
            } else {
                log.warn("Could not migrate access column of table {}: {}", table,
                        StringSanitizer.forLog(e.getMessage(), 256));
            }
        }
    }

    /**
     * Insert a row owned by {@code user}. The user's attributes are copied into the row and never
     * change afterwards; rows inserted without a user, or by a user without attributes, are
     * public.
     */
    public void insert(@Nullable User user, String table, Map<String, Object> data) {
        Map<String, Object> row = new LinkedHashMap<>(data);
        if (row.containsKey(ACCESS_ATTRIBUTES_COLUMN)) {
            log.warn("Ignoring caller-supplied {} on insert into {}", ACCESS_ATTRIBUTES_COLUMN, table);
        }
        row.put(ACCESS_ATTRIBUTES_COLUMN, user != null && user.hasAttributes() ? user.attributes() : null);
        sqlStore.insert(table, row);
    }

    public PaginatedResult fetchAll(@Nullable User user, String table, FetchQuery query) {
        return fetchAll(user, table, policy, query);
    }

    /**
     * Rows of {@code table} the user may read under {@code policy}.
     */
    public PaginatedResult fetchAll(@Nullable User user, String table, List<AccessRule> policy, FetchQuery query) {
        FetchQuery effective = query != null ? query : FetchQuery.all();
        if (effective.cursorId() != null) {
            requireReadableCursor(user, table, policy, effective.cursorId());
        }
        FetchQuery filtered = withAccessPredicate(policy, user, effective);
        PaginatedResult candidates = sqlStore.fetchAll(table, filtered);

        List<Map<String, Object>> permitted = new ArrayList<>(candidates.data().size());
        for (Map<String, Object> row : candidates.data()) {
            if (AccessPolicyEngine.isActionAllowed(policy, Action.READ, SqlRecord.fromRow(table, row), user)) {
                permitted.add(row);
            }
        }

        int dropped = candidates.data().size() - permitted.size();
        if (dropped > 0) {
            log.debug("Policy evaluation removed {} of {} rows from {}", dropped, candidates.data().size(), table);
        }
        if (metrics != null) {
            metrics.recordRowFiltering(candidates.data().size(), dropped);
        }
        return new PaginatedResult(permitted, candidates.hasMore());
    }

    @Nullable
    public Map<String, Object> fetchOne(@Nullable User user, String table, FetchQuery query) {
        return fetchOne(user, table, policy, query);
    }

    @Nullable
    public Map<String, Object> fetchOne(@Nullable User user, String table, List<AccessRule> policy, FetchQuery query) {
        FetchQuery single = (query != null ? query.toBuilder() : FetchQuery.builder()).limit(1).build();
        List<Map<String, Object>> rows = fetchAll(user, table, policy, single).data();
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Update the rows matching {@code where}. Every matched row must permit
     * {@link Action#UPDATE} to the user, otherwise nothing is written.
     *
     * @throws IllegalArgumentException if {@code where} is empty or {@code data} touches the
     *                                  access column
     * @throws AccessDeniedException    if a matched row does not permit the update
     */
    public int update(@Nullable User user, String table, Map<String, Object> data, Map<String, Object> where) {
        if (where == null || where.isEmpty()) {
            throw new IllegalArgumentException("where is required for update");
        }
        if (data != null && data.keySet().stream().anyMatch(ACCESS_ATTRIBUTES_COLUMN::equalsIgnoreCase)) {
            throw new IllegalArgumentException(ACCESS_ATTRIBUTES_COLUMN + " cannot be updated");
        }
        requireActionOnMatches(user, table, Action.UPDATE, where);
        return sqlStore.update(table, data, where);
    }

    /**
     * Delete the rows matching {@code where}. Every matched row must permit
     * {@link Action#DELETE} to the user, otherwise nothing is deleted.
     *
     * @throws IllegalArgumentException if {@code where} is empty
     * @throws AccessDeniedException    if a matched row does not permit the deletion
     */
    public int delete(@Nullable User user, String table, Map<String, Object> where) {
        if (where == null || where.isEmpty()) {
            throw new IllegalArgumentException("where is required for delete");
        }
        requireActionOnMatches(user, table, Action.DELETE, where);
        return sqlStore.delete(table, where);
    }

    private void requireActionOnMatches(@Nullable User user, String table, Action action, Map<String, Object> where) {
        for (Map<String, Object> row : sqlStore.fetchAll(table, FetchQuery.matching(where)).data()) {
            SqlRecord record = SqlRecord.fromRow(table, row);
            if (!AccessPolicyEngine.isActionAllowed(policy, action, record, user)) {
                String principal = user != null ? user.principal() : null;
                log.warn("{} on {} denied for principal {}", action, record.qualifiedId(),
                        StringSanitizer.forLog(principal));
                throw new AccessDeniedException(
                        action + " denied on " + record.qualifiedId(), principal, record.qualifiedId());
            }
        }
    }

    // A hidden cursor row fails like a missing one, so paging reveals nothing about unreadable rows.
    private void requireReadableCursor(@Nullable User user, String table, List<AccessRule> policy, String cursorId) {
        Map<String, Object> cursorRow = sqlStore.fetchOne(table,
                FetchQuery.matching(Map.of(SqlStore.CURSOR_KEY_COLUMN, cursorId)));
        if (cursorRow == null
                || !AccessPolicyEngine.isActionAllowed(policy, Action.READ, SqlRecord.fromRow(table, cursorRow), user)) {
            throw FetchQuery.cursorNotFound(table, cursorId);
        }
    }

    private FetchQuery withAccessPredicate(List<AccessRule> policy, @Nullable User user, FetchQuery query) {
        SqlPredicate predicate = whereClauseBuilder.build(policy, user);
        if (metrics != null) {
            metrics.recordPrefilter(whereClauseBuilder.isOptimized(policy));
        }

        String whereSql = query.whereSql() == null || query.whereSql().isBlank()
                ? predicate.sql()
                : "(" + query.whereSql() + ") AND " + predicate.sql();

        Map<String, Object> parameters = new HashMap<>(query.whereSqlParameters());
        predicate.parameters().forEach((name, value) -> {
            if (parameters.containsKey(name)) {
                throw new IllegalArgumentException("Parameter '" + name + "' is reserved");
            }
            parameters.put(name, value);
        });

        return query.toBuilder()
                .whereSql(whereSql)
                .whereSqlParameters(parameters)
                .build();
    }
}
