package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.engine.AccessPolicies;
import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.sqlstore.dialect.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles an access policy into a SQL pre-filter over the {@code access_attributes} column.
 *
 * <p>The pre-filter never excludes a row the policy would permit. Only the default policy is
 * translated precisely:
 * <pre>
 * (row is public) OR (row is an object AND roles-match AND teams-match AND projects-match AND namespaces-match)
 * </pre>
 * where a category matches when the row does not restrict it or lists one of the user's values.
 * Any other policy gets a conservative predicate and relies on the evaluator pass.
 */
@Slf4j
public class AccessControlWhereClauseBuilder {

    private static final String PARAMETER_PREFIX = "acl_";

    private final SqlDialect dialect;
    private final boolean optimizationActive;

    public AccessControlWhereClauseBuilder(SqlDialect dialect, boolean optimizationEnabled) {
        this(dialect, optimizationEnabled, AccessPolicies.defaultPolicy());
    }

    AccessControlWhereClauseBuilder(SqlDialect dialect, boolean optimizationEnabled, List<AccessRule> defaultPolicy) {
        this.dialect = dialect;

        boolean consistent = SqlOptimizedPolicy.RULES.equals(defaultPolicy);
        if (!consistent) {
            log.warn("SQL-optimized access policy does not match the default policy, "
                    + "using conservative row filtering for all reads");
        }
        if (!optimizationEnabled) {
            log.info("SQL access optimization disabled by configuration");
        }
        this.optimizationActive = optimizationEnabled && consistent;
    }

    public boolean isOptimizationActive() {
        return optimizationActive;
    }

    /**
     * Whether {@link #build} translates this policy precisely.
     */
    public boolean isOptimized(List<AccessRule> policy) {
        return optimizationActive && SqlOptimizedPolicy.RULES.equals(policy);
    }

    public SqlPredicate build(List<AccessRule> policy, @Nullable User user) {
        if (isOptimized(policy)) {
            return optimized(user);
        }
        return conservative(user);
    }

    private SqlPredicate conservative(@Nullable User user) {
        if (user == null) {
            return new SqlPredicate(dialect.jsonIsEmptyObject(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN), Map.of());
        }
        return SqlPredicate.ALWAYS_TRUE;
    }

    private SqlPredicate optimized(@Nullable User user) {
        String column = AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN;
        String publicRow = dialect.jsonIsEmptyObject(column);
        if (user == null) {
            return new SqlPredicate(publicRow, Map.of());
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        List<String> categoryConditions = new ArrayList<>(SqlOptimizedPolicy.CATEGORIES.size() + 1);
        categoryConditions.add(dialect.jsonIsObject(column));
        for (String category : SqlOptimizedPolicy.CATEGORIES) {
            String missing = dialect.jsonKeyMissingOrEmpty(column, category);
            List<String> values = user.valuesOf(category);
            if (values.isEmpty()) {
                categoryConditions.add(missing);
                continue;
            }
            String parameter = PARAMETER_PREFIX + category;
            parameters.put(parameter, List.copyOf(values));
            categoryConditions.add("(" + missing + " OR "
                    + dialect.jsonArrayContainsAny(column, category, parameter) + ")");
        }

        String sql = "(" + publicRow + " OR (" + String.join(" AND ", categoryConditions) + "))";
        return new SqlPredicate(sql, parameters);
    }
}
