package com.example.rowguard.sqlstore.authorized;

import java.util.Map;

/**
 * A WHERE-clause fragment with its named parameters.
 */
public record SqlPredicate(String sql, Map<String, Object> parameters) {

    public static final SqlPredicate ALWAYS_TRUE = new SqlPredicate("1 = 1", Map.of());

    public SqlPredicate {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
