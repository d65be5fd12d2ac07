package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Scope;

import java.util.List;

/**
 * The policy {@link AccessControlWhereClauseBuilder} knows how to translate to SQL.
 *
 * <p>Written out literally rather than derived from the default policy, so a change to one without
 * the other is caught by the comparison at construction of the builder.
 */
final class SqlOptimizedPolicy {

    static final List<String> CATEGORIES = List.of("roles", "teams", "projects", "namespaces");

    static final List<AccessRule> RULES = List.of(
            AccessRule.permit(
                    Scope.allActions(),
                    List.of(
                            "user in owners roles",
                            "user in owners teams",
                            "user in owners projects",
                            "user in owners namespaces")));

    private SqlOptimizedPolicy() {}
}
