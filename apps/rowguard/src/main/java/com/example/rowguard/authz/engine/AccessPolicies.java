package com.example.rowguard.authz.engine;

import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Scope;

import java.util.List;

/**
 * Built-in policies.
 */
public final class AccessPolicies {

    /**
     * Attribute categories the default policy matches owners on.
     */
    public static final List<String> OWNER_CATEGORIES = List.of("roles", "teams", "projects", "namespaces");

    private AccessPolicies() {}

    /**
     * The policy used when none is configured: every action is permitted when the user is among
     * the resource owner's values for each category the resource declares.
     */
    public static List<AccessRule> defaultPolicy() {
        return List.of(AccessRule.permit(
                Scope.allActions(),
                OWNER_CATEGORIES.stream().map(category -> "user in owners " + category).toList()));
    }
}
