package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

import java.util.EnumSet;
import java.util.Set;

/**
 * The set of requests an access rule applies to.
 *
 * <p>{@code actions} is required. {@code principal} narrows the rule to a single user and
 * {@code resource} to a qualified resource id ({@code type::identifier}); a resource ending in
 * {@code ::*} matches every identifier of that type.
 */
public record Scope(
        Set<Action> actions,
        @Nullable String principal,
        @Nullable String resource
) {

    private static final String WILDCARD_SUFFIX = "::*";

    public Scope {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Scope must name at least one action");
        }
        actions = Set.copyOf(actions);
    }

    public static Scope of(Set<Action> actions) {
        return new Scope(actions, null, null);
    }

    public static Scope allActions() {
        return of(EnumSet.allOf(Action.class));
    }

    /**
     * Check if a request falls within this scope.
     *
     * @param action              requested action
     * @param qualifiedResourceId {@code type::identifier} of the resource
     * @param principal           requesting principal
     */
    public boolean matches(Action action, String qualifiedResourceId, String principal) {
        if (resource != null && !matchesResource(qualifiedResourceId)) {
            return false;
        }
        if (this.principal != null && !this.principal.equals(principal)) {
            return false;
        }
        return actions.contains(action);
    }

    private boolean matchesResource(String qualifiedResourceId) {
        if (resource.equals(qualifiedResourceId)) {
            return true;
        }
        return resource.endsWith(WILDCARD_SUFFIX)
                && qualifiedResourceId.startsWith(resource.substring(0, resource.length() - 1));
    }
}
