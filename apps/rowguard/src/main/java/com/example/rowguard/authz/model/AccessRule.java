package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * A single rule of an access policy.
 *
 * <p>Exactly one of {@code permit} and {@code forbid} is set. Conditions are kept as strings at
 * this boundary so policies stay comparable by value and round-trip through configuration; they
 * are parsed into typed conditions at evaluation time.
 *
 * <ul>
 *   <li>{@code when}: the rule applies only if every condition holds</li>
 *   <li>{@code unless}: the rule applies only if not every condition holds</li>
 *   <li>neither: the rule applies unconditionally</li>
 * </ul>
 */
public record AccessRule(
        @Nullable Scope permit,
        @Nullable Scope forbid,
        List<String> when,
        List<String> unless,
        @Nullable String description
) {

    public AccessRule {
        if ((permit == null) == (forbid == null)) {
            throw new IllegalArgumentException("Access rule must set exactly one of permit or forbid");
        }
        when = when == null ? List.of() : List.copyOf(when);
        unless = unless == null ? List.of() : List.copyOf(unless);
        if (!when.isEmpty() && !unless.isEmpty()) {
            throw new IllegalArgumentException("Access rule cannot set both when and unless");
        }
    }

    public static AccessRule permit(Scope scope, List<String> when) {
        return new AccessRule(scope, null, when, null, null);
    }

    public static AccessRule permitUnless(Scope scope, List<String> unless) {
        return new AccessRule(scope, null, null, unless, null);
    }

    public static AccessRule forbid(Scope scope, List<String> when) {
        return new AccessRule(null, scope, when, null, null);
    }

    public static AccessRule forbidUnless(Scope scope, List<String> unless) {
        return new AccessRule(null, scope, null, unless, null);
    }

    public boolean isPermit() {
        return permit != null;
    }

    /**
     * The scope of this rule, whichever effect it has.
     */
    public Scope scope() {
        return permit != null ? permit : forbid;
    }
}
