package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

/**
 * Result of evaluating an access policy.
 *
 * @param decision  ALLOW or DENY
 * @param reason    human-readable explanation, safe to log
 * @param ruleIndex position of the deciding rule in the policy, {@code null} when no rule decided
 */
public record PolicyDecision(
        Decision decision,
        String reason,
        @Nullable Integer ruleIndex
) {
    public enum Decision {
        ALLOW,
        DENY
    }

    /**
     * Create an ALLOW decision reached by a rule.
     */
    public static PolicyDecision allow(int ruleIndex, String reason) {
        return new PolicyDecision(Decision.ALLOW, reason, ruleIndex);
    }

    /**
     * Create an ALLOW decision reached without a rule (public resource).
     */
    public static PolicyDecision allow(String reason) {
        return new PolicyDecision(Decision.ALLOW, reason, null);
    }

    /**
     * Create a DENY decision reached by a rule.
     */
    public static PolicyDecision deny(int ruleIndex, String reason) {
        return new PolicyDecision(Decision.DENY, reason, ruleIndex);
    }

    /**
     * Create a DENY decision reached without a rule.
     */
    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(Decision.DENY, reason, null);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }
}
