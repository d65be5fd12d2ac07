package com.example.rowguard.authz.engine;

import com.example.rowguard.authz.condition.Condition;
import com.example.rowguard.authz.condition.ConditionParser;
import com.example.rowguard.authz.condition.InvalidConditionException;
import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Action;
import com.example.rowguard.authz.model.PolicyDecision;
import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Authoritative, in-memory access policy evaluation.
 *
 * <p>Combining algorithm: first applicable rule, deny by default.
 * <ul>
 *   <li>A resource with unreadable ownership data is denied to everyone</li>
 *   <li>A public resource (no owner attributes) is always readable</li>
 *   <li>Without a user no rule can be satisfied</li>
 *   <li>Rules are evaluated in order; the first one whose scope matches and whose conditions
 *       apply decides: permit allows, forbid denies</li>
 *   <li>If no rule applies, access is denied</li>
 * </ul>
 *
 * <p>Condition strings that fail to parse never widen access: they make a permit rule
 * inapplicable and make a forbid rule apply.
 *
 * <p>Every method here is a pure function of its arguments, which is what the SQL pre-filter is
 * checked against.
 */
public final class AccessPolicyEngine {

    private AccessPolicyEngine() {}

    /**
     * Check whether {@code user} may perform {@code action} on {@code resource}.
     */
    public static boolean isActionAllowed(
            List<AccessRule> policy,
            Action action,
            ProtectedResource resource,
            @Nullable User user) {
        return evaluate(policy, action, resource, user).isAllowed();
    }

    /**
     * Evaluate the policy and explain the outcome.
     */
    public static PolicyDecision evaluate(
            List<AccessRule> policy,
            Action action,
            ProtectedResource resource,
            @Nullable User user) {

        if (resource.hasUnreadableOwnership()) {
            return PolicyDecision.deny("Resource " + resource.qualifiedId() + " has unreadable ownership attributes");
        }
        if (resource.isPublic()) {
            return PolicyDecision.allow("Resource " + resource.qualifiedId() + " is public");
        }
        if (user == null) {
            return PolicyDecision.deny("No authenticated user for non-public resource " + resource.qualifiedId());
        }

        for (int i = 0; i < policy.size(); i++) {
            AccessRule rule = policy.get(i);
            if (!rule.scope().matches(action, resource.qualifiedId(), user.principal())) {
                continue;
            }

            RuleOutcome outcome = applies(rule, resource, user);
            if (outcome == RuleOutcome.NOT_APPLICABLE) {
                continue;
            }
            if (outcome == RuleOutcome.INVALID) {
                if (rule.isPermit()) {
                    continue;
                }
                return PolicyDecision.deny(i, "Rule " + i + " has an invalid condition");
            }
            if (rule.isPermit()) {
                return PolicyDecision.allow(i, "Permitted by rule " + i);
            }
            return PolicyDecision.deny(i, "Forbidden by rule " + i);
        }

        return PolicyDecision.deny("No rule permits " + action + " on " + resource.qualifiedId());
    }

    private enum RuleOutcome {
        APPLIES,
        NOT_APPLICABLE,
        INVALID
    }

    private static RuleOutcome applies(AccessRule rule, ProtectedResource resource, User user) {
        try {
            if (!rule.when().isEmpty()) {
                return allMatch(ConditionParser.parseAll(rule.when()), resource, user)
                        ? RuleOutcome.APPLIES
                        : RuleOutcome.NOT_APPLICABLE;
            }
            if (!rule.unless().isEmpty()) {
                return allMatch(ConditionParser.parseAll(rule.unless()), resource, user)
                        ? RuleOutcome.NOT_APPLICABLE
                        : RuleOutcome.APPLIES;
            }
            return RuleOutcome.APPLIES;
        } catch (InvalidConditionException e) {
            return RuleOutcome.INVALID;
        }
    }

    private static boolean allMatch(List<Condition> conditions, ProtectedResource resource, User user) {
        for (Condition condition : conditions) {
            if (!condition.matches(resource, user)) {
                return false;
            }
        }
        return true;
    }
}
