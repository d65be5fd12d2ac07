package com.example.rowguard.authz.guard;

import com.example.rowguard.authz.condition.Condition;
import com.example.rowguard.authz.condition.ConditionParser;
import com.example.rowguard.authz.condition.InvalidConditionException;
import com.example.rowguard.authz.condition.UserWithValueInList;
import com.example.rowguard.authz.condition.UserWithValueNotInList;
import com.example.rowguard.authz.model.ApiResource;
import com.example.rowguard.authz.model.User;
import org.springframework.lang.Nullable;

/**
 * Access check for routes and service methods.
 *
 * <p>APIs have no owners, so only the two attribute-membership forms are supported:
 * {@code user with VALUE in CATEGORY} and {@code user with VALUE not in CATEGORY}. Everything
 * else, including a missing user and unparseable conditions, is denied.
 */
public final class RouteAccessGuard {

    private RouteAccessGuard() {}

    public static boolean isAllowed(String condition, @Nullable User user) {
        return isAllowed(condition, "unknown", user);
    }

    /**
     * @param condition  condition string from {@code @RequiresAccess}
     * @param identifier name of the guarded route, used as the resource identifier
     * @param user       the requesting user
     */
    public static boolean isAllowed(String condition, String identifier, @Nullable User user) {
        if (user == null) {
            return false;
        }
        Condition parsed;
        try {
            parsed = ConditionParser.parse(condition);
        } catch (InvalidConditionException e) {
            return false;
        }
        if (!(parsed instanceof UserWithValueInList) && !(parsed instanceof UserWithValueNotInList)) {
            return false;
        }
        return parsed.matches(new ApiResource(identifier, user), user);
    }
}
