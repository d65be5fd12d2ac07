package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * A parsed access condition, evaluated against a resource and the requesting user.
 *
 * <p>Implementations are pure: no I/O, no mutation.
 */
public sealed interface Condition permits
        UserWithValueInList,
        UserWithValueNotInList,
        UserInOwnersList,
        UserNotInOwnersList,
        UserIsOwner,
        UserIsNotOwner,
        ResourceIsUnowned {

    /**
     * @param resource the resource being accessed
     * @param user     the requesting user, never {@code null}
     */
    boolean matches(ProtectedResource resource, User user);
}
