package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * {@code user is not owner}.
 */
public record UserIsNotOwner() implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        return !new UserIsOwner().matches(resource, user);
    }

    @Override
    public String toString() {
        return "user is not owner";
    }
}
