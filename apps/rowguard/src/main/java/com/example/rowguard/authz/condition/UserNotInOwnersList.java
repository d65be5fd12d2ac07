package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * {@code user not in owners <category>}.
 */
public record UserNotInOwnersList(String category) implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        return !new UserInOwnersList(category).matches(resource, user);
    }

    @Override
    public String toString() {
        return "user not in owners " + category;
    }
}
