package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * {@code user is owner}.
 */
public record UserIsOwner() implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        User owner = resource.owner();
        return owner != null && owner.principal().equals(user.principal());
    }

    @Override
    public String toString() {
        return "user is owner";
    }
}
