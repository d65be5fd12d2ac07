package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * {@code resource is unowned}.
 */
public record ResourceIsUnowned() implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        return resource.owner() == null;
    }

    @Override
    public String toString() {
        return "resource is unowned";
    }
}
