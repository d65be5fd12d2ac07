package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

/**
 * {@code user with <value> in <category>}.
 */
public record UserWithValueInList(String category, String value) implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        return user.valuesOf(category).contains(value);
    }

    @Override
    public String toString() {
        return "user with " + value + " in " + category;
    }
}
