package com.example.rowguard.authz.condition;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;

import java.util.List;

/**
 * {@code user in owners <category>}: the user holds at least one of the values the resource
 * owner declares for the category. A category the owner does not declare, or declares empty,
 * imposes no restriction.
 */
public record UserInOwnersList(String category) implements Condition {

    @Override
    public boolean matches(ProtectedResource resource, User user) {
        List<String> required = ownerValues(resource);
        if (required.isEmpty()) {
            return true;
        }
        List<String> held = user.valuesOf(category);
        for (String value : required) {
            if (held.contains(value)) {
                return true;
            }
        }
        return false;
    }

    List<String> ownerValues(ProtectedResource resource) {
        User owner = resource.owner();
        return owner != null ? owner.valuesOf(category) : List.of();
    }

    @Override
    public String toString() {
        return "user in owners " + category;
    }
}
