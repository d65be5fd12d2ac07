package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Generic resource for callers evaluating access outside the store.
 */
public record ResourceRef(
        String type,
        String identifier,
        @Nullable User owner
) implements ProtectedResource {

    public ResourceRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(identifier, "identifier");
    }
}
