package com.example.rowguard.authz.model;

/**
 * A guarded route or service method. APIs have no owner of their own, so the caller stands in
 * as the owner.
 */
public record ApiResource(
        String identifier,
        User owner
) implements ProtectedResource {

    public static final String TYPE = "api";

    @Override
    public String type() {
        return TYPE;
    }
}
