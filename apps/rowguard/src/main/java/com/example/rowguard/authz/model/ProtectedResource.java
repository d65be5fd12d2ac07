package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

/**
 * Anything an access policy can be evaluated against.
 *
 * <p>A resource whose owner is missing, or whose owner carries no attributes, is public.
 */
public interface ProtectedResource {

    String type();

    String identifier();

    @Nullable
    User owner();

    /**
     * Qualified id used for scope matching: {@code type::identifier}.
     */
    default String qualifiedId() {
        return type() + "::" + identifier();
    }

    /**
     * Whether the stored ownership data could not be interpreted. Such a resource is neither
     * public nor owned, and no policy grants access to it.
     */
    default boolean hasUnreadableOwnership() {
        return false;
    }

    /**
     * Check if this resource is readable by everyone.
     */
    default boolean isPublic() {
        User owner = owner();
        return owner == null || !owner.hasAttributes();
    }
}
