package com.example.rowguard.authz.model;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An authenticated principal and the attributes used for access decisions.
 *
 * <p>Attributes map a category ({@code roles}, {@code teams}, {@code projects},
 * {@code namespaces}, ...) to the values the user holds in it. A {@code null} or empty map
 * means the principal carries no attributes.
 *
 * <p>Instances are immutable: the attribute map and its value lists are copied on construction,
 * so a row that snapshots a user's attributes is never affected by later changes to the
 * caller's collections.
 */
public record User(
        String principal,
        @Nullable Map<String, List<String>> attributes
) {

    public User {
        Objects.requireNonNull(principal, "principal");
        attributes = copyOf(attributes);
    }

    /**
     * Create a user without attributes.
     */
    public static User anonymousPrincipal(String principal) {
        return new User(principal, null);
    }

    /**
     * Check if the user carries at least one attribute category.
     */
    public boolean hasAttributes() {
        return attributes != null && !attributes.isEmpty();
    }

    /**
     * Values the user holds in a category, empty if the category is absent.
     */
    public List<String> valuesOf(String category) {
        if (attributes == null) {
            return List.of();
        }
        List<String> values = attributes.get(category);
        return values != null ? values : List.of();
    }

    @Nullable
    private static Map<String, List<String>> copyOf(@Nullable Map<String, List<String>> source) {
        if (source == null) {
            return null;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        // null entries carry no value and are dropped
        source.forEach((category, values) ->
                copy.put(category, values == null ? null : values.stream().filter(Objects::nonNull).toList()));
        return Collections.unmodifiableMap(copy);
    }
}
