package com.example.rowguard.authz.model;

import java.util.Locale;

/**
 * Operations an access rule can permit or forbid.
 */
public enum Action {
    /**
     * Create a new record.
     */
    CREATE,

    /**
     * Read an existing record. Row-level filtering always checks this action.
     */
    READ,

    /**
     * Modify an existing record.
     */
    UPDATE,

    /**
     * Remove a record.
     */
    DELETE;

    /**
     * Parse an action name as written in configuration ({@code read}, {@code READ}).
     *
     * @throws IllegalArgumentException if the name is not a known action
     */
    public static Action fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action must not be blank");
        }
        try {
            return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action '" + value + "'", e);
        }
    }
}
