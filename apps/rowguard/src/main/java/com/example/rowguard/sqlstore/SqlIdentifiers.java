package com.example.rowguard.sqlstore;

import java.util.regex.Pattern;

/**
 * Table and column names are written into SQL text, so only plain identifiers are accepted.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {}

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * @param kind what the identifier names, for the error message
     * @throws IllegalArgumentException if the identifier is not a plain identifier
     */
    public static String requireValid(String identifier, String kind) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("Invalid " + kind + " name '" + identifier + "'");
        }
        return identifier;
    }
}
