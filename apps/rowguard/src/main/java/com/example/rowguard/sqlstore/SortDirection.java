package com.example.rowguard.sqlstore;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parse {@code asc} or {@code desc}, case-insensitive.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static SortDirection from(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("asc")) {
                return ASC;
            }
            if (normalized.equals("desc")) {
                return DESC;
            }
        }
        throw new IllegalArgumentException("Invalid order '" + value + "', expected asc or desc");
    }
}
