package com.example.rowguard.sqlstore;

/**
 * Raised when a value cannot be converted between its Java and stored form.
 */
public class SqlStoreException extends RuntimeException {

    public SqlStoreException(String message) {
        super(message);
    }

    public SqlStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
