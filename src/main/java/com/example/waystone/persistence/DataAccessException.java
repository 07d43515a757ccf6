package com.example.waystone.persistence;

/**
 * A database operation failed. Wraps the underlying {@link java.sql.SQLException}.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
