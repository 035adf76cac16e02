package com.todos.api.exception;

/**
 * Thrown when the MongoDB connection could not be established during startup.
 * Raised from bean creation, so it aborts the application context and the
 * process never starts accepting requests.
 */
public class DatabaseUnavailableException extends RuntimeException {

    public DatabaseUnavailableException(String message) {
        super(message);
    }

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
