package com.dynamiccapital.pool.services;

/**
 * Failure of a {@link PrivatePoolStore} operation.
 *
 * <p>Carries the operation name and the underlying persistence message; callers only
 * rely on the fact of failure, never on store-specific error codes.</p>
 */
public class StoreException extends RuntimeException {

    private final String operation;

    public StoreException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public StoreException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
