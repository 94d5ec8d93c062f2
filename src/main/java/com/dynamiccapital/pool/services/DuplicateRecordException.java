package com.dynamiccapital.pool.services;

/**
 * Insert rejected by a store-level uniqueness guard: a second investor for the same
 * profile, or a second active cycle. The row that won the race can be re-read.
 */
public class DuplicateRecordException extends StoreException {

    public DuplicateRecordException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
