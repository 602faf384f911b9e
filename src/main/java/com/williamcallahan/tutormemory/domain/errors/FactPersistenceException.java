package com.williamcallahan.tutormemory.domain.errors;

/**
 * Signals that the fact store rejected a write or returned no row for it.
 */
public class FactPersistenceException extends RuntimeException {

    /**
     * Creates a persistence failure with a human-readable message.
     *
     * @param message explanation of the failure
     */
    public FactPersistenceException(String message) {
        super(message);
    }
}
