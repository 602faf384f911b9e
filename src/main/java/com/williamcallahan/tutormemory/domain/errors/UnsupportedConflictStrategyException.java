package com.williamcallahan.tutormemory.domain.errors;

/**
 * Signals a conflict strategy that is unknown or not valid for the requested operation.
 *
 * <p>This is a configuration error: it is raised before any fact is touched and is never
 * recorded as a per-item import error.</p>
 */
public class UnsupportedConflictStrategyException extends RuntimeException {

    /**
     * Creates a configuration failure with a human-readable message.
     *
     * @param message explanation naming the offending strategy
     */
    public UnsupportedConflictStrategyException(String message) {
        super(message);
    }
}
