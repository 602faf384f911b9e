package com.williamcallahan.tutormemory.domain.errors;

/**
 * Signals that an operation referenced a fact that does not exist or is not visible to the caller.
 */
public class FactNotFoundException extends RuntimeException {

    private final String factId;

    /**
     * Creates a not-found failure for the given fact id.
     *
     * @param factId id that could not be resolved
     */
    public FactNotFoundException(String factId) {
        super("Fact not found: " + factId);
        this.factId = factId;
    }

    public String getFactId() {
        return factId;
    }
}
