package com.williamcallahan.tutormemory.application.prompt;

/**
 * Maps text to an integer token cost.
 *
 * <p>Implementations must be deterministic, never negative, and return zero for empty text.
 * Budget allocation treats the count as exact.</p>
 */
@FunctionalInterface
public interface TokenCounter {

    /**
     * Counts tokens in the given text.
     *
     * @param text text to measure, null treated as empty
     * @return token cost, at least zero
     */
    int count(String text);
}
