package com.williamcallahan.tutormemory.domain.memory;

/**
 * Per-item failure recorded during batch import.
 *
 * @param fact the candidate that was skipped
 * @param error reason the candidate was skipped
 */
public record FactImportError(NewFact fact, String error) {
}
