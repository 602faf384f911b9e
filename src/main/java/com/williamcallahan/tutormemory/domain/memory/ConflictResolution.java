package com.williamcallahan.tutormemory.domain.memory;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving one candidate fact.
 *
 * @param action what happened to the candidate
 * @param existingFacts active matches observed before the decision was applied
 * @param result the inserted or merged fact; null when the candidate was ignored
 */
public record ConflictResolution(ConflictAction action, List<Fact> existingFacts, Fact result) {

    public ConflictResolution {
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        existingFacts = existingFacts == null ? List.of() : List.copyOf(existingFacts);
    }

    public Optional<Fact> resultFact() {
        return Optional.ofNullable(result);
    }
}
