package com.williamcallahan.tutormemory.repository;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for facts.
 *
 * <p>Implementations provide row-level primitives only. Filtering beyond {@link FactQuery},
 * sorting and pagination live in the service layer so every backend behaves the same way.
 * Results of {@link #find(FactQuery)} are returned in insertion order.</p>
 */
public interface FactRepository {

    /**
     * Stores a new fact, assigning an id when the fact carries none.
     *
     * @param fact fact to store
     * @return stored fact with its id
     */
    Fact insert(Fact fact);

    Optional<Fact> findById(String id);

    /**
     * Replaces a stored fact.
     *
     * @param fact replacement with an existing id
     * @return stored fact
     * @throws com.williamcallahan.tutormemory.domain.errors.FactNotFoundException if no fact has the id
     */
    Fact update(Fact fact);

    /**
     * Removes a fact permanently.
     *
     * @param id fact id
     * @return true when a fact was removed
     */
    boolean delete(String id);

    List<Fact> find(FactQuery query);

    default long count(FactQuery query) {
        return find(query).size();
    }
}
