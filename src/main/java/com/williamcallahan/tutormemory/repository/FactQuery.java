package com.williamcallahan.tutormemory.repository;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import java.util.Set;

/**
 * Equality filter over a user's facts, translatable to a single indexed lookup.
 *
 * <p>Subject matching treats null and blank subjects as the same "no subject" value.</p>
 *
 * @param userId owning user, required
 * @param includeInactive whether soft-deleted facts are returned
 * @param factTypes restricts to these types, empty for all
 * @param matchSubject whether {@code subject} participates in the filter
 * @param subject subject to match when {@code matchSubject} is set
 */
public record FactQuery(
        String userId, boolean includeInactive, Set<FactType> factTypes, boolean matchSubject, String subject) {

    public FactQuery {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be blank");
        }
        factTypes = factTypes == null ? Set.of() : Set.copyOf(factTypes);
    }

    /**
     * Active facts of a user.
     */
    public static FactQuery activeFor(String userId) {
        return new FactQuery(userId, false, Set.of(), false, null);
    }

    /**
     * Active and inactive facts of a user.
     */
    public static FactQuery allFor(String userId) {
        return new FactQuery(userId, true, Set.of(), false, null);
    }

    /**
     * Active facts colliding with a candidate on type and subject.
     */
    public static FactQuery activeMatches(String userId, FactType factType, String subject) {
        return new FactQuery(userId, false, Set.of(factType), true, subject);
    }

    public FactQuery withFactTypes(Set<FactType> newFactTypes) {
        return new FactQuery(userId, includeInactive, newFactTypes, matchSubject, subject);
    }

    public FactQuery withSubject(String newSubject) {
        return new FactQuery(userId, includeInactive, factTypes, true, newSubject);
    }

    /**
     * Evaluates this query against a fact.
     *
     * @param fact candidate fact
     * @return true when the fact satisfies every condition
     */
    public boolean matches(Fact fact) {
        if (!userId.equals(fact.userId())) {
            return false;
        }
        if (!includeInactive && !fact.active()) {
            return false;
        }
        if (!factTypes.isEmpty() && !factTypes.contains(fact.factType())) {
            return false;
        }
        return !matchSubject || normalizeSubject(subject).equals(normalizeSubject(fact.subject()));
    }

    /**
     * Canonical form of a subject for equality lookups; null and blank collapse to empty.
     */
    public static String normalizeSubject(String subject) {
        return subject == null || subject.isBlank() ? "" : subject;
    }
}
