package com.williamcallahan.tutormemory.domain.memory;

import java.time.Instant;
import java.util.Set;

/**
 * Filters, ordering and paging for fact search.
 *
 * @param query free text; every whitespace-separated term must occur in details or subject
 * @param factTypes allowed fact types, empty for any
 * @param subjects allowed subjects, empty for any
 * @param fromDate inclusive lower bound on creation time
 * @param toDate inclusive upper bound on creation time
 * @param includeInactive whether soft-deleted facts are returned
 * @param minConfidence minimum confidence; facts without confidence never satisfy it
 * @param offset number of matches to skip
 * @param limit maximum number of matches to return
 * @param sortBy sort column
 * @param sortDirection sort direction
 */
public record FactSearchCriteria(
        String query,
        Set<FactType> factTypes,
        Set<String> subjects,
        Instant fromDate,
        Instant toDate,
        boolean includeInactive,
        Double minConfidence,
        int offset,
        int limit,
        FactSortField sortBy,
        SortDirection sortDirection) {

    public static final int DEFAULT_LIMIT = 20;

    /**
     * Creates search criteria, applying defaults for ordering.
     *
     * @throws IllegalArgumentException if offset is negative or limit is not positive
     */
    public FactSearchCriteria {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        factTypes = factTypes == null ? Set.of() : Set.copyOf(factTypes);
        subjects = subjects == null ? Set.of() : Set.copyOf(subjects);
        sortBy = sortBy == null ? FactSortField.UPDATED_AT : sortBy;
        sortDirection = sortDirection == null ? SortDirection.DESC : sortDirection;
    }

    /**
     * Criteria matching all active facts, newest update first, first page.
     */
    public static FactSearchCriteria defaults() {
        return new FactSearchCriteria(null, null, null, null, null, false, null, 0, DEFAULT_LIMIT, null, null);
    }

    public FactSearchCriteria withQuery(String newQuery) {
        return new FactSearchCriteria(newQuery, factTypes, subjects, fromDate, toDate, includeInactive,
                minConfidence, offset, limit, sortBy, sortDirection);
    }

    public FactSearchCriteria withPage(int newOffset, int newLimit) {
        return new FactSearchCriteria(query, factTypes, subjects, fromDate, toDate, includeInactive,
                minConfidence, newOffset, newLimit, sortBy, sortDirection);
    }

    public FactSearchCriteria withSort(FactSortField newSortBy, SortDirection newDirection) {
        return new FactSearchCriteria(query, factTypes, subjects, fromDate, toDate, includeInactive,
                minConfidence, offset, limit, newSortBy, newDirection);
    }

    public FactSearchCriteria withFactTypes(Set<FactType> newFactTypes) {
        return new FactSearchCriteria(query, newFactTypes, subjects, fromDate, toDate, includeInactive,
                minConfidence, offset, limit, sortBy, sortDirection);
    }

    public FactSearchCriteria withSubjects(Set<String> newSubjects) {
        return new FactSearchCriteria(query, factTypes, newSubjects, fromDate, toDate, includeInactive,
                minConfidence, offset, limit, sortBy, sortDirection);
    }

    public FactSearchCriteria withCreatedBetween(Instant from, Instant to) {
        return new FactSearchCriteria(query, factTypes, subjects, from, to, includeInactive,
                minConfidence, offset, limit, sortBy, sortDirection);
    }

    public FactSearchCriteria withMinConfidence(Double newMinConfidence) {
        return new FactSearchCriteria(query, factTypes, subjects, fromDate, toDate, includeInactive,
                newMinConfidence, offset, limit, sortBy, sortDirection);
    }

    public FactSearchCriteria withIncludeInactive(boolean newIncludeInactive) {
        return new FactSearchCriteria(query, factTypes, subjects, fromDate, toDate, newIncludeInactive,
                minConfidence, offset, limit, sortBy, sortDirection);
    }
}
