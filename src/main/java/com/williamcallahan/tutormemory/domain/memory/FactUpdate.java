package com.williamcallahan.tutormemory.domain.memory;

import java.util.Set;

/**
 * Partial update of a stored fact; null fields are left unchanged.
 *
 * @param factType replacement category
 * @param subject replacement subject
 * @param details replacement details
 * @param confidence replacement confidence
 * @param active replacement soft-delete flag
 * @param tags replacement tag set
 */
public record FactUpdate(
        FactType factType,
        String subject,
        String details,
        Double confidence,
        Boolean active,
        Set<String> tags) {

    public static FactUpdate details(String details) {
        return new FactUpdate(null, null, details, null, null, null);
    }
}
