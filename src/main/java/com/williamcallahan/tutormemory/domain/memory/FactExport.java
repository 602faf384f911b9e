package com.williamcallahan.tutormemory.domain.memory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Portable export of a user's facts.
 *
 * @param facts exported facts
 * @param metadata export metadata
 */
public record FactExport(List<Fact> facts, Metadata metadata) {

    public static final String FORMAT_VERSION = "1.0";

    public FactExport {
        facts = facts == null ? null : List.copyOf(facts);
    }

    /**
     * Export metadata.
     *
     * @param exportDate time of export
     * @param totalCount number of exported facts
     * @param factTypeCounts exported fact count per type wire name
     * @param version export format version
     */
    public record Metadata(Instant exportDate, int totalCount, Map<String, Integer> factTypeCounts, String version) {

        public Metadata {
            factTypeCounts = factTypeCounts == null ? Map.of() : Map.copyOf(factTypeCounts);
        }
    }
}
