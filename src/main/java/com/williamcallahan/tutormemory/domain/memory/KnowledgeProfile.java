package com.williamcallahan.tutormemory.domain.memory;

import java.util.List;
import java.util.Map;

/**
 * Narrative summary of a user's active facts.
 *
 * @param summary fixed-order narrative text
 * @param factTypeDistribution active fact count per type, types without facts omitted
 * @param totalFacts number of active facts
 * @param recentSubjects distinct subjects touched within the recency window
 */
public record KnowledgeProfile(
        String summary,
        Map<FactType, Integer> factTypeDistribution,
        int totalFacts,
        List<String> recentSubjects) {

    public KnowledgeProfile {
        factTypeDistribution = Map.copyOf(factTypeDistribution);
        recentSubjects = List.copyOf(recentSubjects);
    }
}
