package com.williamcallahan.tutormemory.domain.memory;

import java.util.List;

/**
 * Coverage gaps in a user's active facts.
 *
 * @param missingFactTypes canonical types with no active fact, in canonical order
 * @param lowCoverageSubjects subjects backed by exactly one active fact, in first-seen order
 * @param recommendedQuestions follow-up questions, missing types first then subjects
 */
public record KnowledgeGapReport(
        List<FactType> missingFactTypes,
        List<String> lowCoverageSubjects,
        List<String> recommendedQuestions) {

    public KnowledgeGapReport {
        missingFactTypes = List.copyOf(missingFactTypes);
        lowCoverageSubjects = List.copyOf(lowCoverageSubjects);
        recommendedQuestions = List.copyOf(recommendedQuestions);
    }
}
