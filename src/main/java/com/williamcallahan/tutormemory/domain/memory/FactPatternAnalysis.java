package com.williamcallahan.tutormemory.domain.memory;

import java.util.List;

/**
 * Heuristic insights derived from a user's active facts.
 *
 * @param strengths at most five strength labels
 * @param challenges at most five challenge descriptions
 * @param recommendedApproaches learning approaches taken from styles and preferences
 * @param learningPatterns count-based pattern labels
 * @param engagementSuggestions suggestions for tailoring interactions
 */
public record FactPatternAnalysis(
        List<String> strengths,
        List<String> challenges,
        List<String> recommendedApproaches,
        List<String> learningPatterns,
        List<String> engagementSuggestions) {

    public FactPatternAnalysis {
        strengths = List.copyOf(strengths);
        challenges = List.copyOf(challenges);
        recommendedApproaches = List.copyOf(recommendedApproaches);
        learningPatterns = List.copyOf(learningPatterns);
        engagementSuggestions = List.copyOf(engagementSuggestions);
    }

    public static FactPatternAnalysis empty() {
        return new FactPatternAnalysis(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
