package com.williamcallahan.tutormemory.application.memory;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactPatternAnalysis;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Keyword and count heuristics that turn raw facts into teaching insights.
 */
@Component
public class FactPatternAnalyzer {

    static final int MAX_STRENGTHS = 5;
    static final int MAX_CHALLENGES = 5;

    private static final List<String> STRENGTH_KEYWORDS =
            List.of("good at", "strong in", "strength", "excel", "skilled");
    private static final List<String> CHALLENGE_KEYWORDS =
            List.of("difficult", "challenge", "struggle", "hard time", "trouble with");
    private static final List<String> APPROACH_KEYWORDS = List.of("learn", "study", "practice", "prefer when");

    static final String GOAL_ORIENTED = "Goal-oriented learner who benefits from clear objectives";
    static final String CHALLENGE_FOCUSED =
            "Focuses more on challenges than goals - may benefit from strengths-based approach";
    static final String INTEREST_DRIVEN =
            "Interest-driven learner who engages best with topics of personal relevance";

    /**
     * Analyzes the active facts of one user.
     *
     * @param facts the user's facts; inactive ones are ignored
     * @return derived insights, empty when there are no active facts
     */
    public FactPatternAnalysis analyze(List<Fact> facts) {
        List<Fact> active = facts.stream().filter(Fact::active).toList();
        if (active.isEmpty()) {
            return FactPatternAnalysis.empty();
        }

        Map<FactType, List<Fact>> byType = new EnumMap<>(FactType.class);
        for (FactType type : FactType.values()) {
            byType.put(type, new ArrayList<>());
        }
        for (Fact fact : active) {
            byType.get(fact.factType()).add(fact);
        }

        List<String> strengths = strengths(active, byType.get(FactType.TOPIC_INTEREST));
        List<String> challenges = challenges(active, byType.get(FactType.STRUGGLE));
        List<String> approaches = approaches(byType.get(FactType.LEARNING_STYLE), byType.get(FactType.PREFERENCE));

        int goals = byType.get(FactType.GOAL).size();
        int struggles = byType.get(FactType.STRUGGLE).size();
        int interests = byType.get(FactType.TOPIC_INTEREST).size();
        List<String> patterns = new ArrayList<>();
        if (goals > 2) {
            patterns.add(GOAL_ORIENTED);
        }
        if (struggles > goals) {
            patterns.add(CHALLENGE_FOCUSED);
        }
        if (interests > goals) {
            patterns.add(INTEREST_DRIVEN);
        }

        List<String> suggestions = new ArrayList<>();
        if (goals > 0) {
            suggestions.add("Connect learning activities to their stated goals for increased motivation");
        }
        if (interests > 0) {
            suggestions.add("Use topics of interest as examples or contexts for teaching new concepts");
        }
        if (!byType.get(FactType.LEARNING_STYLE).isEmpty()) {
            suggestions.add("Accommodate their preferred learning style when presenting new information");
        }
        if (!challenges.isEmpty()) {
            suggestions.add("Provide extra support for identified challenge areas while building on strengths");
        }

        return new FactPatternAnalysis(
                strengths.subList(0, Math.min(MAX_STRENGTHS, strengths.size())),
                challenges.subList(0, Math.min(MAX_CHALLENGES, challenges.size())),
                approaches,
                patterns,
                suggestions);
    }

    private static List<String> strengths(List<Fact> active, List<Fact> interests) {
        List<String> strengths = new ArrayList<>();
        for (Fact fact : active) {
            if (containsAny(fact.details(), STRENGTH_KEYWORDS)) {
                strengths.add(fact.hasSubject() ? fact.subject() : fact.details());
            }
        }
        for (Fact interest : interests) {
            if (interest.hasSubject() && !strengths.contains(interest.subject())) {
                strengths.add(interest.subject());
            }
        }
        return strengths;
    }

    private static List<String> challenges(List<Fact> active, List<Fact> struggles) {
        List<String> challenges = new ArrayList<>();
        for (Fact struggle : struggles) {
            challenges.add(describe(struggle));
        }
        for (Fact fact : active) {
            if (fact.factType() == FactType.STRUGGLE || !containsAny(fact.details(), CHALLENGE_KEYWORDS)) {
                continue;
            }
            String challenge = describe(fact);
            if (!challenges.contains(challenge)) {
                challenges.add(challenge);
            }
        }
        return challenges;
    }

    private static List<String> approaches(List<Fact> learningStyles, List<Fact> preferences) {
        List<String> approaches = new ArrayList<>();
        for (Fact style : learningStyles) {
            approaches.add(style.details());
        }
        for (Fact preference : preferences) {
            if (containsAny(preference.details(), APPROACH_KEYWORDS) && !approaches.contains(preference.details())) {
                approaches.add(preference.details());
            }
        }
        return approaches;
    }

    private static String describe(Fact fact) {
        return fact.hasSubject() ? fact.subject() + ": " + fact.details() : fact.details();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
