package com.williamcallahan.tutormemory.application.memory;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeProfile;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Renders a short narrative profile of a user from their active facts.
 *
 * <p>The narrative is a fixed sequence of sentences: counts, preferences, goals, struggles,
 * interests, learning style and recent subjects. Categories without facts are left out.</p>
 */
@Component
public class KnowledgeProfileBuilder {

    static final String EMPTY_PROFILE = "No knowledge profile available for this user yet.";
    static final int DEFAULT_MAX_FACTS_PER_TYPE = 3;
    static final int MAX_LEARNING_STYLES = 2;
    static final int MAX_RECENT_SUBJECTS = 5;

    private final Clock clock;

    public KnowledgeProfileBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the profile.
     *
     * @param facts the user's facts; inactive ones are ignored
     * @param maxFactsPerType excerpt cap for preferences, goals, struggles and interests
     * @param recencyWindow how far back a subject counts as recent
     * @return profile narrative and statistics
     */
    public KnowledgeProfile build(List<Fact> facts, int maxFactsPerType, Duration recencyWindow) {
        List<Fact> active = facts.stream()
                .filter(Fact::active)
                .sorted(Comparator.comparing(KnowledgeProfileBuilder::recency).reversed())
                .toList();
        if (active.isEmpty()) {
            return new KnowledgeProfile(EMPTY_PROFILE, Map.of(), 0, List.of());
        }

        Map<FactType, List<Fact>> byType = new EnumMap<>(FactType.class);
        for (Fact fact : active) {
            byType.computeIfAbsent(fact.factType(), type -> new ArrayList<>()).add(fact);
        }
        Map<FactType, Integer> distribution = new EnumMap<>(FactType.class);
        byType.forEach((type, typed) -> distribution.put(type, typed.size()));

        Instant cutoff = clock.instant().minus(recencyWindow);
        Set<String> recent = new LinkedHashSet<>();
        for (Fact fact : active) {
            if (fact.hasSubject() && recency(fact).isAfter(cutoff)) {
                recent.add(fact.subject());
            }
        }
        List<String> recentSubjects = List.copyOf(recent);

        List<String> parts = new ArrayList<>();
        parts.add("This user has " + active.size() + " stored facts across " + byType.size() + " categories.");
        addPart(parts, "Preferences", byType.get(FactType.PREFERENCE), maxFactsPerType, Fact::details);
        addPart(parts, "Goals", byType.get(FactType.GOAL), maxFactsPerType, Fact::details);
        addPart(parts, "Struggles", byType.get(FactType.STRUGGLE), maxFactsPerType, Fact::details);
        addPart(parts, "Interests", byType.get(FactType.TOPIC_INTEREST), maxFactsPerType,
                fact -> fact.hasSubject() ? fact.subject() + " (" + fact.details() + ")" : fact.details());
        addPart(parts, "Learning style", byType.get(FactType.LEARNING_STYLE), MAX_LEARNING_STYLES, Fact::details);
        if (!recentSubjects.isEmpty()) {
            List<String> shown = recentSubjects.subList(0, Math.min(MAX_RECENT_SUBJECTS, recentSubjects.size()));
            parts.add("Recent subjects: " + String.join(", ", shown) + ".");
        }

        return new KnowledgeProfile(String.join(" ", parts), distribution, active.size(), recentSubjects);
    }

    public KnowledgeProfile build(List<Fact> facts, Duration recencyWindow) {
        return build(facts, DEFAULT_MAX_FACTS_PER_TYPE, recencyWindow);
    }

    private static void addPart(
            List<String> parts, String label, List<Fact> facts, int limit, Function<Fact, String> render) {
        if (facts == null || facts.isEmpty()) {
            return;
        }
        List<String> excerpts = facts.stream().limit(Math.max(limit, 0)).map(render).toList();
        if (!excerpts.isEmpty()) {
            parts.add(label + ": " + String.join("; ", excerpts) + ".");
        }
    }

    private static Instant recency(Fact fact) {
        return fact.lastTouched() == null ? Instant.EPOCH : fact.lastTouched();
    }
}
