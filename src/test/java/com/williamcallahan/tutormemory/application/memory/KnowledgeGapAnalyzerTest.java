package com.williamcallahan.tutormemory.application.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeGapReport;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies missing-type detection, low-coverage subjects and recommended questions.
 */
class KnowledgeGapAnalyzerTest {

    private final KnowledgeGapAnalyzer analyzer = new KnowledgeGapAnalyzer();

    @Test
    void emptyProfileMissesEveryType() {
        KnowledgeGapReport report = analyzer.analyze(List.of());

        assertEquals(List.of(FactType.values()), report.missingFactTypes());
        assertEquals(List.of(
                "What are your preferences for learning content?",
                "What areas or topics do you find most challenging?",
                "What are your learning goals or what do you hope to achieve?",
                "How do you prefer to learn? (e.g., visual, hands-on, reading)",
                "What topics or subjects are you most interested in?"), report.recommendedQuestions());
    }

    @Test
    void singleMentionSubjectsAreLowCoverage() {
        List<Fact> facts = List.of(
                fact(FactType.PREFERENCE, "math", true),
                fact(FactType.STRUGGLE, "math", true),
                fact(FactType.GOAL, "reading", true),
                fact(FactType.LEARNING_STYLE, null, true),
                fact(FactType.TOPIC_INTEREST, "space", true),
                fact(FactType.OTHER, "history", false));

        KnowledgeGapReport report = analyzer.analyze(facts);

        assertEquals(List.of(FactType.OTHER), report.missingFactTypes());
        assertEquals(List.of("reading", "space"), report.lowCoverageSubjects());
        assertEquals(List.of(
                "Can you tell me more about your experience with reading?",
                "Can you tell me more about your experience with space?"), report.recommendedQuestions());
    }

    private static Fact fact(FactType type, String subject, boolean active) {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        return new Fact("id-" + type + subject, "user_1", null, null, type, subject, "details", null, active,
                Set.of(), at, at);
    }
}
