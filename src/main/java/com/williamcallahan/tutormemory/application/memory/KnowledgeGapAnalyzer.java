package com.williamcallahan.tutormemory.application.memory;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeGapReport;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Finds fact types and subjects that are missing or thinly covered, and the questions that
 * would fill them.
 */
@Component
public class KnowledgeGapAnalyzer {

    private static final Map<FactType, String> MISSING_TYPE_QUESTIONS = new EnumMap<>(FactType.class);

    static {
        MISSING_TYPE_QUESTIONS.put(FactType.PREFERENCE, "What are your preferences for learning content?");
        MISSING_TYPE_QUESTIONS.put(FactType.STRUGGLE, "What areas or topics do you find most challenging?");
        MISSING_TYPE_QUESTIONS.put(FactType.GOAL, "What are your learning goals or what do you hope to achieve?");
        MISSING_TYPE_QUESTIONS.put(FactType.LEARNING_STYLE,
                "How do you prefer to learn? (e.g., visual, hands-on, reading)");
        MISSING_TYPE_QUESTIONS.put(FactType.TOPIC_INTEREST, "What topics or subjects are you most interested in?");
    }

    // Question order for missing types differs from the enum order
    private static final List<FactType> QUESTION_ORDER = List.of(
            FactType.PREFERENCE, FactType.STRUGGLE, FactType.GOAL, FactType.LEARNING_STYLE, FactType.TOPIC_INTEREST);

    /**
     * Analyzes the active facts of one user.
     *
     * @param facts the user's facts; inactive ones are ignored
     * @return missing types, low-coverage subjects and recommended questions
     */
    public KnowledgeGapReport analyze(List<Fact> facts) {
        Set<FactType> presentTypes = EnumSet.noneOf(FactType.class);
        Map<String, Integer> subjectCounts = new LinkedHashMap<>();
        for (Fact fact : facts) {
            if (!fact.active()) {
                continue;
            }
            presentTypes.add(fact.factType());
            if (fact.hasSubject()) {
                subjectCounts.merge(fact.subject(), 1, Integer::sum);
            }
        }

        List<FactType> missingTypes = new ArrayList<>();
        for (FactType type : FactType.values()) {
            if (!presentTypes.contains(type)) {
                missingTypes.add(type);
            }
        }

        List<String> lowCoverageSubjects = new ArrayList<>();
        subjectCounts.forEach((subject, count) -> {
            if (count == 1) {
                lowCoverageSubjects.add(subject);
            }
        });

        List<String> questions = new ArrayList<>();
        for (FactType type : QUESTION_ORDER) {
            if (missingTypes.contains(type)) {
                questions.add(MISSING_TYPE_QUESTIONS.get(type));
            }
        }
        for (String subject : lowCoverageSubjects) {
            questions.add("Can you tell me more about your experience with " + subject + "?");
        }

        return new KnowledgeGapReport(missingTypes, lowCoverageSubjects, questions);
    }
}
