package com.williamcallahan.tutormemory.application.memory;

import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Keyword-overlap relevance of facts to a free-text query.
 *
 * <p>Scoring is independent of the vector index and uses only the fact's own text.</p>
 */
@Component
public class RelevanceScorer {

    static final int MIN_TERM_LENGTH = 4;
    static final double SUBJECT_TERM_WEIGHT = 5.0;
    static final double DETAILS_TERM_WEIGHT = 2.0;
    static final double PHRASE_MATCH_BONUS = 10.0;
    static final double CONTEXTUAL_TYPE_BONUS = 2.0;

    private static final Set<FactType> CONTEXTUAL_TYPES = Set.of(FactType.TOPIC_INTEREST, FactType.PREFERENCE);

    /**
     * Scores a fact against a query.
     *
     * <p>Each query term longer than three characters adds 5 when found in the subject and 2
     * when found in the details. The whole query found in the details adds 10 once. Topic
     * interests and preferences get a flat 2, and a present confidence is added as is.</p>
     *
     * @param fact fact to score
     * @param query free-text query
     * @return non-negative score
     */
    public double score(Fact fact, String query) {
        String lowerQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        String lowerSubject = fact.subject() == null ? "" : fact.subject().toLowerCase(Locale.ROOT);
        String lowerDetails = fact.details().toLowerCase(Locale.ROOT);

        double score = 0.0;
        for (String term : queryTerms(lowerQuery)) {
            if (lowerSubject.contains(term)) {
                score += SUBJECT_TERM_WEIGHT;
            }
            if (lowerDetails.contains(term)) {
                score += DETAILS_TERM_WEIGHT;
            }
        }

        if (!lowerQuery.isBlank() && lowerDetails.contains(lowerQuery)) {
            score += PHRASE_MATCH_BONUS;
        }
        if (CONTEXTUAL_TYPES.contains(fact.factType())) {
            score += CONTEXTUAL_TYPE_BONUS;
        }
        if (fact.confidence() != null) {
            score += fact.confidence();
        }
        return score;
    }

    /**
     * Ranks candidate facts by relevance.
     *
     * <p>The sort is stable: facts with equal scores keep their input order.</p>
     *
     * @param candidates facts to rank
     * @param query free-text query
     * @param limit maximum number of facts returned
     * @param includeInactive whether inactive facts are eligible
     * @param factTypes eligible types, empty for all
     * @return ranked facts, most relevant first
     */
    public List<Fact> rank(
            List<Fact> candidates, String query, int limit, boolean includeInactive, Set<FactType> factTypes) {
        List<ScoredFact> scored = new ArrayList<>();
        for (Fact fact : candidates) {
            if (!includeInactive && !fact.active()) {
                continue;
            }
            if (factTypes != null && !factTypes.isEmpty() && !factTypes.contains(fact.factType())) {
                continue;
            }
            scored.add(new ScoredFact(fact, score(fact, query)));
        }
        scored.sort(Comparator.comparingDouble(ScoredFact::score).reversed());
        return scored.stream()
                .limit(Math.max(limit, 0))
                .map(ScoredFact::fact)
                .toList();
    }

    static List<String> queryTerms(String lowerQuery) {
        List<String> terms = new ArrayList<>();
        for (String term : lowerQuery.split("\\s+")) {
            if (term.length() >= MIN_TERM_LENGTH) {
                terms.add(term);
            }
        }
        return terms;
    }

    private record ScoredFact(Fact fact, double score) {
    }
}
