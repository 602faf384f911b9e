package com.williamcallahan.tutormemory.service;

import com.williamcallahan.tutormemory.application.memory.ConflictResolver;
import com.williamcallahan.tutormemory.application.memory.FactBatchImporter;
import com.williamcallahan.tutormemory.application.memory.FactPatternAnalyzer;
import com.williamcallahan.tutormemory.application.memory.KnowledgeGapAnalyzer;
import com.williamcallahan.tutormemory.application.memory.KnowledgeProfileBuilder;
import com.williamcallahan.tutormemory.application.memory.RelevanceScorer;
import com.williamcallahan.tutormemory.config.AppProperties;
import com.williamcallahan.tutormemory.domain.errors.FactNotFoundException;
import com.williamcallahan.tutormemory.domain.memory.BatchImportResult;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactExport;
import com.williamcallahan.tutormemory.domain.memory.FactFeedbackType;
import com.williamcallahan.tutormemory.domain.memory.FactPatternAnalysis;
import com.williamcallahan.tutormemory.domain.memory.FactSearchCriteria;
import com.williamcallahan.tutormemory.domain.memory.FactSearchPage;
import com.williamcallahan.tutormemory.domain.memory.FactSortField;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.FactUpdate;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeGapReport;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeProfile;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import com.williamcallahan.tutormemory.domain.memory.SortDirection;
import com.williamcallahan.tutormemory.repository.FactQuery;
import com.williamcallahan.tutormemory.repository.FactRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The soft-deleted collection of facts about users.
 *
 * <p>Writes go either straight to the repository (manual entry) or through the
 * {@link ConflictResolver}. Reads never return another user's facts. Deactivation keeps the row;
 * only {@link #hardDelete(String)} removes it.</p>
 */
@Service
public class FactStore {

    private static final Logger log = LoggerFactory.getLogger(FactStore.class);

    static final double FEEDBACK_BASELINE_CONFIDENCE = 0.5;

    private final FactRepository repository;
    private final ConflictResolver conflictResolver;
    private final FactBatchImporter batchImporter;
    private final RelevanceScorer relevanceScorer;
    private final KnowledgeGapAnalyzer gapAnalyzer;
    private final KnowledgeProfileBuilder profileBuilder;
    private final FactPatternAnalyzer patternAnalyzer;
    private final AppProperties props;
    private final Clock clock;

    public FactStore(
            FactRepository repository,
            ConflictResolver conflictResolver,
            FactBatchImporter batchImporter,
            RelevanceScorer relevanceScorer,
            KnowledgeGapAnalyzer gapAnalyzer,
            KnowledgeProfileBuilder profileBuilder,
            FactPatternAnalyzer patternAnalyzer,
            AppProperties props,
            Clock clock) {
        this.repository = repository;
        this.conflictResolver = conflictResolver;
        this.batchImporter = batchImporter;
        this.relevanceScorer = relevanceScorer;
        this.gapAnalyzer = gapAnalyzer;
        this.profileBuilder = profileBuilder;
        this.patternAnalyzer = patternAnalyzer;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Stores a fact as entered, without looking for conflicts.
     *
     * @param userId owning user
     * @param newFact fact content
     * @return stored fact
     * @throws IllegalArgumentException if details are empty or confidence is out of range
     */
    public Fact create(String userId, NewFact newFact) {
        Instant now = clock.instant();
        Fact stored = repository.insert(new Fact(null, userId, newFact.chatId(), newFact.sourceMessageId(),
                newFact.factType(), newFact.subject(), newFact.details(), newFact.confidence(), newFact.active(),
                newFact.tags(), now, now));
        log.info("Stored {} fact {} for user {}", stored.factType().wireName(), stored.id(), userId);
        return stored;
    }

    /**
     * Stores a fact through conflict resolution.
     *
     * @param userId owning user
     * @param newFact candidate fact
     * @param strategy conflict strategy; null selects the configured default
     * @return resolution outcome
     */
    public ConflictResolution store(String userId, NewFact newFact, ConflictStrategy strategy) {
        ConflictStrategy effective = strategy == null ? props.getMemory().defaultStrategy() : strategy;
        ConflictResolution resolution = conflictResolver.resolve(userId, newFact, effective);
        log.info("Resolved {} fact for user {}: {}", newFact.factType().wireName(), userId,
                resolution.action().wireName());
        return resolution;
    }

    public Fact getById(String factId) {
        requireId(factId, "lookup");
        return repository.findById(factId).orElseThrow(() -> new FactNotFoundException(factId));
    }

    /**
     * Applies a partial update; null fields keep their current value.
     *
     * @param factId fact to update
     * @param update replacement values
     * @return updated fact
     */
    public Fact update(String factId, FactUpdate update) {
        requireId(factId, "updates");
        Fact current = repository.findById(factId).orElseThrow(() -> new FactNotFoundException(factId));
        Fact updated = new Fact(
                current.id(),
                current.userId(),
                current.chatId(),
                current.sourceMessageId(),
                update.factType() != null ? update.factType() : current.factType(),
                update.subject() != null ? update.subject() : current.subject(),
                update.details() != null ? update.details() : current.details(),
                update.confidence() != null ? update.confidence() : current.confidence(),
                update.active() != null ? update.active() : current.active(),
                update.tags() != null ? update.tags() : current.tags(),
                current.createdAt(),
                clock.instant());
        Fact stored = repository.update(updated);
        log.info("Updated fact {}", factId);
        return stored;
    }

    public Fact deactivate(String factId) {
        requireId(factId, "deactivation");
        Fact current = repository.findById(factId).orElseThrow(() -> new FactNotFoundException(factId));
        Fact stored = repository.update(current.withActive(false, clock.instant()));
        log.info("Deactivated fact {}", factId);
        return stored;
    }

    /**
     * Permanently removes a fact.
     *
     * @throws FactNotFoundException if no fact has the id
     */
    public void hardDelete(String factId) {
        requireId(factId, "deletion");
        if (!repository.delete(factId)) {
            throw new FactNotFoundException(factId);
        }
        log.info("Deleted fact {}", factId);
    }

    /**
     * Filters, sorts and pages a user's facts.
     *
     * <p>Every whitespace-separated query term must appear, ignoring case, in the details or the
     * subject. A minimum confidence excludes facts without a confidence. Facts without a value for
     * the sort field always sort last.</p>
     *
     * @param userId owning user
     * @param criteria filters, sort and page
     * @return page of facts with the total match count
     */
    public FactSearchPage search(String userId, FactSearchCriteria criteria) {
        FactQuery query = new FactQuery(userId, criteria.includeInactive(), criteria.factTypes(), false, null);
        List<String> terms = searchTerms(criteria.query());

        List<Fact> matches = new ArrayList<>();
        for (Fact fact : repository.find(query)) {
            if (matchesCriteria(fact, criteria, terms)) {
                matches.add(fact);
            }
        }
        matches.sort(sortOrder(criteria.sortBy(), criteria.sortDirection()));

        int total = matches.size();
        int from = Math.min(criteria.offset(), total);
        int to = (int) Math.min((long) criteria.offset() + criteria.limit(), total);
        boolean hasMore = (long) criteria.offset() + criteria.limit() < total;
        return new FactSearchPage(matches.subList(from, to), total, hasMore);
    }

    /**
     * Replaces the tag set of a fact.
     */
    public Fact updateTags(String factId, Collection<String> tags) {
        requireId(factId, "tag updates");
        Fact current = repository.findById(factId).orElseThrow(() -> new FactNotFoundException(factId));
        Set<String> replacement = tags == null ? Set.of() : new LinkedHashSet<>(tags);
        Fact stored = repository.update(current.withTags(replacement, clock.instant()));
        log.info("Updated tags for fact {}", factId);
        return stored;
    }

    /**
     * Distinct tags across a user's active facts, in first-seen order.
     */
    public List<String> allTags(String userId) {
        Set<String> tags = new LinkedHashSet<>();
        for (Fact fact : repository.find(FactQuery.activeFor(userId))) {
            tags.addAll(fact.tags());
        }
        return List.copyOf(tags);
    }

    /**
     * Active facts carrying any (or all) of the given tags.
     *
     * @throws IllegalArgumentException if no tag is given
     */
    public List<Fact> factsByTags(String userId, Collection<String> tags, boolean matchAll) {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("At least one tag must be specified");
        }
        return repository.find(FactQuery.activeFor(userId)).stream()
                .filter(fact -> matchAll
                        ? fact.tags().containsAll(tags)
                        : tags.stream().anyMatch(fact.tags()::contains))
                .toList();
    }

    /**
     * Facts most relevant to a free-text context.
     *
     * @param userId owning user
     * @param context query text
     * @param limit maximum number of facts
     * @param includeInactive whether inactive facts are eligible
     * @param factTypes eligible types, empty for all
     * @return ranked facts
     */
    public List<Fact> relevantFacts(
            String userId, String context, int limit, boolean includeInactive, Set<FactType> factTypes) {
        FactQuery query = includeInactive ? FactQuery.allFor(userId) : FactQuery.activeFor(userId);
        return relevanceScorer.rank(repository.find(query), context, limit, includeInactive, factTypes);
    }

    public KnowledgeGapReport knowledgeGaps(String userId) {
        return gapAnalyzer.analyze(repository.find(FactQuery.activeFor(userId)));
    }

    public KnowledgeProfile knowledgeProfile(String userId) {
        return knowledgeProfile(userId, props.getMemory().getMaxFactsPerType());
    }

    public KnowledgeProfile knowledgeProfile(String userId, int maxFactsPerType) {
        Duration window = Duration.ofDays(props.getMemory().getRecentSubjectWindowDays());
        return profileBuilder.build(repository.find(FactQuery.activeFor(userId)), maxFactsPerType, window);
    }

    public FactPatternAnalysis analyzePatterns(String userId) {
        return patternAnalyzer.analyze(repository.find(FactQuery.activeFor(userId)));
    }

    /**
     * Active facts, most recently updated first, optionally narrowed by subject and types.
     */
    public List<Fact> recentFacts(String userId, String subject, Set<FactType> factTypes, int maxFacts) {
        FactQuery query = FactQuery.activeFor(userId).withFactTypes(factTypes);
        if (subject != null && !subject.isBlank()) {
            query = query.withSubject(subject);
        }
        return repository.find(query).stream()
                .sorted(sortOrder(FactSortField.UPDATED_AT, SortDirection.DESC))
                .limit(Math.max(maxFacts, 0))
                .toList();
    }

    /**
     * Active facts grouped under their type name and, when they have a subject, also under
     * {@code type:subject}. Groups list the most recently updated facts first.
     */
    public Map<String, List<Fact>> groupedFacts(String userId) {
        Map<String, List<Fact>> grouped = new LinkedHashMap<>();
        List<Fact> facts = repository.find(FactQuery.activeFor(userId)).stream()
                .sorted(sortOrder(FactSortField.UPDATED_AT, SortDirection.DESC))
                .toList();
        for (Fact fact : facts) {
            String type = fact.factType().wireName();
            grouped.computeIfAbsent(type, key -> new ArrayList<>()).add(fact);
            if (fact.hasSubject()) {
                grouped.computeIfAbsent(type + ":" + fact.subject(), key -> new ArrayList<>()).add(fact);
            }
        }
        return grouped;
    }

    /**
     * Exports a user's facts with count metadata.
     */
    public FactExport export(String userId, boolean includeInactive) {
        List<Fact> facts = repository.find(includeInactive ? FactQuery.allFor(userId) : FactQuery.activeFor(userId));
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (Fact fact : facts) {
            typeCounts.merge(fact.factType().wireName(), 1, Integer::sum);
        }
        log.info("Exported {} facts for user {}", facts.size(), userId);
        return new FactExport(facts,
                new FactExport.Metadata(clock.instant(), facts.size(), typeCounts, FactExport.FORMAT_VERSION));
    }

    /**
     * Imports an export into a user's facts. Ids, owners, chats and timestamps of the exported
     * facts are discarded.
     *
     * @param userId receiving user
     * @param export exported facts
     * @param strategy conflict strategy; null selects the configured import default
     * @return import counts and per-item errors
     * @throws IllegalArgumentException if the export has no facts list
     */
    public BatchImportResult importFacts(String userId, FactExport export, ConflictStrategy strategy) {
        if (export == null || export.facts() == null) {
            throw new IllegalArgumentException("Invalid import data: facts array is required");
        }
        List<NewFact> candidates = export.facts().stream()
                .map(fact -> new NewFact(null, fact.sourceMessageId(), fact.factType(), fact.subject(),
                        fact.details(), fact.confidence(), fact.active(), fact.tags()))
                .toList();
        return batchImport(userId, null, candidates,
                strategy == null ? props.getMemory().importStrategy() : strategy);
    }

    /**
     * Imports candidates sequentially through conflict resolution.
     */
    public BatchImportResult batchImport(
            String userId, String chatId, List<NewFact> candidates, ConflictStrategy strategy) {
        ConflictStrategy effective = strategy == null ? props.getMemory().defaultStrategy() : strategy;
        return batchImporter.importFacts(userId, chatId, candidates, effective);
    }

    /**
     * Adjusts a fact's confidence from user feedback, clamped to [0, 1].
     *
     * @param userId user giving feedback; must own the fact
     * @param factId fact id
     * @param feedback feedback kind
     * @return updated fact
     * @throws FactNotFoundException if the fact does not exist or belongs to another user
     */
    public Fact applyFeedback(String userId, String factId, FactFeedbackType feedback) {
        requireId(factId, "feedback");
        Fact current = repository.findById(factId)
                .filter(fact -> fact.userId().equals(userId))
                .orElseThrow(() -> new FactNotFoundException(factId));
        double baseline = current.confidence() == null ? FEEDBACK_BASELINE_CONFIDENCE : current.confidence();
        double adjusted = Math.max(0.0, Math.min(1.0, baseline + feedback.confidenceDelta()));
        Fact stored = repository.update(current.withConfidence(adjusted, clock.instant()));
        log.info("Applied {} feedback to fact {} (confidence {} -> {})",
                feedback.wireName(), factId, current.confidence(), adjusted);
        return stored;
    }

    private static void requireId(String factId, String operation) {
        if (factId == null || factId.isBlank()) {
            throw new IllegalArgumentException("Fact ID is required for " + operation + ".");
        }
    }

    private static List<String> searchTerms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String term : query.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static boolean matchesCriteria(Fact fact, FactSearchCriteria criteria, List<String> terms) {
        if (!criteria.subjects().isEmpty() && (fact.subject() == null || !criteria.subjects().contains(fact.subject()))) {
            return false;
        }
        if (criteria.fromDate() != null && (fact.createdAt() == null || fact.createdAt().isBefore(criteria.fromDate()))) {
            return false;
        }
        if (criteria.toDate() != null && (fact.createdAt() == null || fact.createdAt().isAfter(criteria.toDate()))) {
            return false;
        }
        if (criteria.minConfidence() != null
                && (fact.confidence() == null || fact.confidence() < criteria.minConfidence())) {
            return false;
        }
        String details = fact.details().toLowerCase(Locale.ROOT);
        String subject = fact.subject() == null ? "" : fact.subject().toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (!details.contains(term) && !subject.contains(term)) {
                return false;
            }
        }
        return true;
    }

    private static Comparator<Fact> sortOrder(FactSortField field, SortDirection direction) {
        return switch (field) {
            case CREATED_AT -> nullsLast(Fact::createdAt, direction);
            case UPDATED_AT -> nullsLast(Fact::updatedAt, direction);
            case CONFIDENCE -> nullsLast(Fact::confidence, direction);
        };
    }

    private static <T extends Comparable<? super T>> Comparator<Fact> nullsLast(
            Function<Fact, T> key, SortDirection direction) {
        Comparator<T> natural = Comparator.naturalOrder();
        Comparator<T> ordered = direction == SortDirection.ASC ? natural : natural.reversed();
        return Comparator.comparing(key, Comparator.nullsLast(ordered));
    }
}
