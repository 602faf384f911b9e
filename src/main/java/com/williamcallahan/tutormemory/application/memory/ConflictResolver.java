package com.williamcallahan.tutormemory.application.memory;

import com.google.common.util.concurrent.Striped;
import com.williamcallahan.tutormemory.domain.errors.FactPersistenceException;
import com.williamcallahan.tutormemory.domain.errors.UnsupportedConflictStrategyException;
import com.williamcallahan.tutormemory.domain.memory.ConflictAction;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import com.williamcallahan.tutormemory.repository.FactQuery;
import com.williamcallahan.tutormemory.repository.FactRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Consolidates a candidate fact with the user's active facts of the same type and subject.
 *
 * <p>Outcomes per strategy, when at least one active match exists:</p>
 * <ul>
 *   <li>{@code prefer_new}: every match is deactivated and the candidate stored ({@code updated})</li>
 *   <li>{@code prefer_high_confidence}: as {@code prefer_new} when the candidate is strictly more
 *       confident than the best match, otherwise the candidate is dropped ({@code ignored})</li>
 *   <li>{@code merge}: the most recently updated match absorbs the candidate's details
 *       ({@code merged})</li>
 * </ul>
 * <p>Without matches the candidate is stored ({@code added}) regardless of strategy.</p>
 *
 * <p>Resolution for one (user, type, subject) key is serialized through striped locks, so two
 * concurrent candidates for the same key never both observe "no match".</p>
 */
@Service
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final String MERGE_SEPARATOR = " (Updated: ";

    private final FactRepository repository;
    private final Striped<Lock> keyLocks;
    private final Clock clock;

    public ConflictResolver(FactRepository repository, Striped<Lock> factKeyLocks, Clock clock) {
        this.repository = repository;
        this.keyLocks = factKeyLocks;
        this.clock = clock;
    }

    /**
     * Resolves a candidate with one of the interactive strategies.
     *
     * @param userId owning user
     * @param candidate candidate fact
     * @param strategy {@code prefer_new}, {@code prefer_high_confidence} or {@code merge}
     * @return action taken, the matches seen and the stored or merged fact
     * @throws UnsupportedConflictStrategyException for a missing strategy or {@code skip_duplicates}
     */
    public ConflictResolution resolve(String userId, NewFact candidate, ConflictStrategy strategy) {
        if (strategy == null) {
            throw new UnsupportedConflictStrategyException("Unknown conflict resolution strategy: null");
        }
        if (strategy == ConflictStrategy.SKIP_DUPLICATES) {
            throw new UnsupportedConflictStrategyException(
                    "Conflict resolution strategy skip_duplicates is only supported for batch import");
        }
        return resolveLocked(userId, candidate, strategy);
    }

    /**
     * Resolves a candidate during batch import, where {@code skip_duplicates} is also accepted.
     *
     * @param userId owning user
     * @param candidate candidate fact
     * @param strategy any strategy
     * @return resolution; a skipped duplicate is reported as {@code ignored}
     */
    public ConflictResolution resolveForImport(String userId, NewFact candidate, ConflictStrategy strategy) {
        if (strategy == null) {
            throw new UnsupportedConflictStrategyException("Unknown conflict resolution strategy: null");
        }
        return resolveLocked(userId, candidate, strategy);
    }

    /**
     * Decides the outcome for a candidate against its active matches without touching storage.
     *
     * @param candidate candidate fact
     * @param matches active facts with the same user, type and subject
     * @param strategy conflict strategy
     * @return action that {@link #resolve} would take
     */
    public static ConflictAction decide(NewFact candidate, List<Fact> matches, ConflictStrategy strategy) {
        if (matches.isEmpty()) {
            return ConflictAction.ADDED;
        }
        return switch (strategy) {
            case PREFER_NEW -> ConflictAction.UPDATED;
            case PREFER_HIGH_CONFIDENCE -> candidate.confidenceOrZero() > highestConfidence(matches)
                    ? ConflictAction.UPDATED
                    : ConflictAction.IGNORED;
            case MERGE -> ConflictAction.MERGED;
            case SKIP_DUPLICATES -> ConflictAction.IGNORED;
        };
    }

    /**
     * Merged details for a candidate folded into an existing fact.
     */
    public static String mergeDetails(String existingDetails, String candidateDetails) {
        return existingDetails + MERGE_SEPARATOR + candidateDetails + ")";
    }

    /**
     * Larger of two optional confidences; null only when both are null.
     */
    static Double mergeConfidence(Double existing, Double candidate) {
        if (existing == null) {
            return candidate;
        }
        if (candidate == null) {
            return existing;
        }
        return Math.max(existing, candidate);
    }

    private ConflictResolution resolveLocked(String userId, NewFact candidate, ConflictStrategy strategy) {
        Lock lock = keyLocks.get(lockKey(userId, candidate));
        lock.lock();
        try {
            List<Fact> matches = repository.find(
                    FactQuery.activeMatches(userId, candidate.factType(), candidate.subject()));
            ConflictAction action = decide(candidate, matches, strategy);
            if (!matches.isEmpty()) {
                log.debug("Found {} conflicting facts for {}/{}, strategy {}",
                        matches.size(), candidate.factType().wireName(), candidate.subject(), strategy.wireName());
            }

            Instant now = clock.instant();
            return switch (action) {
                case ADDED -> new ConflictResolution(action, List.of(), insert(userId, candidate, now));
                case UPDATED -> {
                    deactivateAll(matches, now);
                    yield new ConflictResolution(action, matches, insert(userId, candidate, now));
                }
                case MERGED -> new ConflictResolution(action, matches, merge(candidate, matches, now));
                case IGNORED -> new ConflictResolution(action, matches, null);
            };
        } finally {
            lock.unlock();
        }
    }

    private Fact insert(String userId, NewFact candidate, Instant now) {
        Fact fact = new Fact(null, userId, candidate.chatId(), candidate.sourceMessageId(), candidate.factType(),
                candidate.subject(), candidate.details(), candidate.confidence(), candidate.active(),
                candidate.tags(), now, now);
        return repository.insert(fact);
    }

    private void deactivateAll(List<Fact> matches, Instant now) {
        for (Fact match : matches) {
            repository.update(match.withActive(false, now));
        }
    }

    private Fact merge(NewFact candidate, List<Fact> matches, Instant now) {
        Fact target = matches.stream()
                .max(Comparator.comparing(ConflictResolver::recency))
                .orElseThrow();
        if (target.id() == null) {
            throw new FactPersistenceException("Cannot merge with fact that has no ID");
        }
        Fact merged = target.withDetailsAndConfidence(
                mergeDetails(target.details(), candidate.details()),
                mergeConfidence(target.confidence(), candidate.confidence()),
                now);
        return repository.update(merged);
    }

    private static Instant recency(Fact fact) {
        return fact.lastTouched() == null ? Instant.EPOCH : fact.lastTouched();
    }

    private static double highestConfidence(List<Fact> matches) {
        double highest = 0.0;
        for (Fact match : matches) {
            highest = Math.max(highest, match.confidenceOrZero());
        }
        return highest;
    }

    private static String lockKey(String userId, NewFact candidate) {
        return userId + "|" + candidate.factType().wireName() + "|" + FactQuery.normalizeSubject(candidate.subject());
    }
}
