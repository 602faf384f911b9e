package com.williamcallahan.tutormemory.application.memory;

import com.williamcallahan.tutormemory.domain.errors.UnsupportedConflictStrategyException;
import com.williamcallahan.tutormemory.domain.memory.BatchImportResult;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Imports candidate facts one at a time as a fold over {@link BatchImportResult}.
 *
 * <p>Each candidate is resolved against the store as left by the previous candidates of the
 * same batch. Invalid candidates and per-item failures are recorded and the batch continues;
 * only a missing strategy aborts the import, before any candidate is processed.</p>
 */
@Service
public class FactBatchImporter {

    private static final Logger log = LoggerFactory.getLogger(FactBatchImporter.class);

    static final String MISSING_DETAILS_ERROR = "Fact details missing or empty";
    static final String MISSING_FACT_ERROR = "Fact entry missing";

    private final ConflictResolver conflictResolver;

    public FactBatchImporter(ConflictResolver conflictResolver) {
        this.conflictResolver = conflictResolver;
    }

    /**
     * Imports a batch of candidates for one user.
     *
     * @param userId owning user
     * @param chatId chat id applied to every candidate, or null to keep each candidate's own
     * @param candidates candidates in import order
     * @param strategy conflict strategy, including {@code skip_duplicates}
     * @return counts of imported, updated and skipped candidates plus per-item errors
     */
    public BatchImportResult importFacts(
            String userId, String chatId, List<NewFact> candidates, ConflictStrategy strategy) {
        if (strategy == null) {
            throw new UnsupportedConflictStrategyException("Unknown conflict resolution strategy: null");
        }

        BatchImportResult result = BatchImportResult.empty();
        for (NewFact candidate : candidates) {
            result = importOne(userId, chatId, candidate, strategy, result);
        }

        log.info("Imported facts for user {} with strategy {}: {} imported, {} updated, {} skipped, {} errors",
                userId, strategy.wireName(), result.imported(), result.updated(), result.skipped(),
                result.errors().size());
        return result;
    }

    private BatchImportResult importOne(
            String userId, String chatId, NewFact candidate, ConflictStrategy strategy, BatchImportResult result) {
        if (candidate == null) {
            return result.plusError(null, MISSING_FACT_ERROR);
        }
        NewFact scoped = chatId == null ? candidate : candidate.withChatId(chatId);
        if (!scoped.hasDetails()) {
            return result.plusError(scoped, MISSING_DETAILS_ERROR);
        }
        try {
            ConflictResolution resolution = conflictResolver.resolveForImport(userId, scoped, strategy);
            return result.plus(resolution.action());
        } catch (RuntimeException e) {
            log.warn("Error importing fact of type {} for user {}: {}",
                    scoped.factType().wireName(), userId, e.getMessage());
            return result.plusError(scoped, e.getMessage());
        }
    }
}
