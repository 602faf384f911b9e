package com.williamcallahan.tutormemory.domain.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated counts of a batch import. Instances are immutable; each processed candidate
 * yields a new accumulator.
 *
 * @param imported candidates stored as new facts
 * @param skipped candidates dropped (duplicates, ignored, invalid or failed)
 * @param updated candidates that replaced or merged into existing facts
 * @param errors per-item failures, in processing order
 */
public record BatchImportResult(int imported, int skipped, int updated, List<FactImportError> errors) {

    public BatchImportResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchImportResult empty() {
        return new BatchImportResult(0, 0, 0, List.of());
    }

    public BatchImportResult plusImported() {
        return new BatchImportResult(imported + 1, skipped, updated, errors);
    }

    public BatchImportResult plusUpdated() {
        return new BatchImportResult(imported, skipped, updated + 1, errors);
    }

    public BatchImportResult plusSkipped() {
        return new BatchImportResult(imported, skipped + 1, updated, errors);
    }

    /**
     * Records a skipped candidate together with the reason it was skipped.
     */
    public BatchImportResult plusError(NewFact fact, String reason) {
        List<FactImportError> nextErrors = new ArrayList<>(errors);
        nextErrors.add(new FactImportError(fact, reason));
        return new BatchImportResult(imported, skipped + 1, updated, nextErrors);
    }

    /**
     * Folds a conflict resolution outcome into the counts.
     */
    public BatchImportResult plus(ConflictAction action) {
        return switch (action) {
            case ADDED -> plusImported();
            case UPDATED, MERGED -> plusUpdated();
            case IGNORED -> plusSkipped();
        };
    }

    public int processed() {
        return imported + skipped + updated;
    }
}
