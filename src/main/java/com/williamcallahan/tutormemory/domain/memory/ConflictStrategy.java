package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.williamcallahan.tutormemory.domain.errors.UnsupportedConflictStrategyException;
import java.util.Locale;

/**
 * Policy governing how a candidate fact interacts with active facts of the same type and subject.
 */
public enum ConflictStrategy {
    /** Deactivate every match and store the candidate. */
    PREFER_NEW("prefer_new"),
    /** Replace matches only when the candidate is strictly more confident. */
    PREFER_HIGH_CONFIDENCE("prefer_high_confidence"),
    /** Fold the candidate into the most recently updated match. */
    MERGE("merge"),
    /** Batch import only: drop the candidate when any match exists. */
    SKIP_DUPLICATES("skip_duplicates");

    private final String wireName;

    ConflictStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a strategy name. Unknown names are configuration errors, not data errors.
     *
     * @throws UnsupportedConflictStrategyException if the name is unknown
     */
    @JsonCreator
    public static ConflictStrategy fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ConflictStrategy strategy : values()) {
                if (strategy.wireName.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new UnsupportedConflictStrategyException("Unknown conflict resolution strategy: " + value);
    }
}
