package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Terminal state of a candidate fact after conflict resolution.
 */
public enum ConflictAction {
    ADDED,
    UPDATED,
    MERGED,
    IGNORED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
