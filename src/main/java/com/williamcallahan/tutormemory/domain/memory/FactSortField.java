package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Sortable fact columns.
 */
public enum FactSortField {
    CREATED_AT("created_at"),
    UPDATED_AT("updated_at"),
    CONFIDENCE("confidence");

    private final String wireName;

    FactSortField(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FactSortField fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sort field cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FactSortField field : values()) {
            if (field.wireName.equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + value);
    }
}
