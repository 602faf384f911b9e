package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Category of an atomic fact inferred about a student.
 */
public enum FactType {
    PREFERENCE("preference"),
    STRUGGLE("struggle"),
    GOAL("goal"),
    TOPIC_INTEREST("topic_interest"),
    LEARNING_STYLE("learning_style"),
    OTHER("other");

    private final String wireName;

    FactType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a fact type from its snake_case wire name (case-insensitive).
     *
     * @throws IllegalArgumentException if the value names no known fact type
     */
    @JsonCreator
    public static FactType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Fact type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FactType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown fact type: " + value);
    }
}
