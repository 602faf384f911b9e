package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * User feedback on a stored fact and the confidence adjustment it implies.
 */
public enum FactFeedbackType {
    CORRECT(0.1),
    INCORRECT(-0.2),
    OUTDATED(-0.1);

    private final double confidenceDelta;

    FactFeedbackType(double confidenceDelta) {
        this.confidenceDelta = confidenceDelta;
    }

    public double confidenceDelta() {
        return confidenceDelta;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FactFeedbackType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Feedback type cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            throw new IllegalArgumentException("Unknown feedback type: " + value, unknown);
        }
    }
}
