package com.williamcallahan.tutormemory.domain.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SortDirection fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sort direction cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
