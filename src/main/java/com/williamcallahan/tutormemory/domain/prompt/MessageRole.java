package com.williamcallahan.tutormemory.domain.prompt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Participant role of a stored chat message.
 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a role from its lowercase wire name.
     *
     * @throws IllegalArgumentException if the value names no known role
     */
    @JsonCreator
    public static MessageRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageRole role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role: " + value);
    }
}
