package com.williamcallahan.tutormemory.domain.prompt;

import java.util.List;

/**
 * Final message in the turn-based {@code {role, parts}} representation used by providers
 * that accept only alternating user/model turns.
 *
 * @param role turn role ("user" or "model")
 * @param parts ordered text parts
 */
public record TurnMessage(String role, List<TurnPart> parts) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    public TurnMessage {
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static TurnMessage ofText(String role, String text) {
        return new TurnMessage(role, List.of(new TurnPart(text)));
    }
}
