package com.williamcallahan.tutormemory.domain.prompt;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Final message in the flat {@code {role, content}} representation.
 *
 * <p>Content is either plain text or an ordered list of parts; exactly one of {@code text} and
 * {@code parts} is meaningful, as reported by {@link #isMultiPart()}.</p>
 *
 * @param role provider role name ("system", "user" or "assistant")
 * @param text plain text content, null for multi-part messages
 * @param parts ordered parts, empty for plain text messages
 */
public record AssembledMessage(String role, @JsonIgnore String text, @JsonIgnore List<ContentPart> parts) {

    public AssembledMessage {
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static AssembledMessage ofText(String role, String text) {
        return new AssembledMessage(role, text == null ? "" : text, List.of());
    }

    public static AssembledMessage ofParts(String role, List<ContentPart> parts) {
        return new AssembledMessage(role, null, parts);
    }

    @JsonIgnore
    public boolean isMultiPart() {
        return text == null;
    }

    /**
     * Serialized content: a string for text messages, a part array otherwise.
     *
     * @return content value for JSON output
     */
    @JsonProperty("content")
    public Object content() {
        return isMultiPart() ? parts : text;
    }
}
