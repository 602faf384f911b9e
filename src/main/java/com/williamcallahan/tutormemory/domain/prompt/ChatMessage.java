package com.williamcallahan.tutormemory.domain.prompt;

import java.time.Instant;
import java.util.List;

/**
 * A persisted conversation message as loaded for prompt assembly.
 *
 * <p>Messages are immutable. Retrieval injection produces augmented copies through
 * {@link #withContent(String)}; those copies live only for the duration of one assembly
 * and are never written back.</p>
 *
 * @param id message identifier
 * @param sequenceNumber position of the message within its chat
 * @param role participant role
 * @param content message text
 * @param createdAt creation time, may be null for transient messages
 * @param imagePaths ordered image references (storage paths or data URIs)
 * @param attachedSourceIds ids of chat-level source items referenced by this message
 */
public record ChatMessage(
        String id,
        int sequenceNumber,
        MessageRole role,
        String content,
        Instant createdAt,
        List<String> imagePaths,
        List<String> attachedSourceIds) {

    /**
     * Creates a chat message with defensive copies of list fields.
     *
     * @throws IllegalArgumentException if id or role is null
     */
    public ChatMessage {
        if (id == null) {
            throw new IllegalArgumentException("Message id cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("Message role cannot be null");
        }
        if (content == null) {
            content = "";
        }
        imagePaths = imagePaths == null ? List.of() : List.copyOf(imagePaths);
        attachedSourceIds = attachedSourceIds == null ? List.of() : List.copyOf(attachedSourceIds);
    }

    /**
     * Creates a text-only message with no images or attached sources.
     */
    public static ChatMessage text(String id, int sequenceNumber, MessageRole role, String content) {
        return new ChatMessage(id, sequenceNumber, role, content, null, List.of(), List.of());
    }

    /**
     * Returns a copy of this message carrying replacement content.
     *
     * @param newContent replacement text
     * @return augmented copy
     */
    public ChatMessage withContent(String newContent) {
        return new ChatMessage(id, sequenceNumber, role, newContent, createdAt, imagePaths, attachedSourceIds);
    }

    public boolean hasImages() {
        return !imagePaths.isEmpty();
    }
}
