package com.williamcallahan.tutormemory.domain.prompt;

/**
 * Retrieved text snippet eligible for injection into a message as grounding context.
 *
 * @param id source identifier, matched against {@link ChatMessage#attachedSourceIds()}
 * @param content snippet text
 */
public record SourceItem(String id, String content) {

    /**
     * Creates a source item.
     *
     * @throws IllegalArgumentException if id is null
     */
    public SourceItem {
        if (id == null) {
            throw new IllegalArgumentException("Source id cannot be null");
        }
        if (content == null) {
            content = "";
        }
    }
}
