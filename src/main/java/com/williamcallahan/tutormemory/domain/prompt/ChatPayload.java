package com.williamcallahan.tutormemory.domain.prompt;

import java.util.List;

/**
 * Everything needed to assemble the message list for one model call.
 *
 * @param settings chat settings including the token budget
 * @param workspaceInstructions workspace-level system instructions
 * @param adminPrompt optional admin instructions, highest precedence
 * @param studentSystemPrompt optional instructions applied to all student interactions
 * @param assistant optional assistant persona
 * @param messages conversation ordered oldest to newest
 * @param messageLevelSources sources retrieved for the newest message
 * @param chatLevelSources sources attached to the chat and referenced by individual messages
 */
public record ChatPayload(
        ChatSettings settings,
        String workspaceInstructions,
        String adminPrompt,
        String studentSystemPrompt,
        AssistantIdentity assistant,
        List<ChatMessage> messages,
        List<SourceItem> messageLevelSources,
        List<SourceItem> chatLevelSources) {

    /**
     * Creates a chat payload with defensive copies of list fields.
     *
     * @throws IllegalArgumentException if settings is null
     */
    public ChatPayload {
        if (settings == null) {
            throw new IllegalArgumentException("Chat settings cannot be null");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
        messageLevelSources = messageLevelSources == null ? List.of() : List.copyOf(messageLevelSources);
        chatLevelSources = chatLevelSources == null ? List.of() : List.copyOf(chatLevelSources);
    }
}
