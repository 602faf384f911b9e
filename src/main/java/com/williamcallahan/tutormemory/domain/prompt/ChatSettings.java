package com.williamcallahan.tutormemory.domain.prompt;

/**
 * Per-chat model settings that shape prompt assembly.
 *
 * @param model model identifier
 * @param promptTemplate base user prompt, always rendered under "User Instructions"
 * @param temperature sampling temperature forwarded to the model call
 * @param contextLength total token budget for the system prompt plus included history
 * @param includeProfileContext whether the user profile section is rendered
 * @param includeWorkspaceInstructions whether workspace instructions are rendered
 */
public record ChatSettings(
        String model,
        String promptTemplate,
        double temperature,
        int contextLength,
        boolean includeProfileContext,
        boolean includeWorkspaceInstructions) {

    /**
     * Creates chat settings.
     *
     * @throws IllegalArgumentException if contextLength is not positive
     */
    public ChatSettings {
        if (contextLength <= 0) {
            throw new IllegalArgumentException("Context length must be a positive integer, got " + contextLength);
        }
        if (promptTemplate == null) {
            promptTemplate = "";
        }
    }
}
