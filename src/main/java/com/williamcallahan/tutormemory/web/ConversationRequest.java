package com.williamcallahan.tutormemory.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Body of a conversation-processing call.
 *
 * @param chatId conversation id recorded on stored facts
 * @param messages conversation turns, oldest first
 * @param model extraction model override, optional
 * @param temperature extraction temperature override, optional
 * @param strategy conflict strategy wire name, optional
 */
public record ConversationRequest(
        String chatId,
        @NotEmpty @Valid List<Turn> messages,
        String model,
        Double temperature,
        String strategy) {

    /**
     * One conversation turn.
     *
     * @param role user, assistant or system
     * @param content turn text
     */
    public record Turn(@NotBlank String role, String content) {}
}
