package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.MessageImage;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Body of a prompt assembly call.
 *
 * <p>When {@code profileContext} is absent and {@code userId} is given, the profile context is
 * built from the user's stored facts and conversation memories.</p>
 *
 * @param payload chat payload
 * @param userId user whose memory feeds the profile context, optional
 * @param profileContext explicit profile context, optional
 * @param images resolved image data for the flat format, optional
 */
public record PromptRequest(
        @NotNull ChatPayload payload,
        String userId,
        String profileContext,
        List<MessageImage> images) {

    public PromptRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
