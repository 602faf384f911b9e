package com.williamcallahan.tutormemory.service.extraction;

import com.williamcallahan.tutormemory.domain.memory.ExtractedFact;
import java.util.List;

/**
 * Opaque model call that proposes candidate facts from conversation text.
 *
 * <p>Implementations may throw on transport or parsing failures; callers that must not fail
 * go through {@link com.williamcallahan.tutormemory.service.FactExtractionService}.</p>
 */
public interface FactExtractionClient {

    /**
     * Extracts candidate facts.
     *
     * @param conversationText rendered conversation, one {@code role: content} line per message
     * @param modelConfig model settings for this call
     * @return candidate facts, possibly empty
     */
    List<ExtractedFact> extract(String conversationText, FactExtractionModelConfig modelConfig);

    /**
     * Whether the client has the credentials it needs to make calls.
     */
    boolean isAvailable();
}
