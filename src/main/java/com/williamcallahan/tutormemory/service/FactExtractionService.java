package com.williamcallahan.tutormemory.service;

import com.williamcallahan.tutormemory.domain.memory.ExtractedFact;
import com.williamcallahan.tutormemory.service.extraction.FactExtractionClient;
import com.williamcallahan.tutormemory.service.extraction.FactExtractionModelConfig;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;

/**
 * Runs fact extraction over a conversation and never fails the caller.
 *
 * <p>Any client failure, including malformed model output, is logged and reported as an
 * empty candidate list.</p>
 */
@Service
public class FactExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FactExtractionService.class);

    private final FactExtractionClient extractionClient;

    public FactExtractionService(FactExtractionClient extractionClient) {
        this.extractionClient = extractionClient;
    }

    /**
     * Extracts candidate facts from conversation messages.
     *
     * @param messages conversation, oldest first
     * @param modelConfig model settings
     * @return candidate facts, empty on any failure
     */
    public List<ExtractedFact> extract(List<Message> messages, FactExtractionModelConfig modelConfig) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        return extract(renderConversation(messages), modelConfig);
    }

    /**
     * Extracts candidate facts from already-rendered conversation text.
     */
    public List<ExtractedFact> extract(String conversationText, FactExtractionModelConfig modelConfig) {
        if (conversationText == null || conversationText.isBlank()) {
            return List.of();
        }
        try {
            List<ExtractedFact> facts = extractionClient.extract(
                    conversationText, modelConfig == null ? FactExtractionModelConfig.defaults() : modelConfig);
            if (facts == null) {
                return List.of();
            }
            log.debug("Extracted {} candidate facts", facts.size());
            return facts;
        } catch (RuntimeException e) {
            log.warn("Fact extraction failed; continuing without extracted facts: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Renders messages as {@code role: content} lines.
     */
    public static String renderConversation(List<Message> messages) {
        return messages.stream()
                .map(message -> message.getMessageType().getValue() + ": "
                        + (message.getText() == null ? "" : message.getText()))
                .collect(Collectors.joining("\n"));
    }
}
