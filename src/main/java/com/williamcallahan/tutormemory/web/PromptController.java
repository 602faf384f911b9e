package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.application.prompt.FinalMessageAssembler;
import com.williamcallahan.tutormemory.application.prompt.FinalMessageAssembler.FinalMessages;
import com.williamcallahan.tutormemory.application.prompt.FinalMessageAssembler.TurnBasedMessages;
import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.MessageRole;
import com.williamcallahan.tutormemory.service.MemoryContextService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Assembles model-ready message lists from a chat payload.
 */
@RestController
@RequestMapping("/api/prompt")
public class PromptController {

    private static final Logger log = LoggerFactory.getLogger(PromptController.class);

    private final FinalMessageAssembler assembler;
    private final MemoryContextService memoryContextService;

    public PromptController(FinalMessageAssembler assembler, MemoryContextService memoryContextService) {
        this.assembler = assembler;
        this.memoryContextService = memoryContextService;
    }

    /**
     * POST /api/prompt/messages - flat {@code {role, content}} messages.
     */
    @PostMapping("/messages")
    public FinalMessages messages(@Valid @RequestBody PromptRequest request) {
        return assembler.buildFinalMessages(request.payload(), profileContext(request), request.images());
    }

    /**
     * POST /api/prompt/turns - turn-based {@code {role, parts}} messages.
     */
    @PostMapping("/turns")
    public TurnBasedMessages turns(@Valid @RequestBody PromptRequest request) {
        return assembler.buildTurnBasedMessages(request.payload(), profileContext(request));
    }

    private String profileContext(PromptRequest request) {
        if (request.profileContext() != null) {
            return request.profileContext();
        }
        ChatPayload payload = request.payload();
        if (request.userId() == null || request.userId().isBlank() || !payload.settings().includeProfileContext()) {
            return null;
        }
        log.debug("Building profile context from memory for user {}", request.userId());
        return memoryContextService.buildProfileContext(request.userId(), latestUserText(payload.messages()));
    }

    private static String latestUserText(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == MessageRole.USER) {
                return messages.get(i).content();
            }
        }
        return "";
    }
}
