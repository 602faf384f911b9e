package com.williamcallahan.tutormemory.application.prompt;

import com.williamcallahan.tutormemory.application.prompt.ContextBudgetAllocator.BudgetAllocation;
import com.williamcallahan.tutormemory.domain.prompt.AssembledMessage;
import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.MessageImage;
import com.williamcallahan.tutormemory.domain.prompt.MessageRole;
import com.williamcallahan.tutormemory.domain.prompt.TurnMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Assembles the final message list for a model call.
 *
 * <p>The pipeline is: compose the system prompt, allocate the history window against the
 * context length, inject retrieved sources into the window, then format the result for the
 * target provider shape. Token usage is fixed at allocation time.</p>
 */
@Service
public class FinalMessageAssembler {

    private static final Logger log = LoggerFactory.getLogger(FinalMessageAssembler.class);

    static final String SYSTEM_ROLE = "system";

    private final PromptComposer promptComposer;
    private final ContextBudgetAllocator budgetAllocator;
    private final RetrievalInjector retrievalInjector;
    private final MultiModalContentFormatter contentFormatter;
    private final TokenCounter tokenCounter;

    public FinalMessageAssembler(
            PromptComposer promptComposer,
            ContextBudgetAllocator budgetAllocator,
            RetrievalInjector retrievalInjector,
            MultiModalContentFormatter contentFormatter,
            TokenCounter tokenCounter) {
        this.promptComposer = promptComposer;
        this.budgetAllocator = budgetAllocator;
        this.retrievalInjector = retrievalInjector;
        this.contentFormatter = contentFormatter;
        this.tokenCounter = tokenCounter;
    }

    /**
     * Builds messages in the flat {@code {role, content}} shape: the system prompt first, then the
     * included history with sources injected and images expanded.
     *
     * @param payload chat payload
     * @param profileContext user profile info for the system prompt, may be null
     * @param images caller-resolved image data
     * @return messages and token usage
     */
    public FinalMessages buildFinalMessages(ChatPayload payload, String profileContext, List<MessageImage> images) {
        String systemPrompt = promptComposer.compose(payload, profileContext);
        BudgetAllocation allocation = allocate(payload);
        List<ChatMessage> window = injectSources(payload, allocation);

        List<AssembledMessage> finalMessages = new ArrayList<>();
        finalMessages.add(AssembledMessage.ofText(SYSTEM_ROLE, systemPrompt));
        finalMessages.addAll(contentFormatter.formatAll(window, images));
        return new FinalMessages(finalMessages, allocation.usedTokens());
    }

    /**
     * Builds messages in the turn-based {@code {role, parts}} shape. The system prompt is sent as
     * a leading user turn and assistant messages become model turns. Image references are not
     * carried in this shape.
     *
     * @param payload chat payload
     * @param profileContext user profile info for the system prompt, may be null
     * @return turns and token usage
     */
    public TurnBasedMessages buildTurnBasedMessages(ChatPayload payload, String profileContext) {
        String systemPrompt = promptComposer.compose(payload, profileContext);
        BudgetAllocation allocation = allocate(payload);
        List<ChatMessage> window = injectSources(payload, allocation);

        List<TurnMessage> turns = new ArrayList<>();
        turns.add(TurnMessage.ofText(TurnMessage.ROLE_USER, systemPrompt));
        for (ChatMessage message : window) {
            String role = message.role() == MessageRole.ASSISTANT ? TurnMessage.ROLE_MODEL : TurnMessage.ROLE_USER;
            turns.add(TurnMessage.ofText(role, message.content()));
        }
        return new TurnBasedMessages(turns, allocation.usedTokens());
    }

    private BudgetAllocation allocate(ChatPayload payload) {
        int systemTokens = tokenCounter.count(payload.settings().promptTemplate());
        return budgetAllocator.allocate(systemTokens, payload.settings().contextLength(), payload.messages());
    }

    private List<ChatMessage> injectSources(ChatPayload payload, BudgetAllocation allocation) {
        List<ChatMessage> window = retrievalInjector.inject(
                allocation.includedMessages(), payload.messageLevelSources(), payload.chatLevelSources());
        log.debug("Prepared window of {} messages ({} tokens used)", window.size(), allocation.usedTokens());
        return window;
    }

    /**
     * Flat-shape assembly result.
     *
     * @param messages system message followed by the included history
     * @param usedTokens prompt template tokens plus included message tokens
     */
    public record FinalMessages(List<AssembledMessage> messages, int usedTokens) {

        public FinalMessages {
            messages = List.copyOf(messages);
        }
    }

    /**
     * Turn-based assembly result.
     *
     * @param messages system turn followed by the included history
     * @param usedTokens prompt template tokens plus included message tokens
     */
    public record TurnBasedMessages(List<TurnMessage> messages, int usedTokens) {

        public TurnBasedMessages {
            messages = List.copyOf(messages);
        }
    }
}
