package com.williamcallahan.tutormemory.application.prompt;

import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects the recent-history window that fits a token budget.
 *
 * <p>Messages are walked newest to oldest. Each message is kept while its cost fits the
 * remaining budget; the first message that does not fit ends the walk, so older messages are
 * never considered even when individually small. The result is always a contiguous suffix of
 * the conversation.</p>
 *
 * <p>Budget exhaustion is normal control flow and never raises an error.</p>
 */
@Component
public class ContextBudgetAllocator {

    private static final Logger log = LoggerFactory.getLogger(ContextBudgetAllocator.class);

    private final TokenCounter tokenCounter;

    public ContextBudgetAllocator(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    /**
     * Allocates the budget between the system prompt and conversation history.
     *
     * @param systemPromptTokens token cost already reserved for the system prompt
     * @param budget total token budget for the model call
     * @param messages conversation ordered oldest to newest
     * @return included suffix in chronological order and the tokens it consumes
     */
    public BudgetAllocation allocate(int systemPromptTokens, int budget, List<ChatMessage> messages) {
        if (systemPromptTokens >= budget) {
            log.warn("System prompt ({} tokens) leaves no room in budget ({} tokens)", systemPromptTokens, budget);
            return new BudgetAllocation(List.of(), systemPromptTokens);
        }

        int remaining = budget - systemPromptTokens;
        int usedTokens = systemPromptTokens;

        // Process from newest to oldest
        List<ChatMessage> included = new ArrayList<>();
        for (int index = messages.size() - 1; index >= 0; index--) {
            ChatMessage message = messages.get(index);
            int cost = tokenCounter.count(message.content());
            if (cost > remaining) {
                break;
            }
            included.add(message);
            remaining -= cost;
            usedTokens += cost;
        }

        // Restore chronological order
        Collections.reverse(included);

        if (included.size() < messages.size()) {
            log.debug("Context window kept {} of {} messages (budget: {} tokens, used: {})",
                    included.size(), messages.size(), budget, usedTokens);
        }
        return new BudgetAllocation(included, usedTokens);
    }

    /**
     * Messages selected for the context window and the tokens they consume together with the
     * system prompt. Token usage is measured on original message content, before any retrieval
     * injection.
     *
     * @param includedMessages selected messages, oldest first
     * @param usedTokens system prompt tokens plus included message tokens
     */
    public record BudgetAllocation(List<ChatMessage> includedMessages, int usedTokens) {

        public BudgetAllocation {
            includedMessages = List.copyOf(includedMessages);
        }
    }
}
