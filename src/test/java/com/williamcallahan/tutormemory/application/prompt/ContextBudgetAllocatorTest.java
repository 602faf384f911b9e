package com.williamcallahan.tutormemory.application.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.tutormemory.application.prompt.ContextBudgetAllocator.BudgetAllocation;
import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.MessageRole;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies newest-first history selection under a token budget.
 */
class ContextBudgetAllocatorTest {

    private ContextBudgetAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new ContextBudgetAllocator(new CharacterTokenCounter());
    }

    @Test
    void keepsEverythingWithinBudget() {
        List<ChatMessage> history = List.of(
                message("1", MessageRole.USER, "Hello"),
                message("2", MessageRole.ASSISTANT, "Hi there"));

        BudgetAllocation allocation = allocator.allocate(17, 400, history);

        assertEquals(history, allocation.includedMessages());
        assertEquals(17 + 5 + 8, allocation.usedTokens());
    }

    @Test
    void stopsAtFirstMessageThatDoesNotFit() {
        ChatMessage oldest = message("1", MessageRole.USER, "hi");
        ChatMessage large = message("2", MessageRole.ASSISTANT, "a".repeat(150));
        ChatMessage newest = message("3", MessageRole.USER, "Recent message - should be included");

        BudgetAllocation allocation = allocator.allocate(17, 200, List.of(oldest, large, newest));

        // "hi" would fit on its own but sits behind the message that overflowed
        assertEquals(List.of(newest), allocation.includedMessages());
        assertEquals(17 + 35, allocation.usedTokens());
    }

    @Test
    void returnsNothingWhenSystemPromptExhaustsBudget() {
        BudgetAllocation allocation = allocator.allocate(50, 50, List.of(message("1", MessageRole.USER, "x")));

        assertTrue(allocation.includedMessages().isEmpty());
        assertEquals(50, allocation.usedTokens());
    }

    @Test
    void tightBudgetKeepsOnlyTheNewestMessage() {
        List<ChatMessage> history = List.of(
                message("1", MessageRole.USER, "aaaaaaaaaa"),
                message("2", MessageRole.ASSISTANT, "bbbbb"));

        BudgetAllocation allocation = allocator.allocate(10, 16, history);

        assertEquals(List.of(history.get(1)), allocation.includedMessages());
        assertEquals(15, allocation.usedTokens());
    }

    @Test
    void includedMessagesAreAlwaysAContiguousSuffixWithinBudget() {
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            history.add(message(String.valueOf(i), i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT,
                    "m".repeat(3 + (i * 7) % 11)));
        }

        for (int budget = 1; budget <= 120; budget += 7) {
            BudgetAllocation allocation = allocator.allocate(0, budget, history);
            List<ChatMessage> kept = allocation.includedMessages();
            List<ChatMessage> expectedSuffix = history.subList(history.size() - kept.size(), history.size());

            assertEquals(expectedSuffix, kept, "budget " + budget);
            assertTrue(allocation.usedTokens() <= budget, "budget " + budget);
        }
    }

    @Test
    void growingTheBudgetNeverDropsAMessage() {
        List<ChatMessage> history = List.of(
                message("1", MessageRole.USER, "first question"),
                message("2", MessageRole.ASSISTANT, "a longer assistant answer"),
                message("3", MessageRole.USER, "follow up"));

        int previous = 0;
        for (int budget = 1; budget <= 80; budget++) {
            int kept = allocator.allocate(0, budget, history).includedMessages().size();
            assertTrue(kept >= previous, "budget " + budget);
            previous = kept;
        }
    }

    @Test
    void prependingOlderHistoryKeepsTheSameRecentSelection() {
        List<ChatMessage> recent = List.of(
                message("5", MessageRole.USER, "what is a noun"),
                message("6", MessageRole.ASSISTANT, "a person, place or thing"),
                message("7", MessageRole.USER, "examples please"));
        List<ChatMessage> extended = new ArrayList<>();
        extended.add(message("1", MessageRole.USER, "an older question that came first"));
        extended.addAll(recent);

        for (int budget = 1; budget <= 60; budget++) {
            List<ChatMessage> before = allocator.allocate(0, budget, recent).includedMessages();
            List<ChatMessage> after = allocator.allocate(0, budget, extended).includedMessages();

            assertEquals(before, after.subList(after.size() - before.size(), after.size()), "budget " + budget);
        }
    }

    private static ChatMessage message(String id, MessageRole role, String content) {
        return ChatMessage.text("msg_" + id, Integer.parseInt(id), role, content);
    }
}
