package com.williamcallahan.tutormemory.application.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.tutormemory.application.prompt.FinalMessageAssembler.FinalMessages;
import com.williamcallahan.tutormemory.application.prompt.FinalMessageAssembler.TurnBasedMessages;
import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.ChatSettings;
import com.williamcallahan.tutormemory.domain.prompt.MessageImage;
import com.williamcallahan.tutormemory.domain.prompt.MessageRole;
import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import com.williamcallahan.tutormemory.domain.prompt.TurnMessage;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end assembly of flat and turn-based message lists with character token counting.
 */
class FinalMessageAssemblerTest {

    private static final String BASE_PROMPT = "Test base prompt.";
    private static final String PROFILE = "User test profile context.";
    private static final String WORKSPACE = "Test workspace instructions.";

    private FinalMessageAssembler assembler;

    @BeforeEach
    void setUp() {
        TokenCounter tokenCounter = new CharacterTokenCounter();
        assembler = new FinalMessageAssembler(
                new PromptComposer(Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC)),
                new ContextBudgetAllocator(tokenCounter),
                new RetrievalInjector(),
                new MultiModalContentFormatter(),
                tokenCounter);
    }

    @Test
    @DisplayName("Should build system, user and assistant messages without truncation")
    void buildsMessagesWithoutTruncation() {
        ChatPayload payload = payload(400, WORKSPACE, List.of(
                message("1", MessageRole.USER, "Hello"),
                message("2", MessageRole.ASSISTANT, "Hi there")), List.of(), List.of());

        FinalMessages result = assembler.buildFinalMessages(payload, PROFILE, List.of());

        assertEquals(3, result.messages().size());
        assertEquals("system", result.messages().get(0).role());
        String system = (String) result.messages().get(0).content();
        assertTrue(system.contains(BASE_PROMPT));
        assertTrue(system.contains(PROFILE));
        assertTrue(system.contains(WORKSPACE));
        assertEquals("user", result.messages().get(1).role());
        assertEquals("Hello", result.messages().get(1).content());
        assertEquals("assistant", result.messages().get(2).role());
        assertEquals("Hi there", result.messages().get(2).content());
        assertEquals(BASE_PROMPT.length() + "Hello".length() + "Hi there".length(), result.usedTokens());
    }

    @Test
    @DisplayName("Should drop older messages once the context budget is exhausted")
    void truncatesOlderMessages() {
        ChatPayload payload = payload(200, "", List.of(
                message("1", MessageRole.USER, "First message - should be truncated"),
                message("2", MessageRole.ASSISTANT, "a".repeat(150)),
                message("3", MessageRole.USER, "Recent message - should be included")), List.of(), List.of());

        FinalMessages result = assembler.buildFinalMessages(payload, PROFILE, List.of());

        assertEquals(2, result.messages().size());
        assertEquals("system", result.messages().get(0).role());
        assertEquals("Recent message - should be included", result.messages().get(1).content());
        assertEquals(BASE_PROMPT.length() + 35, result.usedTokens());
    }

    @Test
    void excludesProfileAndWorkspaceWhenFlagsAreOff() {
        ChatSettings settings = new ChatSettings("gpt-4", BASE_PROMPT, 0.7, 400, false, false);
        ChatPayload payload = new ChatPayload(settings, WORKSPACE, null, null, null,
                List.of(message("1", MessageRole.USER, "Hi")), List.of(), List.of());

        String system = (String) assembler.buildFinalMessages(payload, PROFILE, List.of())
                .messages().get(0).content();

        assertFalse(system.contains(PROFILE));
        assertFalse(system.contains(WORKSPACE));
        assertTrue(system.contains(BASE_PROMPT));
    }

    @Test
    void injectsChatLevelSourceIntoPrecedingAssistantMessage() {
        ChatPayload payload = payload(400, WORKSPACE, List.of(
                message("1", MessageRole.ASSISTANT, "Assistant response"),
                new ChatMessage("msg_2", 2, MessageRole.USER, "User query referencing file", null, List.of(),
                        List.of("file_item_2"))),
                List.of(), List.of(new SourceItem("file_item_2", "Retrieved content from chat file.")));

        FinalMessages result = assembler.buildFinalMessages(payload, PROFILE, List.of());

        assertEquals(3, result.messages().size());
        String assistant = (String) result.messages().get(1).content();
        assertTrue(assistant.contains("Assistant response"));
        assertTrue(assistant.contains("You may use the following sources"));
        assertTrue(assistant.contains("<BEGIN SOURCE>\nRetrieved content from chat file.\n</END SOURCE>"));
        assertEquals("User query referencing file", result.messages().get(2).content());
    }

    @Test
    void usedTokensExcludeInjectedSourceText() {
        ChatPayload payload = payload(400, WORKSPACE, List.of(message("1", MessageRole.USER, "User query")),
                List.of(new SourceItem("s1", "x".repeat(1000))), List.of());

        FinalMessages result = assembler.buildFinalMessages(payload, PROFILE, List.of());

        assertTrue(((String) result.messages().get(1).content()).contains("x".repeat(1000)));
        assertEquals(BASE_PROMPT.length() + "User query".length(), result.usedTokens());
    }

    @Test
    void resolvesImagesForMultiPartContent() {
        ChatPayload payload = payload(400, WORKSPACE, List.of(new ChatMessage("msg_1", 1, MessageRole.USER,
                "Look at this", null, List.of("images/test.jpg"), List.of())), List.of(), List.of());

        FinalMessages result = assembler.buildFinalMessages(payload, PROFILE,
                List.of(new MessageImage("msg_1", "images/test.jpg", "base64data")));

        assertEquals(2, result.messages().size());
        assertTrue(result.messages().get(1).isMultiPart());
        assertEquals(2, result.messages().get(1).parts().size());
    }

    @Test
    @DisplayName("Turn-based output sends the system prompt as a user turn and assistant turns as model")
    void buildsTurnBasedMessages() {
        ChatPayload payload = payload(400, WORKSPACE, List.of(
                message("1", MessageRole.USER, "Hello Gemini"),
                message("2", MessageRole.ASSISTANT, "Hello there!")), List.of(), List.of());

        TurnBasedMessages result = assembler.buildTurnBasedMessages(payload, PROFILE);

        assertEquals(3, result.messages().size());
        TurnMessage system = result.messages().get(0);
        assertEquals(TurnMessage.ROLE_USER, system.role());
        assertTrue(system.parts().get(0).text().contains(BASE_PROMPT));
        assertEquals(TurnMessage.ROLE_USER, result.messages().get(1).role());
        assertEquals("Hello Gemini", result.messages().get(1).parts().get(0).text());
        assertEquals(TurnMessage.ROLE_MODEL, result.messages().get(2).role());
        assertEquals(BASE_PROMPT.length() + 12 + 12, result.usedTokens());
    }

    private static ChatPayload payload(int contextLength, String workspace, List<ChatMessage> messages,
            List<SourceItem> messageSources, List<SourceItem> chatSources) {
        ChatSettings settings = new ChatSettings("gpt-4", BASE_PROMPT, 0.7, contextLength, true, true);
        return new ChatPayload(settings, workspace, null, null, null, messages, messageSources, chatSources);
    }

    private static ChatMessage message(String id, MessageRole role, String content) {
        return ChatMessage.text("msg_" + id, Integer.parseInt(id), role, content);
    }
}
