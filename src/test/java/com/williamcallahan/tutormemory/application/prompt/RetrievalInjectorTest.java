package com.williamcallahan.tutormemory.application.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.MessageRole;
import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies where retrieved sources are appended in the history window.
 */
class RetrievalInjectorTest {

    private RetrievalInjector injector;

    @BeforeEach
    void setUp() {
        injector = new RetrievalInjector();
    }

    @Test
    void messageLevelSourcesAreAppendedToTheLastMessage() {
        List<ChatMessage> window = List.of(
                ChatMessage.text("msg_1", 1, MessageRole.USER, "User query about file"));

        List<ChatMessage> result = injector.inject(window,
                List.of(new SourceItem("file_item_1", "Retrieved content from message file.")), List.of());

        assertEquals("User query about file\n\nYou may use the following sources:\n\n"
                + "<BEGIN SOURCE>\nRetrieved content from message file.\n</END SOURCE>", result.get(0).content());
    }

    @Test
    void chatLevelSourceGoesToTheMessageBeforeTheReferencingOne() {
        List<ChatMessage> window = List.of(
                ChatMessage.text("msg_1", 1, MessageRole.ASSISTANT, "Assistant response"),
                new ChatMessage("msg_2", 2, MessageRole.USER, "User query referencing file", null, List.of(),
                        List.of("file_item_2")));

        List<ChatMessage> result = injector.inject(window, List.of(),
                List.of(new SourceItem("file_item_2", "Retrieved content from chat file.")));

        assertTrue(result.get(0).content().startsWith("Assistant response\n\n"));
        assertTrue(result.get(0).content().contains("You may use the following sources:"));
        assertTrue(result.get(0).content().contains(
                "<BEGIN SOURCE>\nRetrieved content from chat file.\n</END SOURCE>"));
        assertEquals("User query referencing file", result.get(1).content());
    }

    @Test
    void referenceFromTheFirstMessageIsDropped() {
        List<ChatMessage> window = List.of(
                new ChatMessage("msg_1", 1, MessageRole.USER, "Only message", null, List.of(), List.of("s1")));

        List<ChatMessage> result = injector.inject(window, List.of(), List.of(new SourceItem("s1", "content")));

        assertEquals("Only message", result.get(0).content());
    }

    @Test
    void unknownSourceIdsAreIgnored() {
        List<ChatMessage> window = List.of(
                ChatMessage.text("msg_1", 1, MessageRole.ASSISTANT, "Answer"),
                new ChatMessage("msg_2", 2, MessageRole.USER, "Question", null, List.of(), List.of("missing")));

        List<ChatMessage> result = injector.inject(window, List.of(), List.of(new SourceItem("s1", "content")));

        assertEquals("Answer", result.get(0).content());
    }

    @Test
    void multipleSourcesShareOneHeader() {
        String text = RetrievalInjector.buildRetrievalText(
                List.of(new SourceItem("a", "first"), new SourceItem("b", "second")));

        assertEquals("You may use the following sources:\n\n<BEGIN SOURCE>\nfirst\n</END SOURCE>\n\n"
                + "<BEGIN SOURCE>\nsecond\n</END SOURCE>", text);
    }

    @Test
    void emptyWindowStaysEmpty() {
        assertTrue(injector.inject(List.of(), List.of(new SourceItem("a", "x")), List.of()).isEmpty());
    }
}
