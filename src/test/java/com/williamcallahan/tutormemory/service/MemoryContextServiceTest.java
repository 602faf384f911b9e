package com.williamcallahan.tutormemory.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.tutormemory.config.AppProperties;
import com.williamcallahan.tutormemory.domain.memory.ConflictAction;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.ExtractedFact;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import com.williamcallahan.tutormemory.service.retrieval.SourceRetriever;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

/**
 * Verifies prompt-ready fact formatting, memory context assembly and conversation processing.
 */
class MemoryContextServiceTest {

    private static final String USER = "student_1";

    private FactStore factStore;
    private FactExtractionService extractionService;
    private SourceRetriever retriever;
    private MemoryContextService service;

    @BeforeEach
    void setUp() {
        factStore = mock(FactStore.class);
        extractionService = mock(FactExtractionService.class);
        retriever = mock(SourceRetriever.class);
        service = new MemoryContextService(factStore, extractionService, retriever, new AppProperties());
    }

    @Test
    void formatsFactsAsBulletedList() {
        when(factStore.recentFacts(USER, null, Set.of(), 15)).thenReturn(List.of(
                fact(FactType.TOPIC_INTEREST, "Space", "Loves rockets"),
                fact(FactType.LEARNING_STYLE, null, "Visual learner")));

        assertEquals("Known information about the student:\n"
                + "- TOPIC_INTEREST [Space]: Loves rockets\n"
                + "- LEARNING_STYLE: Visual learner", service.formatFactsForPrompt(USER));
    }

    @Test
    void noFactsGiveTheFixedNotice() {
        when(factStore.recentFacts(USER, "math", Set.of(FactType.GOAL), 3)).thenReturn(List.of());

        assertEquals("No prior information about the student available.",
                service.formatFactsForPrompt(USER, "math", Set.of(FactType.GOAL), 3));
    }

    @Test
    void storeFailureGivesEmptyText() {
        when(factStore.recentFacts(anyString(), any(), any(), anyInt()))
                .thenThrow(new IllegalStateException("store offline"));

        assertEquals("", service.formatFactsForPrompt(USER));
    }

    @Test
    void profileContextCombinesFactsAndConversationMemories() {
        when(factStore.recentFacts(USER, null, Set.of(), 15))
                .thenReturn(List.of(fact(FactType.GOAL, null, "Pass the exam")));
        when(retriever.retrieve(eq("how do I revise?"), any(), eq(4)))
                .thenReturn(List.of(new SourceItem("m1", "Talked about flashcards"), new SourceItem("m2", "Exam in May")));

        String context = service.buildProfileContext(USER, "how do I revise?");

        assertEquals("Known information about the student:\n- GOAL: Pass the exam\n\n"
                + "Relevant conversation memories:\nTalked about flashcards\n\nExam in May", context);
    }

    @Test
    void retrieverFailureLeavesOutTheMemorySection() {
        when(factStore.recentFacts(USER, null, Set.of(), 15)).thenReturn(List.of());
        when(retriever.retrieve(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("down"));

        assertEquals("No prior information about the student available.",
                service.buildProfileContext(USER, "anything"));
    }

    @Test
    void blankQuerySkipsRetrieval() {
        when(factStore.recentFacts(USER, null, Set.of(), 15)).thenReturn(List.of());

        service.buildProfileContext(USER, " ");

        verify(retriever, never()).retrieve(anyString(), any(), anyInt());
    }

    @Test
    void processConversationStoresEveryExtractedFact() {
        List<Message> conversation = List.of(new UserMessage("I really want to get better at chess"));
        when(extractionService.extract(conversation, null)).thenReturn(List.of(
                new ExtractedFact(FactType.GOAL, "chess", "Wants to improve at chess", 0.9),
                new ExtractedFact(FactType.GOAL, "chess", "Plays chess weekly", 0.2)));
        Fact stored = fact(FactType.GOAL, "chess", "Wants to improve at chess");
        when(factStore.store(eq(USER), any(NewFact.class), isNull()))
                .thenReturn(new ConflictResolution(ConflictAction.ADDED, List.of(), stored))
                .thenReturn(new ConflictResolution(ConflictAction.IGNORED, List.of(stored), null));

        List<Fact> result = service.processConversation(USER, "chat_1", conversation, null, null);

        assertEquals(List.of(stored), result);
        verify(factStore).store(USER, new NewFact("chat_1", null, FactType.GOAL, "chess",
                "Wants to improve at chess", 0.9, true, Set.of()), null);
    }

    @Test
    void processConversationWithNoExtractedFactsStoresNothing() {
        when(extractionService.extract(anyList(), any())).thenReturn(List.of());

        assertTrue(service.processConversation(USER, "chat_1", List.of(), null, ConflictStrategy.MERGE).isEmpty());
        verify(factStore, never()).store(anyString(), any(), any());
    }

    private static Fact fact(FactType type, String subject, String details) {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        return new Fact("id-" + details, USER, null, null, type, subject, details, null, true, Set.of(), at, at);
    }
}
