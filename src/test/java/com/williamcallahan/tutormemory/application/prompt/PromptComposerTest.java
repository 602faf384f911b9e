package com.williamcallahan.tutormemory.application.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.tutormemory.domain.prompt.AssistantIdentity;
import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.ChatSettings;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies layered system prompt composition and section ordering.
 */
class PromptComposerTest {

    private static final String BASE_PROMPT = "User initial prompt.";
    private static final String PROFILE = "User profile context.";
    private static final String WORKSPACE = "Workspace instructions.";
    private static final String ADMIN = "Admin instructions.";
    private static final String STUDENT = "Student instructions.";

    private PromptComposer composer;

    @BeforeEach
    void setUp() {
        composer = new PromptComposer(Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void includesAllSectionsWhenProvided() {
        String prompt = composer.compose(BASE_PROMPT, PROFILE, WORKSPACE, ADMIN,
                new AssistantIdentity("asst_123", "Test Assistant"), STUDENT);

        assertTrue(prompt.contains("<INJECT ROLE>\nYou are not an AI. You are Test Assistant.\n</INJECT ROLE>"));
        assertTrue(prompt.contains("Today is Fri Mar 15 2024."));
        assertTrue(prompt.contains("Admin Instructions (Always Follow These First):\n" + ADMIN));
        assertTrue(prompt.contains("Student Instructions (Apply to all student interactions):\n" + STUDENT));
        assertTrue(prompt.contains("User Info:\n" + PROFILE));
        assertTrue(prompt.contains("System Instructions:\n" + WORKSPACE));
        assertTrue(prompt.contains("User Instructions:\n" + BASE_PROMPT));
    }

    @Test
    void ordersSectionsByPrecedence() {
        String prompt = composer.compose(BASE_PROMPT, PROFILE, WORKSPACE, ADMIN,
                new AssistantIdentity("asst_123", "Test Assistant"), STUDENT);

        assertTrue(prompt.indexOf("<INJECT ROLE>") < prompt.indexOf("Today is"));
        assertTrue(prompt.indexOf("Today is") < prompt.indexOf("Admin Instructions"));
        assertTrue(prompt.indexOf("Admin Instructions") < prompt.indexOf("Student Instructions"));
        assertTrue(prompt.indexOf("Student Instructions") < prompt.indexOf("User Info"));
        assertTrue(prompt.indexOf("User Info") < prompt.indexOf("System Instructions"));
        assertTrue(prompt.indexOf("System Instructions") < prompt.indexOf("User Instructions"));
    }

    @Test
    void baseOnlyPromptHasDateAndUserInstructions() {
        String prompt = composer.compose(BASE_PROMPT, "", "", null, null, null);

        assertEquals("Today is Fri Mar 15 2024.\n\nUser Instructions:\n" + BASE_PROMPT, prompt);
        assertFalse(prompt.contains("<INJECT ROLE>"));
        assertFalse(prompt.contains("Admin Instructions"));
        assertFalse(prompt.contains("User Info:"));
    }

    @Test
    void blankSectionsAndUnnamedAssistantAreOmitted() {
        String prompt = composer.compose(BASE_PROMPT, "   ", "\t", " ", new AssistantIdentity("asst_1", " "), "");

        assertFalse(prompt.contains("<INJECT ROLE>"));
        assertFalse(prompt.contains("Student Instructions"));
        assertFalse(prompt.contains("System Instructions"));
    }

    @Test
    void payloadFlagsSuppressProfileAndWorkspace() {
        ChatSettings settings = new ChatSettings("gpt-4", BASE_PROMPT, 0.7, 400, false, false);
        ChatPayload payload = new ChatPayload(settings, WORKSPACE, ADMIN, null, null, List.of(), null, null);

        String prompt = composer.compose(payload, PROFILE);

        assertFalse(prompt.contains(PROFILE));
        assertFalse(prompt.contains(WORKSPACE));
        assertTrue(prompt.contains(ADMIN));
        assertTrue(prompt.endsWith("User Instructions:\n" + BASE_PROMPT));
    }
}
