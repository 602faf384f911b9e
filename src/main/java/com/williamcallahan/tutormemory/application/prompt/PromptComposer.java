package com.williamcallahan.tutormemory.application.prompt;

import com.williamcallahan.tutormemory.domain.prompt.AssistantIdentity;
import com.williamcallahan.tutormemory.domain.prompt.ChatPayload;
import com.williamcallahan.tutormemory.domain.prompt.ChatSettings;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds the system prompt from layered instruction sources.
 *
 * <p>Sections are rendered in a fixed precedence and separated by a blank line:</p>
 * <ol>
 *   <li>role injection block (only for a named assistant)</li>
 *   <li>current date line</li>
 *   <li>admin instructions</li>
 *   <li>student instructions</li>
 *   <li>user profile info</li>
 *   <li>workspace (system) instructions</li>
 *   <li>base user instructions</li>
 * </ol>
 *
 * <p>A section whose input is null or blank is omitted entirely, header included.
 * Admin instructions always precede student, profile, workspace and user layers.</p>
 */
@Component
public class PromptComposer {

    static final String SECTION_SEPARATOR = "\n\n";
    static final String ADMIN_HEADER = "Admin Instructions (Always Follow These First):";
    static final String STUDENT_HEADER = "Student Instructions (Apply to all student interactions):";
    static final String PROFILE_HEADER = "User Info:";
    static final String WORKSPACE_HEADER = "System Instructions:";
    static final String USER_HEADER = "User Instructions:";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEE MMM dd yyyy", Locale.US);

    private final Clock clock;

    public PromptComposer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Composes the system prompt for a chat payload, honouring the settings' include flags.
     *
     * @param payload chat payload carrying settings and instruction layers
     * @param profileContext user profile text, may be null
     * @return composed system prompt
     */
    public String compose(ChatPayload payload, String profileContext) {
        ChatSettings settings = payload.settings();
        return compose(
                settings.promptTemplate(),
                settings.includeProfileContext() ? profileContext : null,
                settings.includeWorkspaceInstructions() ? payload.workspaceInstructions() : null,
                payload.adminPrompt(),
                payload.assistant(),
                payload.studentSystemPrompt());
    }

    /**
     * Composes the system prompt from already-filtered layers.
     *
     * @param basePrompt base user prompt, always rendered
     * @param profileContext user profile info, omitted when blank
     * @param workspaceInstructions workspace instructions, omitted when blank
     * @param adminPrompt admin instructions, omitted when blank
     * @param assistant assistant identity, role block omitted when absent or unnamed
     * @param studentPrompt student instructions, omitted when blank
     * @return composed system prompt
     */
    public String compose(
            String basePrompt,
            String profileContext,
            String workspaceInstructions,
            String adminPrompt,
            AssistantIdentity assistant,
            String studentPrompt) {
        List<String> sections = new ArrayList<>();

        if (assistant != null && assistant.hasName()) {
            sections.add("<INJECT ROLE>\nYou are not an AI. You are " + assistant.name() + ".\n</INJECT ROLE>");
        }

        sections.add("Today is " + LocalDate.now(clock).format(DATE_FORMAT) + ".");

        addSection(sections, ADMIN_HEADER, adminPrompt);
        addSection(sections, STUDENT_HEADER, studentPrompt);
        addSection(sections, PROFILE_HEADER, profileContext);
        addSection(sections, WORKSPACE_HEADER, workspaceInstructions);

        sections.add(USER_HEADER + "\n" + (basePrompt == null ? "" : basePrompt));

        return String.join(SECTION_SEPARATOR, sections);
    }

    private static void addSection(List<String> sections, String header, String body) {
        if (body != null && !body.isBlank()) {
            sections.add(header + "\n" + body);
        }
    }
}
