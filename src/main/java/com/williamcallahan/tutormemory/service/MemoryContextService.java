package com.williamcallahan.tutormemory.service;

import com.williamcallahan.tutormemory.config.AppProperties;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.ExtractedFact;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import com.williamcallahan.tutormemory.service.extraction.FactExtractionModelConfig;
import com.williamcallahan.tutormemory.service.retrieval.SourceRetriever;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.stereotype.Service;

/**
 * Turns stored facts and past conversation snippets into the profile context that prompt
 * assembly places into the system prompt, and feeds new conversations back into the fact store.
 */
@Service
public class MemoryContextService {

    private static final Logger log = LoggerFactory.getLogger(MemoryContextService.class);

    static final String NO_FACTS_TEXT = "No prior information about the student available.";
    static final String FACTS_HEADER = "Known information about the student:\n";
    static final String MEMORIES_HEADER = "Relevant conversation memories:\n";
    static final String USER_ID_METADATA_KEY = "user_id";

    private final FactStore factStore;
    private final FactExtractionService extractionService;
    private final SourceRetriever memoryRetriever;
    private final AppProperties props;

    public MemoryContextService(
            FactStore factStore,
            FactExtractionService extractionService,
            SourceRetriever memoryRetriever,
            AppProperties props) {
        this.factStore = factStore;
        this.extractionService = extractionService;
        this.memoryRetriever = memoryRetriever;
        this.props = props;
    }

    public String formatFactsForPrompt(String userId) {
        return formatFactsForPrompt(userId, null, Set.of(), props.getMemory().getMaxFactsForPrompt());
    }

    /**
     * Renders the user's most recently updated active facts as a bulleted list.
     *
     * @param userId owning user
     * @param subject optional subject filter
     * @param factTypes optional type filter, empty for all
     * @param maxFacts maximum number of facts listed
     * @return formatted facts, a fixed notice when there are none, or an empty string when the
     *     facts could not be read
     */
    public String formatFactsForPrompt(String userId, String subject, Set<FactType> factTypes, int maxFacts) {
        List<Fact> facts;
        try {
            facts = factStore.recentFacts(userId, subject, factTypes, maxFacts);
        } catch (RuntimeException e) {
            log.warn("Could not load facts for prompt context of user {}: {}", userId, e.getMessage());
            return "";
        }
        if (facts.isEmpty()) {
            return NO_FACTS_TEXT;
        }
        return FACTS_HEADER + facts.stream()
                .map(MemoryContextService::formatFactLine)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Builds the profile context for a prompt: known facts followed by retrieved snippets of
     * earlier conversations that relate to the query.
     *
     * @param userId owning user
     * @param query latest user question, may be blank
     * @return profile context, possibly empty
     */
    public String buildProfileContext(String userId, String query) {
        List<String> sections = new ArrayList<>();
        String facts = formatFactsForPrompt(userId);
        if (!facts.isEmpty()) {
            sections.add(facts);
        }
        String memories = retrieveMemories(userId, query);
        if (!memories.isEmpty()) {
            sections.add(memories);
        }
        return String.join("\n\n", sections);
    }

    /**
     * Extracts facts from a conversation and stores each through conflict resolution.
     *
     * @param userId owning user
     * @param chatId conversation the facts came from
     * @param messages conversation, oldest first
     * @param modelConfig extraction model settings, null for defaults
     * @param strategy conflict strategy, null for the configured default
     * @return facts that were added, replaced or merged
     */
    public List<Fact> processConversation(
            String userId,
            String chatId,
            List<Message> messages,
            FactExtractionModelConfig modelConfig,
            ConflictStrategy strategy) {
        List<ExtractedFact> extracted = extractionService.extract(messages, modelConfig);
        List<Fact> stored = new ArrayList<>();
        for (ExtractedFact fact : extracted) {
            ConflictResolution resolution = factStore.store(userId, fact.toNewFact(chatId), strategy);
            resolution.resultFact().ifPresent(stored::add);
        }
        log.info("Processed conversation {} for user {}: {} extracted, {} stored",
                chatId, userId, extracted.size(), stored.size());
        return stored;
    }

    private String retrieveMemories(String userId, String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        Filter.Expression filter = new FilterExpressionBuilder().eq(USER_ID_METADATA_KEY, userId).build();
        List<SourceItem> memories;
        try {
            memories = memoryRetriever.retrieve(query, filter, props.getMemory().getMemoryTopK());
        } catch (RuntimeException e) {
            log.warn("Conversation memory retrieval failed for user {}: {}", userId, e.getMessage());
            return "";
        }
        if (memories == null || memories.isEmpty()) {
            return "";
        }
        return MEMORIES_HEADER + memories.stream()
                .map(SourceItem::content)
                .collect(Collectors.joining("\n\n"));
    }

    static String formatFactLine(Fact fact) {
        String subject = fact.hasSubject() ? " [" + fact.subject() + "]" : "";
        return "- " + fact.factType().wireName().toUpperCase(Locale.ROOT) + subject + ": " + fact.details();
    }
}
