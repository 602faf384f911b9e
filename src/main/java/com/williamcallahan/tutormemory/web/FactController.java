package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.config.AppProperties;
import com.williamcallahan.tutormemory.domain.memory.BatchImportResult;
import com.williamcallahan.tutormemory.domain.memory.ConflictResolution;
import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactExport;
import com.williamcallahan.tutormemory.domain.memory.FactPatternAnalysis;
import com.williamcallahan.tutormemory.domain.memory.FactSearchCriteria;
import com.williamcallahan.tutormemory.domain.memory.FactSearchPage;
import com.williamcallahan.tutormemory.domain.memory.FactSortField;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.FactUpdate;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeGapReport;
import com.williamcallahan.tutormemory.domain.memory.KnowledgeProfile;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import com.williamcallahan.tutormemory.domain.memory.SortDirection;
import com.williamcallahan.tutormemory.service.FactStore;
import com.williamcallahan.tutormemory.service.MemoryContextService;
import com.williamcallahan.tutormemory.service.extraction.FactExtractionModelConfig;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON endpoints over the fact store. Callers are authenticated upstream; the user id is taken
 * from the request as given.
 */
@RestController
@RequestMapping("/api/facts")
public class FactController {

    private final FactStore factStore;
    private final MemoryContextService memoryContextService;
    private final ExceptionResponseBuilder exceptionBuilder;
    private final AppProperties props;

    public FactController(
            FactStore factStore,
            MemoryContextService memoryContextService,
            ExceptionResponseBuilder exceptionBuilder,
            AppProperties props) {
        this.factStore = factStore;
        this.memoryContextService = memoryContextService;
        this.exceptionBuilder = exceptionBuilder;
        this.props = props;
    }

    /**
     * POST /api/facts - stores a fact as entered.
     */
    @PostMapping
    public ResponseEntity<Fact> create(@Valid @RequestBody FactRequest request) {
        Fact created = factStore.create(request.userId(), request.toNewFact());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * POST /api/facts/resolve - stores a fact through conflict resolution.
     */
    @PostMapping("/resolve")
    public ConflictResolution resolve(@Valid @RequestBody FactRequest request) {
        return factStore.store(request.userId(), request.toNewFact(), parseStrategy(request.strategy()));
    }

    @GetMapping("/{factId}")
    public Fact get(@PathVariable String factId) {
        return factStore.getById(factId);
    }

    @PatchMapping("/{factId}")
    public Fact update(@PathVariable String factId, @RequestBody FactUpdate update) {
        return factStore.update(factId, update);
    }

    @PostMapping("/{factId}/deactivate")
    public Fact deactivate(@PathVariable String factId) {
        return factStore.deactivate(factId);
    }

    @DeleteMapping("/{factId}")
    public ResponseEntity<ApiSuccessResponse> delete(@PathVariable String factId) {
        factStore.hardDelete(factId);
        return exceptionBuilder.buildSuccessResponse("Fact deleted: " + factId);
    }

    @PutMapping("/{factId}/tags")
    public Fact updateTags(@PathVariable String factId, @RequestBody List<String> tags) {
        return factStore.updateTags(factId, tags);
    }

    @PostMapping("/{factId}/feedback")
    public Fact feedback(@PathVariable String factId, @Valid @RequestBody FeedbackRequest request) {
        return factStore.applyFeedback(request.userId(), factId, request.feedback());
    }

    /**
     * GET /api/facts/users/{userId}/search - filtered, sorted and paged facts.
     */
    @GetMapping("/users/{userId}/search")
    public FactSearchPage search(
            @PathVariable String userId,
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "types", required = false) List<String> types,
            @RequestParam(name = "subjects", required = false) List<String> subjects,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
                    Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
                    Instant to,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @RequestParam(name = "minConfidence", required = false) Double minConfidence,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "sortBy", defaultValue = "updated_at") String sortBy,
            @RequestParam(name = "direction", defaultValue = "desc") String direction) {
        FactSearchCriteria criteria = new FactSearchCriteria(query, parseTypes(types),
                subjects == null ? Set.of() : new LinkedHashSet<>(subjects), from, to, includeInactive,
                minConfidence, offset, limit, FactSortField.fromWireName(sortBy),
                SortDirection.fromWireName(direction));
        return factStore.search(userId, criteria);
    }

    @GetMapping("/users/{userId}/tags")
    public List<String> tags(@PathVariable String userId) {
        return factStore.allTags(userId);
    }

    @GetMapping("/users/{userId}/by-tags")
    public List<Fact> byTags(
            @PathVariable String userId,
            @RequestParam(name = "tags", required = false) List<String> tags,
            @RequestParam(name = "matchAll", defaultValue = "false") boolean matchAll) {
        return factStore.factsByTags(userId, tags == null ? List.of() : tags, matchAll);
    }

    @GetMapping("/users/{userId}/relevant")
    public List<Fact> relevant(
            @PathVariable String userId,
            @RequestParam(name = "context") String context,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive,
            @RequestParam(name = "types", required = false) List<String> types) {
        int effectiveLimit = limit == null ? props.getMemory().getRelevantFactsLimit() : limit;
        return factStore.relevantFacts(userId, context, effectiveLimit, includeInactive, parseTypes(types));
    }

    @GetMapping("/users/{userId}/gaps")
    public KnowledgeGapReport gaps(@PathVariable String userId) {
        return factStore.knowledgeGaps(userId);
    }

    @GetMapping("/users/{userId}/profile")
    public KnowledgeProfile profile(
            @PathVariable String userId,
            @RequestParam(name = "maxFactsPerType", required = false) Integer maxFactsPerType) {
        return maxFactsPerType == null
                ? factStore.knowledgeProfile(userId)
                : factStore.knowledgeProfile(userId, maxFactsPerType);
    }

    @GetMapping("/users/{userId}/patterns")
    public FactPatternAnalysis patterns(@PathVariable String userId) {
        return factStore.analyzePatterns(userId);
    }

    @GetMapping("/users/{userId}/grouped")
    public Map<String, List<Fact>> grouped(@PathVariable String userId) {
        return factStore.groupedFacts(userId);
    }

    /**
     * GET /api/facts/users/{userId}/prompt-context - facts formatted for a system prompt.
     */
    @GetMapping("/users/{userId}/prompt-context")
    public Map<String, String> promptContext(
            @PathVariable String userId,
            @RequestParam(name = "subject", required = false) String subject,
            @RequestParam(name = "types", required = false) List<String> types,
            @RequestParam(name = "maxFacts", required = false) Integer maxFacts) {
        int effectiveMax = maxFacts == null ? props.getMemory().getMaxFactsForPrompt() : maxFacts;
        return Map.of("context",
                memoryContextService.formatFactsForPrompt(userId, subject, parseTypes(types), effectiveMax));
    }

    @GetMapping("/users/{userId}/export")
    public FactExport export(
            @PathVariable String userId,
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive) {
        return factStore.export(userId, includeInactive);
    }

    @PostMapping("/users/{userId}/import")
    public BatchImportResult importFacts(
            @PathVariable String userId,
            @RequestParam(name = "strategy", required = false) String strategy,
            @RequestBody FactExport export) {
        return factStore.importFacts(userId, export, parseStrategy(strategy));
    }

    @PostMapping("/users/{userId}/batch")
    public BatchImportResult batch(
            @PathVariable String userId,
            @RequestParam(name = "chatId", required = false) String chatId,
            @RequestParam(name = "strategy", required = false) String strategy,
            @RequestBody List<NewFact> candidates) {
        return factStore.batchImport(userId, chatId, candidates, parseStrategy(strategy));
    }

    /**
     * POST /api/facts/users/{userId}/conversations - extracts and stores facts from a conversation.
     */
    @PostMapping("/users/{userId}/conversations")
    public List<Fact> processConversation(
            @PathVariable String userId, @Valid @RequestBody ConversationRequest request) {
        FactExtractionModelConfig modelConfig = new FactExtractionModelConfig(
                request.model(), request.temperature() == null ? 0.0 : request.temperature());
        return memoryContextService.processConversation(userId, request.chatId(), toMessages(request.messages()),
                modelConfig, parseStrategy(request.strategy()));
    }

    private static ConflictStrategy parseStrategy(String strategy) {
        return strategy == null || strategy.isBlank() ? null : ConflictStrategy.fromWireName(strategy);
    }

    private static Set<FactType> parseTypes(List<String> types) {
        if (types == null || types.isEmpty()) {
            return Set.of();
        }
        Set<FactType> parsed = new LinkedHashSet<>();
        for (String type : types) {
            parsed.add(FactType.fromWireName(type));
        }
        return parsed;
    }

    static List<Message> toMessages(List<ConversationRequest.Turn> turns) {
        List<Message> messages = new ArrayList<>(turns.size());
        for (ConversationRequest.Turn turn : turns) {
            String content = turn.content() == null ? "" : turn.content();
            messages.add(switch (turn.role().trim().toLowerCase(Locale.ROOT)) {
                case "user" -> new UserMessage(content);
                case "assistant" -> new AssistantMessage(content);
                case "system" -> new SystemMessage(content);
                default -> throw new IllegalArgumentException("Unknown message role: " + turn.role());
            });
        }
        return messages;
    }
}
