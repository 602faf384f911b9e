package com.williamcallahan.tutormemory.service.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.tutormemory.domain.memory.ExtractedFact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fact extraction through an OpenAI-compatible chat completions endpoint.
 *
 * <p>The model is asked for a JSON object with a {@code facts} array. Fenced or prefixed JSON is
 * unwrapped before parsing. Facts with an unknown type are kept as {@code other}; facts without
 * details are dropped, and a confidence outside [0, 1] is discarded.</p>
 */
public class OpenAiFactExtractionClient implements FactExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiFactExtractionClient.class);

    static final String SYSTEM_PROMPT = """
            Extract relevant facts, preferences, learning goals, and struggles mentioned by the student \
            in the following conversation. Focus on atomic pieces of information. \
            If no relevant facts are found, return an empty array.

            Respond only with JSON of the form:
            {"facts": [{"fact_type": "...", "subject": "...", "details": "...", "confidence": 0.0}]}
            - fact_type: one of preference, struggle, goal, topic_interest, learning_style, other
            - subject: the academic subject the fact relates to (e.g., Math, Physics), or null
            - details: a concise description of the fact (e.g., "visual learner", "difficulty with fractions")
            - confidence: a number between 0 and 1, or null
            """;

    private final OpenAIClient client;
    private final String defaultModel;
    private final ObjectMapper objectMapper;

    /**
     * Creates the client.
     *
     * @param client configured SDK client, or null when no credentials are available
     * @param defaultModel model used when the call does not name one
     * @param objectMapper mapper for the model's JSON output
     */
    public OpenAiFactExtractionClient(OpenAIClient client, String defaultModel, ObjectMapper objectMapper) {
        this.client = client;
        this.defaultModel = defaultModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public List<ExtractedFact> extract(String conversationText, FactExtractionModelConfig modelConfig) {
        if (client == null) {
            throw new IllegalStateException("Fact extraction client is not configured");
        }
        String model = modelConfig.hasModel() ? modelConfig.model() : defaultModel;
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(conversationText)
                .temperature(modelConfig.temperature())
                .build();

        log.debug("[LLM] Extracting facts with model {}", model);
        ChatCompletion completion = client.chat().completions().create(params);
        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElse("");
        return parseFacts(content);
    }

    /**
     * Parses the model output into candidate facts.
     *
     * @param raw model output
     * @return parsed facts
     * @throws IllegalArgumentException when the output is not the expected JSON
     */
    List<ExtractedFact> parseFacts(String raw) {
        ExtractionPayload payload;
        try {
            payload = objectMapper.reader()
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .forType(ExtractionPayload.class)
                    .readValue(cleanJson(raw));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed fact extraction output", e);
        }
        if (payload == null || payload.facts() == null) {
            return List.of();
        }

        List<ExtractedFact> facts = new ArrayList<>();
        for (RawFact rawFact : payload.facts()) {
            if (rawFact == null || rawFact.details() == null || rawFact.details().isBlank()) {
                continue;
            }
            facts.add(new ExtractedFact(
                    toFactType(rawFact.factType()),
                    rawFact.subject() == null || rawFact.subject().isBlank() ? null : rawFact.subject().trim(),
                    rawFact.details().trim(),
                    validConfidence(rawFact.confidence())));
        }
        return facts;
    }

    private static FactType toFactType(String wireName) {
        if (wireName == null) {
            return FactType.OTHER;
        }
        try {
            return FactType.fromWireName(wireName);
        } catch (IllegalArgumentException unknown) {
            return FactType.OTHER;
        }
    }

    private static Double validConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            return null;
        }
        return confidence;
    }

    static String cleanJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return "{}";
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        if (first >= 0 && last >= first) {
            return trimmed.substring(first, last + 1);
        }
        return trimmed;
    }

    record ExtractionPayload(List<RawFact> facts) {
    }

    record RawFact(
            @JsonProperty("fact_type") String factType,
            String subject,
            String details,
            Double confidence) {
    }
}
