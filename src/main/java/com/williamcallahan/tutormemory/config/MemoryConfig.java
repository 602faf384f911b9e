package com.williamcallahan.tutormemory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Striped;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.williamcallahan.tutormemory.application.prompt.CharacterTokenCounter;
import com.williamcallahan.tutormemory.application.prompt.JtokkitTokenCounter;
import com.williamcallahan.tutormemory.application.prompt.TokenCounter;
import com.williamcallahan.tutormemory.repository.FactRepository;
import com.williamcallahan.tutormemory.repository.InMemoryFactRepository;
import com.williamcallahan.tutormemory.service.extraction.FactExtractionClient;
import com.williamcallahan.tutormemory.service.extraction.OpenAiFactExtractionClient;
import com.williamcallahan.tutormemory.service.retrieval.SourceRetriever;
import com.williamcallahan.tutormemory.service.retrieval.VectorStoreSourceRetriever;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the fact store, prompt token counting and the external model collaborators.
 */
@Configuration
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    static final String TOKENIZER_CL100K = "cl100k";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Token counter selected by {@code app.prompt.tokenizer}: {@code cl100k} for BPE counting,
     * anything else for character counting.
     */
    @Bean
    @ConditionalOnMissingBean
    public TokenCounter tokenCounter(AppProperties props) {
        String tokenizer = props.getPrompt().getTokenizer();
        if (tokenizer != null && TOKENIZER_CL100K.equals(tokenizer.trim().toLowerCase(Locale.ROOT))) {
            log.info("Using cl100k_base token counting for prompt budgets");
            return new JtokkitTokenCounter();
        }
        log.info("Using character-length token counting for prompt budgets");
        return new CharacterTokenCounter();
    }

    @Bean
    @ConditionalOnMissingBean
    public FactRepository factRepository() {
        return new InMemoryFactRepository();
    }

    /**
     * Locks serializing conflict resolution per (user, type, subject) key.
     */
    @Bean
    public Striped<Lock> factKeyLocks(AppProperties props) {
        return Striped.lock(props.getMemory().getLockStripes());
    }

    @Bean
    @ConditionalOnMissingBean
    public FactExtractionClient factExtractionClient(AppProperties props, ObjectMapper objectMapper) {
        AppProperties.Extraction extraction = props.getExtraction();
        OpenAIClient client = null;
        if (extraction.getApiKey() != null && !extraction.getApiKey().isBlank()) {
            log.info("Initializing fact extraction client for {}", extraction.getBaseUrl());
            client = OpenAIOkHttpClient.builder()
                    .apiKey(extraction.getApiKey())
                    .baseUrl(extraction.getBaseUrl())
                    .timeout(Duration.ofSeconds(extraction.getTimeoutSeconds()))
                    .build();
        } else {
            log.warn("No extraction API key configured (app.extraction.api-key) - fact extraction will return no facts");
        }
        return new OpenAiFactExtractionClient(client, extraction.getModel(), objectMapper);
    }

    /**
     * Source retriever backed by the application's {@link VectorStore} when one is configured,
     * otherwise a retriever that finds nothing.
     */
    @Bean
    @ConditionalOnMissingBean
    public SourceRetriever sourceRetriever(ObjectProvider<VectorStore> vectorStore) {
        VectorStore store = vectorStore.getIfAvailable();
        if (store == null) {
            log.info("No vector store configured - conversation memory retrieval disabled");
            return (query, filter, topK) -> List.of();
        }
        return new VectorStoreSourceRetriever(store);
    }
}
