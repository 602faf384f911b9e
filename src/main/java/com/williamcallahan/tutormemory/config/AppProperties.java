package com.williamcallahan.tutormemory.config;

import com.williamcallahan.tutormemory.domain.memory.ConflictStrategy;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Prompt prompt = new Prompt();
    private Memory memory = new Memory();
    private Extraction extraction = new Extraction();

    public Prompt getPrompt() {
        return prompt;
    }

    public void setPrompt(Prompt prompt) {
        this.prompt = prompt;
    }

    public Memory getMemory() {
        return memory;
    }

    public void setMemory(Memory memory) {
        this.memory = memory;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    /**
     * Rejects settings that would make prompt assembly or conflict resolution misbehave.
     *
     * @throws IllegalArgumentException when a numeric setting is out of range
     * @throws com.williamcallahan.tutormemory.domain.errors.UnsupportedConflictStrategyException when a strategy is unknown
     */
    @PostConstruct
    public void validateConfiguration() {
        if (memory.getMaxFactsForPrompt() <= 0) {
            throw new IllegalArgumentException("app.memory.max-facts-for-prompt must be positive");
        }
        if (memory.getMaxFactsPerType() <= 0) {
            throw new IllegalArgumentException("app.memory.max-facts-per-type must be positive");
        }
        if (memory.getRecentSubjectWindowDays() <= 0) {
            throw new IllegalArgumentException("app.memory.recent-subject-window-days must be positive");
        }
        if (memory.getLockStripes() <= 0) {
            throw new IllegalArgumentException("app.memory.lock-stripes must be positive");
        }
        if (memory.getMemoryTopK() <= 0) {
            throw new IllegalArgumentException("app.memory.memory-top-k must be positive");
        }
        if (extraction.getTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("app.extraction.timeout-seconds must be positive");
        }
        memory.defaultStrategy();
        memory.importStrategy();
    }

    public static class Prompt {
        private String tokenizer = "character";

        public String getTokenizer() { return tokenizer; }
        public void setTokenizer(String tokenizer) { this.tokenizer = tokenizer; }
    }

    public static class Memory {
        private int maxFactsForPrompt = 15;
        private int maxFactsPerType = 3;
        private int relevantFactsLimit = 10;
        private String defaultConflictStrategy = "prefer_high_confidence";
        private String importConflictStrategy = "skip_duplicates";
        private int recentSubjectWindowDays = 30;
        private int lockStripes = 64;
        private int memoryTopK = 4;

        public int getMaxFactsForPrompt() {
            return maxFactsForPrompt;
        }

        public void setMaxFactsForPrompt(int maxFactsForPrompt) {
            this.maxFactsForPrompt = maxFactsForPrompt;
        }

        public int getMaxFactsPerType() {
            return maxFactsPerType;
        }

        public void setMaxFactsPerType(int maxFactsPerType) {
            this.maxFactsPerType = maxFactsPerType;
        }

        public int getRelevantFactsLimit() {
            return relevantFactsLimit;
        }

        public void setRelevantFactsLimit(int relevantFactsLimit) {
            this.relevantFactsLimit = relevantFactsLimit;
        }

        public String getDefaultConflictStrategy() {
            return defaultConflictStrategy;
        }

        public void setDefaultConflictStrategy(String defaultConflictStrategy) {
            this.defaultConflictStrategy = defaultConflictStrategy;
        }

        public String getImportConflictStrategy() {
            return importConflictStrategy;
        }

        public void setImportConflictStrategy(String importConflictStrategy) {
            this.importConflictStrategy = importConflictStrategy;
        }

        public int getRecentSubjectWindowDays() {
            return recentSubjectWindowDays;
        }

        public void setRecentSubjectWindowDays(int recentSubjectWindowDays) {
            this.recentSubjectWindowDays = recentSubjectWindowDays;
        }

        public int getLockStripes() {
            return lockStripes;
        }

        public void setLockStripes(int lockStripes) {
            this.lockStripes = lockStripes;
        }

        public int getMemoryTopK() {
            return memoryTopK;
        }

        public void setMemoryTopK(int memoryTopK) {
            this.memoryTopK = memoryTopK;
        }

        public ConflictStrategy defaultStrategy() {
            return ConflictStrategy.fromWireName(defaultConflictStrategy);
        }

        public ConflictStrategy importStrategy() {
            return ConflictStrategy.fromWireName(importConflictStrategy);
        }
    }

    public static class Extraction {
        private String model = "gpt-4o-mini";
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private int timeoutSeconds = 30;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
