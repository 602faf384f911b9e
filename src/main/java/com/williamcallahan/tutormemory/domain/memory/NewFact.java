package com.williamcallahan.tutormemory.domain.memory;

import java.util.Set;

/**
 * Candidate fact that has not been stored yet, as produced by extraction, manual entry or import.
 *
 * <p>Unlike {@link Fact}, a candidate may carry blank details; batch import reports such
 * candidates as validation errors instead of failing the whole batch.</p>
 *
 * @param chatId chat the candidate came from, if any
 * @param sourceMessageId message the candidate was extracted from, if any
 * @param factType fact category
 * @param subject optional subject
 * @param details fact text
 * @param confidence optional confidence in [0, 1]
 * @param active whether the stored fact starts active
 * @param tags initial tags
 */
public record NewFact(
        String chatId,
        String sourceMessageId,
        FactType factType,
        String subject,
        String details,
        Double confidence,
        boolean active,
        Set<String> tags) {

    public NewFact {
        if (factType == null) {
            throw new IllegalArgumentException("Fact type cannot be null");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * Creates an active candidate without chat, source message or tags.
     */
    public static NewFact of(FactType factType, String subject, String details, Double confidence) {
        return new NewFact(null, null, factType, subject, details, confidence, true, Set.of());
    }

    public boolean hasDetails() {
        return details != null && !details.isBlank();
    }

    public double confidenceOrZero() {
        return confidence == null ? 0.0 : confidence;
    }

    public NewFact withChatId(String newChatId) {
        return new NewFact(newChatId, sourceMessageId, factType, subject, details, confidence, active, tags);
    }
}
