package com.williamcallahan.tutormemory.domain.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stored atomic fact about a user.
 *
 * <p>Facts are soft-deleted: {@code active=false} marks a fact as logically removed while keeping
 * it for audit and export. No uniqueness is enforced on (userId, factType, subject); several
 * active facts may describe the same subject until conflict resolution consolidates them.</p>
 *
 * @param id fact identifier
 * @param userId owning user
 * @param chatId chat the fact was discovered in, if any
 * @param sourceMessageId message the fact was extracted from, if any
 * @param factType fact category
 * @param subject optional subject the fact relates to
 * @param details non-empty fact text
 * @param confidence optional confidence in [0, 1]
 * @param active soft-delete flag
 * @param tags free-form tags, insertion ordered
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record Fact(
        String id,
        String userId,
        String chatId,
        String sourceMessageId,
        FactType factType,
        String subject,
        String details,
        Double confidence,
        boolean active,
        Set<String> tags,
        Instant createdAt,
        Instant updatedAt) {

    /**
     * Creates a fact, enforcing the non-empty details and confidence range invariants.
     *
     * @throws IllegalArgumentException if an invariant is violated
     */
    public Fact {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be blank");
        }
        if (factType == null) {
            throw new IllegalArgumentException("Fact type cannot be null");
        }
        if (details == null || details.isBlank()) {
            throw new IllegalArgumentException("Fact details cannot be empty");
        }
        validateConfidence(confidence);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    static void validateConfidence(Double confidence) {
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
        }
    }

    public boolean hasSubject() {
        return subject != null && !subject.isBlank();
    }

    /**
     * Confidence with absent values read as zero, as used by confidence comparisons.
     */
    public double confidenceOrZero() {
        return confidence == null ? 0.0 : confidence;
    }

    /**
     * Timestamp used for recency ordering: updatedAt, falling back to createdAt.
     */
    public Instant lastTouched() {
        return updatedAt != null ? updatedAt : createdAt;
    }

    public Fact withId(String newId) {
        return new Fact(newId, userId, chatId, sourceMessageId, factType, subject, details, confidence, active,
                tags, createdAt, updatedAt);
    }

    public Fact withActive(boolean newActive, Instant touchedAt) {
        return new Fact(id, userId, chatId, sourceMessageId, factType, subject, details, confidence, newActive,
                tags, createdAt, touchedAt);
    }

    public Fact withDetailsAndConfidence(String newDetails, Double newConfidence, Instant touchedAt) {
        return new Fact(id, userId, chatId, sourceMessageId, factType, subject, newDetails, newConfidence, active,
                tags, createdAt, touchedAt);
    }

    public Fact withConfidence(Double newConfidence, Instant touchedAt) {
        return new Fact(id, userId, chatId, sourceMessageId, factType, subject, details, newConfidence, active,
                tags, createdAt, touchedAt);
    }

    public Fact withTags(Set<String> newTags, Instant touchedAt) {
        return new Fact(id, userId, chatId, sourceMessageId, factType, subject, details, confidence, active,
                newTags, createdAt, touchedAt);
    }
}
