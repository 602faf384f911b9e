package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.domain.memory.FactType;
import com.williamcallahan.tutormemory.domain.memory.NewFact;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Set;

/**
 * Body of a single-fact write.
 *
 * @param userId owning user
 * @param chatId conversation the fact came from, optional
 * @param sourceMessageId message the fact came from, optional
 * @param factType fact category
 * @param subject optional subject
 * @param details fact text
 * @param confidence optional confidence in [0, 1]
 * @param active whether the fact starts active; defaults to true
 * @param tags optional tags
 * @param strategy conflict strategy wire name; used only by the resolving endpoint
 */
public record FactRequest(
        @NotBlank String userId,
        String chatId,
        String sourceMessageId,
        @NotNull FactType factType,
        String subject,
        @NotBlank String details,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
        Boolean active,
        Set<String> tags,
        String strategy) {

    public NewFact toNewFact() {
        return new NewFact(chatId, sourceMessageId, factType, subject, details, confidence,
                active == null || active, tags);
    }
}
