package com.williamcallahan.tutormemory.domain.memory;

/**
 * Candidate fact as returned by the external extraction call.
 *
 * @param factType fact category
 * @param subject optional subject
 * @param details fact text
 * @param confidence optional confidence
 */
public record ExtractedFact(FactType factType, String subject, String details, Double confidence) {

    /**
     * Converts the extracted candidate into a storable candidate for the given chat.
     */
    public NewFact toNewFact(String chatId) {
        return new NewFact(chatId, null, factType, subject, details, confidence, true, null);
    }
}
