package com.williamcallahan.tutormemory.domain.prompt;

/**
 * Persona the model is asked to play. Only the name participates in prompt composition.
 *
 * @param id assistant identifier
 * @param name display name injected into the role block
 */
public record AssistantIdentity(String id, String name) {

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
