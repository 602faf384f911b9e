package com.williamcallahan.tutormemory.domain.prompt;

/**
 * Text part of a turn-based message.
 *
 * @param text part text
 */
public record TurnPart(String text) {

    public TurnPart {
        if (text == null) {
            text = "";
        }
    }
}
