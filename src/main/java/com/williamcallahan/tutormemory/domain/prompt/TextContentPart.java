package com.williamcallahan.tutormemory.domain.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Text part of a multi-part message body.
 *
 * @param text message text
 */
@JsonPropertyOrder({"type", "text"})
public record TextContentPart(String text) implements ContentPart {

    public static final String TYPE = "text";

    public TextContentPart {
        if (text == null) {
            text = "";
        }
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
