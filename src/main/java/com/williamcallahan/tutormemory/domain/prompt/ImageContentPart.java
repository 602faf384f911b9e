package com.williamcallahan.tutormemory.domain.prompt;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * Image part of a multi-part message body. The url is either a data URI or resolved image data,
 * and is empty when a storage path could not be resolved.
 *
 * @param url image data or data URI
 */
@JsonPropertyOrder({"type", "image_url"})
public record ImageContentPart(@JsonIgnore String url) implements ContentPart {

    public static final String TYPE = "image_url";

    public ImageContentPart {
        if (url == null) {
            url = "";
        }
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }

    @JsonProperty("image_url")
    public Map<String, String> imageUrl() {
        return Map.of("url", url);
    }
}
