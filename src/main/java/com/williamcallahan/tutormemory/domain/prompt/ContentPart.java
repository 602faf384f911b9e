package com.williamcallahan.tutormemory.domain.prompt;

/**
 * One part of a multi-part message body.
 *
 * <p>Sealed so formatters and provider adapters handle every part kind exhaustively.</p>
 */
public sealed interface ContentPart permits TextContentPart, ImageContentPart {

    /**
     * Provider-neutral part discriminator ("text" or "image_url").
     *
     * @return part type name
     */
    String type();
}
