package com.williamcallahan.tutormemory.domain.prompt;

/**
 * Caller-supplied resolution of an image storage path to inline image data.
 *
 * @param messageId message the image belongs to
 * @param path storage path as recorded on the message
 * @param resolvedData data that replaces the path in the formatted content (usually a data URI)
 */
public record MessageImage(String messageId, String path, String resolvedData) {

    public MessageImage {
        if (resolvedData == null) {
            resolvedData = "";
        }
    }
}
