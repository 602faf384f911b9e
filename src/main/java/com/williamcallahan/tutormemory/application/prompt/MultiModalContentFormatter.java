package com.williamcallahan.tutormemory.application.prompt;

import com.williamcallahan.tutormemory.domain.prompt.AssembledMessage;
import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.ContentPart;
import com.williamcallahan.tutormemory.domain.prompt.ImageContentPart;
import com.williamcallahan.tutormemory.domain.prompt.MessageImage;
import com.williamcallahan.tutormemory.domain.prompt.TextContentPart;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts chat messages into the flat provider representation, expanding image references
 * into multi-part content.
 */
@Component
public class MultiModalContentFormatter {

    private static final Logger log = LoggerFactory.getLogger(MultiModalContentFormatter.class);

    static final String DATA_IMAGE_PREFIX = "data:image";

    /**
     * Formats one message.
     *
     * <p>A message without images keeps plain text content. Otherwise the content becomes a text
     * part followed by one image part per image path, in order. Inline data URIs pass through;
     * storage paths are resolved against {@code images} by exact message id and path, and
     * unresolved paths yield an empty image reference.</p>
     *
     * @param message message to format
     * @param images caller-resolved image data
     * @return formatted message
     */
    public AssembledMessage format(ChatMessage message, List<MessageImage> images) {
        String role = message.role().wireName();
        if (!message.hasImages()) {
            return AssembledMessage.ofText(role, message.content());
        }

        List<ContentPart> parts = new ArrayList<>();
        parts.add(new TextContentPart(message.content()));
        for (String path : message.imagePaths()) {
            parts.add(new ImageContentPart(resolveImage(message.id(), path, images)));
        }
        return AssembledMessage.ofParts(role, parts);
    }

    /**
     * Formats every message of a window, preserving order.
     */
    public List<AssembledMessage> formatAll(List<ChatMessage> messages, List<MessageImage> images) {
        List<AssembledMessage> formatted = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            formatted.add(format(message, images));
        }
        return formatted;
    }

    private static String resolveImage(String messageId, String path, List<MessageImage> images) {
        if (path != null && path.startsWith(DATA_IMAGE_PREFIX)) {
            return path;
        }
        if (images != null) {
            for (MessageImage image : images) {
                if (messageId.equals(image.messageId()) && path != null && path.equals(image.path())) {
                    return image.resolvedData();
                }
            }
        }
        log.debug("No image data resolved for message {} path {}", messageId, path);
        return "";
    }
}
