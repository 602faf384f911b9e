package com.williamcallahan.tutormemory.application.prompt;

import com.williamcallahan.tutormemory.domain.prompt.ChatMessage;
import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Appends retrieved source blocks to messages of an already-allocated context window.
 *
 * <p>Two rules apply independently:</p>
 * <ul>
 *   <li>message-level sources are appended to the last (newest) included message;</li>
 *   <li>chat-level sources referenced by an included message are appended to the message
 *       immediately before it in the window. A reference from the first message of the window
 *       has no target and is dropped.</li>
 * </ul>
 *
 * <p>Injection runs after budget allocation, so injected text is not part of the reported
 * token usage and the assembled prompt can exceed the nominal budget.</p>
 */
@Component
public class RetrievalInjector {

    static final String SOURCES_HEADER = "You may use the following sources:";
    static final String BLOCK_SEPARATOR = "\n\n";

    /**
     * Applies both injection rules.
     *
     * @param window included messages, oldest first
     * @param messageLevelSources sources retrieved for the newest message
     * @param chatLevelSources chat-level sources that messages may reference
     * @return a new window with augmented copies of the affected messages
     */
    public List<ChatMessage> inject(
            List<ChatMessage> window, List<SourceItem> messageLevelSources, List<SourceItem> chatLevelSources) {
        List<ChatMessage> augmented = injectChatLevelSources(window, chatLevelSources);
        return injectMessageLevelSources(augmented, messageLevelSources);
    }

    /**
     * Appends message-level sources to the newest message of the window.
     */
    public List<ChatMessage> injectMessageLevelSources(List<ChatMessage> window, List<SourceItem> sources) {
        if (window.isEmpty() || sources == null || sources.isEmpty()) {
            return List.copyOf(window);
        }
        List<ChatMessage> augmented = new ArrayList<>(window);
        int lastIndex = augmented.size() - 1;
        ChatMessage last = augmented.get(lastIndex);
        augmented.set(lastIndex, last.withContent(last.content() + BLOCK_SEPARATOR + buildRetrievalText(sources)));
        return List.copyOf(augmented);
    }

    /**
     * Appends chat-level sources to the message preceding each referencing message.
     */
    public List<ChatMessage> injectChatLevelSources(List<ChatMessage> window, List<SourceItem> chatLevelSources) {
        if (window.isEmpty() || chatLevelSources == null || chatLevelSources.isEmpty()) {
            return List.copyOf(window);
        }
        Map<String, SourceItem> sourcesById = new LinkedHashMap<>();
        for (SourceItem source : chatLevelSources) {
            sourcesById.putIfAbsent(source.id(), source);
        }

        Map<Integer, List<SourceItem>> sourcesByTarget = new LinkedHashMap<>();
        for (int index = 1; index < window.size(); index++) {
            for (String sourceId : window.get(index).attachedSourceIds()) {
                SourceItem source = sourcesById.get(sourceId);
                if (source != null) {
                    sourcesByTarget.computeIfAbsent(index - 1, k -> new ArrayList<>()).add(source);
                }
            }
        }

        List<ChatMessage> augmented = new ArrayList<>(window);
        sourcesByTarget.forEach((targetIndex, sources) -> {
            ChatMessage target = augmented.get(targetIndex);
            augmented.set(targetIndex,
                    target.withContent(target.content() + BLOCK_SEPARATOR + buildRetrievalText(sources)));
        });
        return List.copyOf(augmented);
    }

    /**
     * Formats sources as a header followed by delimited source blocks.
     *
     * @param sources sources in injection order
     * @return retrieval text to append to a message
     */
    public static String buildRetrievalText(List<SourceItem> sources) {
        StringBuilder text = new StringBuilder(SOURCES_HEADER);
        for (SourceItem source : sources) {
            text.append(BLOCK_SEPARATOR).append(formatSourceBlock(source));
        }
        return text.toString();
    }

    static String formatSourceBlock(SourceItem source) {
        return "<BEGIN SOURCE>\n" + source.content() + "\n</END SOURCE>";
    }
}
