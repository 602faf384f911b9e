package com.williamcallahan.tutormemory.service.retrieval;

import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;

/**
 * Adapts a Spring AI {@link VectorStore} to {@link SourceRetriever}.
 *
 * <p>Search failures are logged and reported as an empty result so prompt assembly can
 * proceed without retrieved context.</p>
 */
public class VectorStoreSourceRetriever implements SourceRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreSourceRetriever.class);

    private final VectorStore vectorStore;

    public VectorStoreSourceRetriever(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public List<SourceItem> retrieve(String query, Filter.Expression filter, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchRequest.Builder request = SearchRequest.builder()
                .query(query)
                .topK(Math.max(1, topK));
        if (filter != null) {
            request.filterExpression(filter);
        }

        List<Document> documents;
        try {
            documents = vectorStore.similaritySearch(request.build());
        } catch (RuntimeException e) {
            log.warn("Vector search unavailable; continuing without retrieved sources: {}", e.getMessage());
            return List.of();
        }
        if (documents == null) {
            return List.of();
        }

        List<SourceItem> sources = new ArrayList<>(documents.size());
        for (Document document : documents) {
            String text = document.getText();
            if (text != null && !text.isBlank()) {
                sources.add(new SourceItem(document.getId(), text));
            }
        }
        log.debug("Vector search returned {} sources for topK {}", sources.size(), topK);
        return sources;
    }
}
