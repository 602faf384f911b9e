package com.williamcallahan.tutormemory.service.retrieval;

import com.williamcallahan.tutormemory.domain.prompt.SourceItem;
import java.util.List;
import org.springframework.ai.vectorstore.filter.Filter;

/**
 * Nearest-neighbour lookup of source snippets. Results are ranked most similar first.
 */
@FunctionalInterface
public interface SourceRetriever {

    /**
     * Retrieves snippets similar to a query.
     *
     * @param query free-text query
     * @param filter metadata filter, or null for none
     * @param topK maximum number of snippets
     * @return ranked snippets, empty when nothing matches or the index is unavailable
     */
    List<SourceItem> retrieve(String query, Filter.Expression filter, int topK);
}
