package com.williamcallahan.tutormemory.domain.memory;

import java.util.List;

/**
 * One page of search results.
 *
 * @param facts facts on this page
 * @param totalCount number of facts matching the filters, ignoring paging
 * @param hasMore true when {@code offset + limit < totalCount}
 */
public record FactSearchPage(List<Fact> facts, long totalCount, boolean hasMore) {

    public FactSearchPage {
        facts = facts == null ? List.of() : List.copyOf(facts);
    }
}
