package com.williamcallahan.tutormemory.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.tutormemory.application.prompt.CharacterTokenCounter;
import com.williamcallahan.tutormemory.application.prompt.JtokkitTokenCounter;
import com.williamcallahan.tutormemory.service.retrieval.SourceRetriever;
import com.williamcallahan.tutormemory.service.retrieval.VectorStoreSourceRetriever;
import org.junit.jupiter.api.Test;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Verifies bean selection driven by configuration.
 */
class MemoryConfigTest {

    private final MemoryConfig config = new MemoryConfig();

    @Test
    void selectsTokenCounterFromTokenizerSetting() {
        AppProperties props = new AppProperties();
        assertInstanceOf(CharacterTokenCounter.class, config.tokenCounter(props));

        props.getPrompt().setTokenizer(" CL100K ");
        assertInstanceOf(JtokkitTokenCounter.class, config.tokenCounter(props));
    }

    @Test
    void extractionClientUnavailableWithoutApiKey() {
        AppProperties props = new AppProperties();
        props.getExtraction().setApiKey(" ");

        assertFalse(config.factExtractionClient(props, new ObjectMapper()).isAvailable());
    }

    @Test
    @SuppressWarnings("unchecked")
    void sourceRetrieverFallsBackWhenNoVectorStore() {
        ObjectProvider<VectorStore> missing = mock(ObjectProvider.class);
        when(missing.getIfAvailable()).thenReturn(null);

        SourceRetriever retriever = config.sourceRetriever(missing);

        assertTrue(retriever.retrieve("fractions", null, 4).isEmpty());

        ObjectProvider<VectorStore> present = mock(ObjectProvider.class);
        when(present.getIfAvailable()).thenReturn(mock(VectorStore.class));
        assertInstanceOf(VectorStoreSourceRetriever.class, config.sourceRetriever(present));
    }
}
