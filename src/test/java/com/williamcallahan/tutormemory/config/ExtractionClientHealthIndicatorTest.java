package com.williamcallahan.tutormemory.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.tutormemory.service.extraction.FactExtractionClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Verifies that the extraction health check reflects client configuration.
 */
class ExtractionClientHealthIndicatorTest {

    @Test
    void health_upWhenClientConfigured() {
        FactExtractionClient client = mock(FactExtractionClient.class);
        when(client.isAvailable()).thenReturn(true);

        Health health = new ExtractionClientHealthIndicator(client, new AppProperties()).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("gpt-4o-mini", health.getDetails().get("model"));
    }

    @Test
    void health_unknownWithoutCredentials() {
        FactExtractionClient client = mock(FactExtractionClient.class);
        when(client.isAvailable()).thenReturn(false);

        Health health = new ExtractionClientHealthIndicator(client, new AppProperties()).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
    }
}
