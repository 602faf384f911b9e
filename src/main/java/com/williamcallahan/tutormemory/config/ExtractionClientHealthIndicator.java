package com.williamcallahan.tutormemory.config;

import com.williamcallahan.tutormemory.service.extraction.FactExtractionClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the fact extraction model client.
 *
 * <p>Reports configuration only; no model call is made. An unconfigured client is UNKNOWN
 * rather than DOWN because extraction degrades to no facts.</p>
 */
@Component
public class ExtractionClientHealthIndicator implements HealthIndicator {

    /** Health detail key for the configured model. */
    private static final String DETAIL_KEY_MODEL = "model";
    /** Health detail key for human-readable status message. */
    private static final String DETAIL_KEY_STATUS = "status";

    private final FactExtractionClient extractionClient;
    private final AppProperties props;

    public ExtractionClientHealthIndicator(FactExtractionClient extractionClient, AppProperties props) {
        this.extractionClient = extractionClient;
        this.props = props;
    }

    @Override
    public Health health() {
        String model = props.getExtraction().getModel();
        if (extractionClient.isAvailable()) {
            return Health.up()
                    .withDetail(DETAIL_KEY_MODEL, model)
                    .withDetail(DETAIL_KEY_STATUS, "Extraction client configured")
                    .build();
        }
        return Health.unknown()
                .withDetail(DETAIL_KEY_MODEL, model)
                .withDetail(DETAIL_KEY_STATUS, "No API key configured; extraction returns no facts")
                .build();
    }
}
