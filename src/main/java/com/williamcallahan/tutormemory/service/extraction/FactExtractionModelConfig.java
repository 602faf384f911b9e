package com.williamcallahan.tutormemory.service.extraction;

/**
 * Model settings for one extraction call.
 *
 * @param model model identifier, blank to use the client's configured default
 * @param temperature sampling temperature; extraction runs deterministic by default
 */
public record FactExtractionModelConfig(String model, double temperature) {

    public static final double DEFAULT_TEMPERATURE = 0.0;

    public FactExtractionModelConfig {
        if (!Double.isFinite(temperature) || temperature < 0.0) {
            throw new IllegalArgumentException("Temperature must be a finite non-negative number");
        }
    }

    /**
     * Uses the configured default model at temperature zero.
     */
    public static FactExtractionModelConfig defaults() {
        return new FactExtractionModelConfig(null, DEFAULT_TEMPERATURE);
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
