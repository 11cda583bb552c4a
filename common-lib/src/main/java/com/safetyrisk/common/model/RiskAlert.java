package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attention signal raised from the latest reporting periods of a neighborhood.
 * {@code value} holds the number that triggered the alert (count, relative increase or deaths).
 */
public record RiskAlert(
    @JsonProperty("type")           AlertType type,
    @JsonProperty("priority")       AlertPriority priority,
    @JsonProperty("neighborhoodId") String neighborhoodId,
    @JsonProperty("description")    String description,
    @JsonProperty("value")          double value
) {

    public enum AlertType {
        HIGH_VOLUME,
        SIGNIFICANT_INCREASE,
        INTERVENTION_DEATHS
    }

    /** Declared most urgent first; ordinal order is the report sort order. */
    public enum AlertPriority {
        CRITICAL,
        HIGH,
        MEDIUM,
        LOW
    }
}
