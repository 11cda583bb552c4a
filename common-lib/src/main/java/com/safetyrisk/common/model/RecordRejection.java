package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An input record (or a whole neighborhood) excluded from evaluation, and why. */
public record RecordRejection(
    @JsonProperty("neighborhoodId") String neighborhoodId,
    @JsonProperty("period")         ReportingPeriod period,
    @JsonProperty("reason")         String reason
) {}
