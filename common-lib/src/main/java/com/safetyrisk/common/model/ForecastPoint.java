package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Projected crime count at a flat period index. Never negative. */
public record ForecastPoint(
    @JsonProperty("periodIndex")         long periodIndex,
    @JsonProperty("predictedCrimeCount") double predictedCrimeCount
) {}
