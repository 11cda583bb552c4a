package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Least-squares line {@code crimeCount = intercept + slope * periodIndex}. */
public record LinearTrend(
    @JsonProperty("slope")     double slope,
    @JsonProperty("intercept") double intercept
) {
    public double valueAt(long periodIndex) {
        return intercept + slope * periodIndex;
    }
}
