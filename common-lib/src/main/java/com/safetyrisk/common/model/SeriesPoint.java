package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One observation of a crime-count time series. */
public record SeriesPoint(
    @JsonProperty("periodIndex") long periodIndex,
    @JsonProperty("crimeCount")  int crimeCount
) {}
