package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@link ForecastPoint} mapped back onto a {@link ReportingPeriod}. */
public record PeriodForecast(
    @JsonProperty("period")              ReportingPeriod period,
    @JsonProperty("predictedCrimeCount") double predictedCrimeCount
) {}
