package com.safetyrisk.riskservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.safetyrisk.common.model.SeriesPoint;

import java.util.List;

/**
 * Body of {@code POST /api/v1/risk/forecast}.
 *
 * @param horizon number of periods to project; the configured horizon when absent
 */
public record ForecastRequest(
    @JsonProperty("series")  List<SeriesPoint> series,
    @JsonProperty("horizon") Integer horizon
) {}
