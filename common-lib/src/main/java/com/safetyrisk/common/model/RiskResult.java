package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Evaluation outcome for one neighborhood.
 *
 * <p>{@code forecast} is {@code null} when the neighborhood has fewer than two
 * reporting periods; it is left out of the JSON rather than rendered as a flat line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskResult(
    @JsonProperty("neighborhoodId")     String neighborhoodId,
    @JsonProperty("latestPeriod")       ReportingPeriod latestPeriod,
    @JsonProperty("periodsAggregated")  int periodsAggregated,
    @JsonProperty("score")              double score,
    @JsonProperty("tier")               RiskTier tier,
    @JsonProperty("breakdown")          ScoreBreakdown breakdown,
    @JsonProperty("effectiveness")      Effectiveness effectiveness,
    @JsonProperty("trend")              TrendDirection trend,
    @JsonProperty("forecast")           List<PeriodForecast> forecast,
    @JsonProperty("recommendations")    List<String> recommendations
) {
    public boolean hasForecast() {
        return forecast != null;
    }
}
