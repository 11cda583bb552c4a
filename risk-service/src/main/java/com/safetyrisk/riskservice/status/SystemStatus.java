package com.safetyrisk.riskservice.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.safetyrisk.common.model.ReportingPeriod;

import java.time.Instant;

/**
 * Process-wide status snapshot served at {@code GET /api/v1/risk/status}.
 *
 * @param lastEvaluationAt {@code null} until the first evaluation
 * @param stale            no evaluation yet, or the last one is older than the freshness threshold
 */
public record SystemStatus(
    @JsonProperty("lastEvaluationAt")        Instant lastEvaluationAt,
    @JsonProperty("latestPeriod")            ReportingPeriod latestPeriod,
    @JsonProperty("neighborhoodsEvaluated")  int neighborhoodsEvaluated,
    @JsonProperty("recordsRejected")         int recordsRejected,
    @JsonProperty("alertsRaised")            int alertsRaised,
    @JsonProperty("totalEvaluations")        long totalEvaluations,
    @JsonProperty("cacheHitRate")            double cacheHitRate,
    @JsonProperty("cacheEntries")            int cacheEntries,
    @JsonProperty("stale")                   boolean stale,
    @JsonProperty("checkedAt")               Instant checkedAt
) {}
