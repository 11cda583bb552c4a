package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one evaluation of an indicator table: a result per evaluable neighborhood,
 * the rejected records, and the alerts raised across the table.
 */
public record EvaluationReport(
    @JsonProperty("results")    List<RiskResult> results,
    @JsonProperty("rejections") List<RecordRejection> rejections,
    @JsonProperty("alerts")     List<RiskAlert> alerts
) {
    public EvaluationReport {
        results = List.copyOf(results);
        rejections = List.copyOf(rejections);
        alerts = List.copyOf(alerts);
    }
}
