package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed contribution of every indicator to the risk score.
 *
 * <p>{@code rawScore} is the plain sum of the terms; {@code score} is the same sum
 * clamped at zero.
 */
public record ScoreBreakdown(
    @JsonProperty("crimeTerm")          double crimeTerm,
    @JsonProperty("deathsTerm")         double deathsTerm,
    @JsonProperty("arrestsTerm")        double arrestsTerm,
    @JsonProperty("weaponsTerm")        double weaponsTerm,
    @JsonProperty("drugsTerm")          double drugsTerm,
    @JsonProperty("operationTerm")      double operationTerm,
    @JsonProperty("rawScore")           double rawScore,
    @JsonProperty("score")              double score,
    @JsonProperty("dominantIndicator")  DominantIndicator dominantIndicator
) {}
