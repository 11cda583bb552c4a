package com.safetyrisk.common.scoring;

import com.safetyrisk.common.config.ScoringWeights;
import com.safetyrisk.common.model.DominantIndicator;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.ScoreBreakdown;

/**
 * Stateless calculator that turns one neighborhood's aggregated indicators into a
 * non-negative risk score.
 *
 * <p><b>Formula</b> (default weights):
 * <pre>
 *   score = crimeCount
 *         + 75 × deathsInIntervention
 *         − 3  × arrests
 *         − 8  × weaponsSeized
 *         − 5  × drugsSeizedKg
 *         − 2  × (1 if an operation is active else 0)
 *   score = max(score, 0)
 * </pre>
 *
 * <p>Deaths in police interventions dominate; enforcement outcomes discount the crime
 * tally and can offset it completely, but the score never goes below zero.
 *
 * <p><b>Dominant indicator</b>: the term with the largest magnitude. Ties resolve in the
 * order deaths, crime count, weapons, drugs, arrests, operation; all-zero terms give
 * {@link DominantIndicator#NONE}.
 *
 * <p>Weights are injected, never hard-coded, so they can be tuned from configuration.
 */
public final class RiskScoreCalculator {

    private final ScoringWeights weights;

    public RiskScoreCalculator() {
        this(ScoringWeights.DEFAULTS);
    }

    public RiskScoreCalculator(ScoringWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Scoring weights are required");
        }
        this.weights = weights;
    }

    public ScoringWeights weights() {
        return weights;
    }

    /**
     * @param indicators validated, aggregated indicators of one neighborhood
     * @return clamped risk score, {@code >= 0}
     */
    public double computeScore(IndicatorRecord indicators) {
        return breakdown(indicators).score();
    }

    /**
     * Computes every signed term together with the raw and clamped score.
     */
    public ScoreBreakdown breakdown(IndicatorRecord indicators) {
        double crimeTerm     = weights.crimeCount() * indicators.crimeCount();
        double deathsTerm    = weights.deathsInIntervention() * indicators.deathsInIntervention();
        double arrestsTerm   = weights.arrests() * indicators.arrests();
        double weaponsTerm   = weights.weaponsSeized() * indicators.weaponsSeized();
        double drugsTerm     = weights.drugsSeizedKg() * indicators.drugsSeizedKg();
        double operationTerm = indicators.hasActiveOperation() ? weights.activeOperation() : 0.0;

        double raw = crimeTerm + deathsTerm + arrestsTerm + weaponsTerm + drugsTerm + operationTerm;
        double score = Math.max(raw, 0.0);

        DominantIndicator dominant = dominantOf(
            crimeTerm, deathsTerm, arrestsTerm, weaponsTerm, drugsTerm, operationTerm);

        return new ScoreBreakdown(crimeTerm, deathsTerm, arrestsTerm, weaponsTerm, drugsTerm,
            operationTerm, raw, score, dominant);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static DominantIndicator dominantOf(double crimeTerm, double deathsTerm, double arrestsTerm,
                                        double weaponsTerm, double drugsTerm, double operationTerm) {
        // tie-break order
        DominantIndicator[] candidates = {
            DominantIndicator.DEATHS_IN_INTERVENTION,
            DominantIndicator.CRIME_COUNT,
            DominantIndicator.WEAPONS_SEIZED,
            DominantIndicator.DRUGS_SEIZED,
            DominantIndicator.ARRESTS,
            DominantIndicator.ACTIVE_OPERATION
        };
        double[] magnitudes = {
            Math.abs(deathsTerm),
            Math.abs(crimeTerm),
            Math.abs(weaponsTerm),
            Math.abs(drugsTerm),
            Math.abs(arrestsTerm),
            Math.abs(operationTerm)
        };

        DominantIndicator dominant = DominantIndicator.NONE;
        double largest = 0.0;
        for (int i = 0; i < candidates.length; i++) {
            if (magnitudes[i] > largest) {
                largest = magnitudes[i];
                dominant = candidates[i];
            }
        }
        return dominant;
    }
}
