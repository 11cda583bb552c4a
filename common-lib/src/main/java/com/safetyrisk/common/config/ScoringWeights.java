package com.safetyrisk.common.config;

/**
 * Signed coefficients of the synergistic risk score.
 *
 * <pre>
 *   score = crimeCount            × crimeCount
 *         + deathsInIntervention  × deathsInIntervention
 *         + arrests               × arrests
 *         + weaponsSeized         × weaponsSeized
 *         + drugsSeizedKg         × drugsSeizedKg
 *         + activeOperation       × (1 if an operation is active else 0)
 *   score = max(score, 0)
 * </pre>
 *
 * Enforcement outcomes carry negative coefficients so they discount the crime tally.
 */
public record ScoringWeights(
    double crimeCount,
    double deathsInIntervention,
    double arrests,
    double weaponsSeized,
    double drugsSeizedKg,
    double activeOperation
) {
    public static final ScoringWeights DEFAULTS = new ScoringWeights(1.0, 75.0, -3.0, -8.0, -5.0, -2.0);

    public ScoringWeights {
        requireFinite("crimeCount", crimeCount);
        requireFinite("deathsInIntervention", deathsInIntervention);
        requireFinite("arrests", arrests);
        requireFinite("weaponsSeized", weaponsSeized);
        requireFinite("drugsSeizedKg", drugsSeizedKg);
        requireFinite("activeOperation", activeOperation);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Scoring weight '" + name + "' must be finite: " + value);
        }
    }
}
