package com.safetyrisk.common.config;

/**
 * Effectiveness ratio parameters.
 *
 * <pre>
 *   ratio = clamp((arrestWeight × arrests + weaponWeight × weaponsSeized + drugKgWeight × drugsSeizedKg)
 *                 / denominator, 0, 1)
 * </pre>
 *
 * Band thresholds: {@code ratio >= highThreshold} is HIGH, {@code >= lowThreshold} MEDIUM, else LOW.
 */
public record EffectivenessSettings(
    EffectivenessDenominator denominator,
    double arrestWeight,
    double weaponWeight,
    double drugKgWeight,
    double lowThreshold,
    double highThreshold
) {
    public static final EffectivenessSettings DEFAULTS =
        new EffectivenessSettings(EffectivenessDenominator.CRIME_COUNT, 1.0, 1.0, 1.0, 0.15, 0.30);

    public EffectivenessSettings {
        if (denominator == null) {
            throw new IllegalArgumentException("Effectiveness denominator is required");
        }
        if (arrestWeight < 0 || weaponWeight < 0 || drugKgWeight < 0) {
            throw new IllegalArgumentException("Effectiveness weights must be non-negative");
        }
        if (lowThreshold < 0 || highThreshold > 1 || lowThreshold > highThreshold) {
            throw new IllegalArgumentException(
                "Effectiveness thresholds must satisfy 0 <= low <= high <= 1: " + lowThreshold + ", " + highThreshold);
        }
    }
}
