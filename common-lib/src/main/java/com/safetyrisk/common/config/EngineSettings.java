package com.safetyrisk.common.config;

/**
 * Every tunable of the risk engine. {@link #DEFAULTS} reproduces the reference weights,
 * tier table and a seven-period forecast horizon.
 *
 * @param aggregationWindow number of most recent periods summed for scoring; 0 sums all periods
 */
public record EngineSettings(
    ScoringWeights weights,
    TierBreakpoints tiers,
    EffectivenessSettings effectiveness,
    ForecastSettings forecast,
    AlertSettings alerts,
    int aggregationWindow
) {
    public static final EngineSettings DEFAULTS = new EngineSettings(
        ScoringWeights.DEFAULTS,
        TierBreakpoints.DEFAULTS,
        EffectivenessSettings.DEFAULTS,
        ForecastSettings.DEFAULTS,
        AlertSettings.DEFAULTS,
        0);

    public EngineSettings {
        if (weights == null || tiers == null || effectiveness == null || forecast == null || alerts == null) {
            throw new IllegalArgumentException("All engine settings sections are required");
        }
        if (aggregationWindow < 0) {
            throw new IllegalArgumentException("Aggregation window must be non-negative: " + aggregationWindow);
        }
    }

    public EngineSettings withForecast(ForecastSettings forecast) {
        return new EngineSettings(weights, tiers, effectiveness, forecast, alerts, aggregationWindow);
    }
}
