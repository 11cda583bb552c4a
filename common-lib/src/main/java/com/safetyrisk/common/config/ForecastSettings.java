package com.safetyrisk.common.config;

/**
 * @param horizon        number of future periods projected
 * @param maxHorizon     largest horizon a caller may ask for
 * @param periodsPerYear reporting periods in a year (12 = monthly)
 * @param trendThreshold relative change between the last two periods that counts as RISING/FALLING
 */
public record ForecastSettings(int horizon, int maxHorizon, int periodsPerYear, double trendThreshold) {

    public static final int DEFAULT_MAX_HORIZON = 120;

    public static final ForecastSettings DEFAULTS = new ForecastSettings(7, DEFAULT_MAX_HORIZON, 12, 0.20);

    public ForecastSettings {
        if (horizon < 0) {
            throw new IllegalArgumentException("Forecast horizon must be non-negative: " + horizon);
        }
        if (maxHorizon < horizon) {
            throw new IllegalArgumentException(
                "Forecast max horizon " + maxHorizon + " is below the default horizon " + horizon);
        }
        if (periodsPerYear < 1) {
            throw new IllegalArgumentException("periodsPerYear must be at least 1: " + periodsPerYear);
        }
        if (trendThreshold < 0) {
            throw new IllegalArgumentException("Trend threshold must be non-negative: " + trendThreshold);
        }
    }
}
