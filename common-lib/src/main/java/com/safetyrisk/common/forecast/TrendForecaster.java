package com.safetyrisk.common.forecast;

import com.safetyrisk.common.config.ForecastSettings;
import com.safetyrisk.common.exception.InsufficientDataException;
import com.safetyrisk.common.model.ForecastPoint;
import com.safetyrisk.common.model.LinearTrend;
import com.safetyrisk.common.model.SeriesPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Short-horizon crime-count projection by ordinary least squares on one predictor.
 *
 * <pre>
 *   slope     = Σ(x − x̄)(y − ȳ) / Σ(x − x̄)²
 *   intercept = ȳ − slope × x̄
 *   ŷ(x)      = max(0, intercept + slope × x)
 * </pre>
 *
 * <p>x is the flat period index and y the crime count. The fit is recomputed from the
 * given series on every call; nothing is carried between calls. Projections start at
 * the period after the largest index in the series.
 *
 * <p>A heuristic, not a validated predictive model.
 */
public final class TrendForecaster {

    /** Minimum number of distinct period indices for a fit. */
    public static final int MIN_DISTINCT_PERIODS = 2;

    private final int maxHorizon;

    public TrendForecaster() {
        this(ForecastSettings.DEFAULT_MAX_HORIZON);
    }

    /**
     * @param maxHorizon largest number of periods a single call may project
     */
    public TrendForecaster(int maxHorizon) {
        if (maxHorizon < 0) {
            throw new IllegalArgumentException("Forecast max horizon must be non-negative: " + maxHorizon);
        }
        this.maxHorizon = maxHorizon;
    }

    public List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon) {
        return forecast(null, series, horizon);
    }

    /**
     * @param neighborhoodId only used to label a failure; may be null
     * @param series         observations, any order
     * @param horizon        number of future periods, within {@code 0..maxHorizon}
     * @return {@code horizon} projections, ascending by period index, none negative
     * @throws InsufficientDataException when the series has fewer than two distinct indices
     * @throws IllegalArgumentException  for a horizon out of range or a negative crime count
     */
    public List<ForecastPoint> forecast(String neighborhoodId, List<SeriesPoint> series, int horizon) {
        if (horizon < 0) {
            throw new IllegalArgumentException("Forecast horizon must be non-negative: " + horizon);
        }
        if (horizon > maxHorizon) {
            throw new IllegalArgumentException(
                "Forecast horizon " + horizon + " exceeds the maximum of " + maxHorizon);
        }
        LinearTrend trend = fit(neighborhoodId, series);

        long last = series.stream().mapToLong(SeriesPoint::periodIndex).max().orElseThrow();
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            long index = last + step;
            points.add(new ForecastPoint(index, Math.max(0.0, trend.valueAt(index))));
        }
        return points;
    }

    public LinearTrend fit(List<SeriesPoint> series) {
        return fit(null, series);
    }

    public LinearTrend fit(String neighborhoodId, List<SeriesPoint> series) {
        int distinct = series == null ? 0
            : (int) series.stream().mapToLong(SeriesPoint::periodIndex).distinct().count();
        if (distinct < MIN_DISTINCT_PERIODS) {
            throw new InsufficientDataException(neighborhoodId, distinct);
        }
        for (SeriesPoint p : series) {
            if (p.crimeCount() < 0) {
                throw new IllegalArgumentException(
                    "Crime count must be non-negative, got " + p.crimeCount() + " at period index " + p.periodIndex());
            }
        }

        int n = series.size();
        double meanX = 0, meanY = 0;
        for (SeriesPoint p : series) {
            meanX += p.periodIndex();
            meanY += p.crimeCount();
        }
        meanX /= n;
        meanY /= n;

        double sxx = 0, sxy = 0;
        for (SeriesPoint p : series) {
            double dx = p.periodIndex() - meanX;
            sxx += dx * dx;
            sxy += dx * (p.crimeCount() - meanY);
        }

        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        return new LinearTrend(slope, intercept);
    }
}
