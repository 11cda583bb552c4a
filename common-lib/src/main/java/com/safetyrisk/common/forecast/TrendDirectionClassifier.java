package com.safetyrisk.common.forecast;

import com.safetyrisk.common.model.SeriesPoint;
import com.safetyrisk.common.model.TrendDirection;

import java.util.Comparator;
import java.util.List;

/**
 * Labels the last step of a crime-count series.
 *
 * <p>With {@code variation = (last − previous) / previous}: above {@code +threshold}
 * is RISING, below {@code −threshold} is FALLING, anything else STABLE. A previous count
 * of zero followed by any crime is RISING. Fewer than two points is STABLE.
 */
public final class TrendDirectionClassifier {

    private final double threshold;

    public TrendDirectionClassifier(double threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Trend threshold must be non-negative: " + threshold);
        }
        this.threshold = threshold;
    }

    public TrendDirection classify(List<SeriesPoint> series) {
        if (series == null || series.size() < 2) {
            return TrendDirection.STABLE;
        }
        List<SeriesPoint> ordered = series.stream()
            .sorted(Comparator.comparingLong(SeriesPoint::periodIndex))
            .toList();
        int last = ordered.get(ordered.size() - 1).crimeCount();
        int previous = ordered.get(ordered.size() - 2).crimeCount();

        if (previous == 0) {
            return last > 0 ? TrendDirection.RISING : TrendDirection.STABLE;
        }
        double variation = (double) (last - previous) / previous;
        if (variation > threshold)  return TrendDirection.RISING;
        if (variation < -threshold) return TrendDirection.FALLING;
        return TrendDirection.STABLE;
    }
}
