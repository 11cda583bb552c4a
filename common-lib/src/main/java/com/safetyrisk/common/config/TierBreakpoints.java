package com.safetyrisk.common.config;

import java.util.List;

/**
 * Lower bounds (inclusive) of tiers LOW through CRITICAL. VERY_LOW always starts at 0
 * and CRITICAL is unbounded above, so exactly seven strictly ascending positive values
 * describe the eight half-open ranges.
 */
public record TierBreakpoints(List<Double> lowerBounds) {

    public static final int BOUND_COUNT = 7;

    public static final TierBreakpoints DEFAULTS =
        new TierBreakpoints(List.of(3.0, 8.0, 15.0, 30.0, 50.0, 80.0, 120.0));

    public TierBreakpoints {
        if (lowerBounds == null || lowerBounds.size() != BOUND_COUNT) {
            throw new IllegalArgumentException("Tier breakpoints need exactly " + BOUND_COUNT
                + " lower bounds, got " + (lowerBounds == null ? "none" : lowerBounds.size()));
        }
        double previous = 0.0;
        for (Double bound : lowerBounds) {
            if (bound == null || !Double.isFinite(bound) || bound <= previous) {
                throw new IllegalArgumentException(
                    "Tier breakpoints must be strictly ascending positive values: " + lowerBounds);
            }
            previous = bound;
        }
        lowerBounds = List.copyOf(lowerBounds);
    }
}
