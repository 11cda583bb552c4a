package com.safetyrisk.common.classifier;

import com.safetyrisk.common.config.TierBreakpoints;
import com.safetyrisk.common.model.RiskTier;

import java.util.List;

/**
 * Pure classifier that maps a risk score to one of the eight {@link RiskTier}s.
 *
 * <p>Default ranges (lower bound inclusive, upper bound exclusive):
 * <pre>
 *   very_low     [0, 3)
 *   low          [3, 8)
 *   low_medium   [8, 15)
 *   medium       [15, 30)
 *   medium_high  [30, 50)
 *   high         [50, 80)
 *   very_high    [80, 120)
 *   critical     [120, ∞)
 * </pre>
 * A score equal to a breakpoint belongs to the upper tier.
 */
public final class RiskTierClassifier {

    private static final RiskTier[] TIERS = RiskTier.values();

    private final List<Double> lowerBounds;

    public RiskTierClassifier() {
        this(TierBreakpoints.DEFAULTS);
    }

    public RiskTierClassifier(TierBreakpoints breakpoints) {
        if (breakpoints == null) {
            throw new IllegalArgumentException("Tier breakpoints are required");
        }
        this.lowerBounds = breakpoints.lowerBounds();
    }

    /**
     * @param score non-negative risk score
     * @return the tier whose range contains {@code score}; never null
     * @throws IllegalArgumentException for a negative or NaN score
     */
    public RiskTier classify(double score) {
        if (Double.isNaN(score) || score < 0.0) {
            throw new IllegalArgumentException("Risk score must be a non-negative number: " + score);
        }
        int tier = 0;
        for (double bound : lowerBounds) {
            if (score >= bound) {
                tier++;
            } else {
                break;
            }
        }
        return TIERS[tier];
    }
}
