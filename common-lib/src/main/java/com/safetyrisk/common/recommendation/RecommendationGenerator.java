package com.safetyrisk.common.recommendation;

import com.safetyrisk.common.model.DominantIndicator;
import com.safetyrisk.common.model.Effectiveness;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.RiskTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic mapping from a classification to ranked advisory strings, highest
 * priority first.
 *
 * <p>Ordering rules (first match leads):
 * <ol>
 *   <li>Deaths in interventions are the dominant score term → use-of-force review.</li>
 *   <li>Tier HIGH or above with LOW or undefined effectiveness → increase operational presence.</li>
 *   <li>The fixed advice list of the tier.</li>
 *   <li>No active operation and more than {@value #OPERATIONS_SUGGESTION_MIN_CRIMES} crimes
 *       → consider launching operations (only with the aggregated record).</li>
 * </ol>
 */
public final class RecommendationGenerator {

    static final int OPERATIONS_SUGGESTION_MIN_CRIMES = 5;

    static final String USE_OF_FORCE_REVIEW =
        "Review use-of-force protocols: deaths in police interventions dominate this neighborhood's risk";
    static final String INCREASE_PRESENCE =
        "Increase operational presence: enforcement effectiveness is low for the current risk level";
    static final String CONSIDER_OPERATIONS =
        "Consider launching police operations: crimes are recorded with no active operation";

    private static final Map<RiskTier, List<String>> TIER_ADVICE = new EnumMap<>(RiskTier.class);

    static {
        TIER_ADVICE.put(RiskTier.VERY_LOW, List.of(
            "Maintain current preventive actions"));
        TIER_ADVICE.put(RiskTier.LOW, List.of(
            "Maintain current preventive actions",
            "Keep community reporting channels active"));
        TIER_ADVICE.put(RiskTier.LOW_MEDIUM, List.of(
            "Maintain regular surveillance",
            "Keep community reporting channels active"));
        TIER_ADVICE.put(RiskTier.MEDIUM, List.of(
            "Maintain regular surveillance",
            "Implement community safety actions"));
        TIER_ADVICE.put(RiskTier.MEDIUM_HIGH, List.of(
            "Reinforce patrols at peak hours",
            "Implement community safety actions",
            "Review street lighting in hotspots"));
        TIER_ADVICE.put(RiskTier.HIGH, List.of(
            "Increase patrols in the area",
            "Implement preventive operations",
            "Reinforce public lighting"));
        TIER_ADVICE.put(RiskTier.VERY_HIGH, List.of(
            "Deploy continuous patrol coverage",
            "Implement preventive operations",
            "Reinforce public lighting",
            "Coordinate with social services on local risk factors"));
        TIER_ADVICE.put(RiskTier.CRITICAL, List.of(
            "Activate the emergency security plan for the neighborhood",
            "Deploy continuous patrol coverage",
            "Coordinate an integrated task force across agencies",
            "Coordinate with social services on local risk factors"));
    }

    public List<String> recommend(RiskTier tier, Effectiveness effectiveness, DominantIndicator dominant) {
        if (tier == null || effectiveness == null) {
            throw new IllegalArgumentException("Tier and effectiveness are required");
        }
        List<String> advice = new ArrayList<>();
        if (dominant == DominantIndicator.DEATHS_IN_INTERVENTION) {
            advice.add(USE_OF_FORCE_REVIEW);
        }
        if (tier.isHighOrAbove() && effectiveness.isLowOrUndefined()) {
            advice.add(INCREASE_PRESENCE);
        }
        advice.addAll(TIER_ADVICE.get(tier));
        return Collections.unmodifiableList(advice);
    }

    /**
     * Same as {@link #recommend(RiskTier, Effectiveness, DominantIndicator)}, plus the
     * operations suggestion when the aggregate calls for it.
     */
    public List<String> recommend(RiskTier tier, Effectiveness effectiveness, DominantIndicator dominant,
                                  IndicatorRecord aggregate) {
        List<String> base = recommend(tier, effectiveness, dominant);
        if (aggregate == null
                || aggregate.hasActiveOperation()
                || aggregate.crimeCount() <= OPERATIONS_SUGGESTION_MIN_CRIMES) {
            return base;
        }
        List<String> advice = new ArrayList<>(base);
        advice.add(CONSIDER_OPERATIONS);
        return Collections.unmodifiableList(advice);
    }
}
