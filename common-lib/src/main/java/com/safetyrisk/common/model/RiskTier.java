package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Eight ordered risk classifications, lowest first.
 * Ranges are owned by {@link com.safetyrisk.common.config.TierBreakpoints}.
 */
public enum RiskTier {
    VERY_LOW("very_low"),
    LOW("low"),
    LOW_MEDIUM("low_medium"),
    MEDIUM("medium"),
    MEDIUM_HIGH("medium_high"),
    HIGH("high"),
    VERY_HIGH("very_high"),
    CRITICAL("critical");

    private final String label;

    RiskTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** HIGH, VERY_HIGH and CRITICAL. */
    public boolean isHighOrAbove() {
        return compareTo(HIGH) >= 0;
    }

    @JsonCreator
    public static RiskTier fromLabel(String label) {
        for (RiskTier tier : values()) {
            if (tier.label.equalsIgnoreCase(label) || tier.name().equalsIgnoreCase(label)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown risk tier: " + label);
    }
}
