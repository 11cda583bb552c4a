package com.safetyrisk.common.config;

/** Quantity the weighted enforcement outcome is normalised against. */
public enum EffectivenessDenominator {
    CRIME_COUNT,
    OFFICERS_INVOLVED
}
