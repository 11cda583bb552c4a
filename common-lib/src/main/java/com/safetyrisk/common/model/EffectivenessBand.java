package com.safetyrisk.common.model;

/**
 * Qualitative reading of an effectiveness ratio.
 * {@link #NOT_ASSESSABLE} is reserved for {@link Effectiveness#UNDEFINED}.
 */
public enum EffectivenessBand {
    HIGH,
    MEDIUM,
    LOW,
    NOT_ASSESSABLE
}
