package com.safetyrisk.common.model;

/**
 * The input factor whose term has the largest magnitude in the risk score sum.
 * {@link #NONE} when every term is zero.
 */
public enum DominantIndicator {
    CRIME_COUNT,
    DEATHS_IN_INTERVENTION,
    ARRESTS,
    WEAPONS_SEIZED,
    DRUGS_SEIZED,
    ACTIVE_OPERATION,
    NONE
}
