package com.safetyrisk.common.exception;

/** Fewer than two distinct periods to fit a trend on. */
public class InsufficientDataException extends RiskEngineException {
    private final int distinctPeriods;

    public InsufficientDataException(String neighborhoodId, int distinctPeriods) {
        super(neighborhoodId, "forecast needs at least 2 distinct periods, got " + distinctPeriods);
        this.distinctPeriods = distinctPeriods;
    }

    public int getDistinctPeriods() {
        return distinctPeriods;
    }
}
