package com.safetyrisk.common.exception;

import com.safetyrisk.common.model.ReportingPeriod;

/**
 * An input record with a negative count or a malformed period. The record is rejected,
 * never clamped.
 */
public class InvalidIndicatorException extends RiskEngineException {
    private final ReportingPeriod period;
    private final String reason;

    public InvalidIndicatorException(String neighborhoodId, ReportingPeriod period, String reason) {
        super(neighborhoodId, "invalid indicator for period " + period + ": " + reason);
        this.period = period;
        this.reason = reason;
    }

    public ReportingPeriod getPeriod() {
        return period;
    }

    public String getReason() {
        return reason;
    }
}
