package com.safetyrisk.common.exception;

/**
 * Base of all engine failures. Every failure is local to the evaluation of a single
 * neighborhood, so the neighborhood id travels with it.
 */
public class RiskEngineException extends RuntimeException {
    private final String neighborhoodId;

    public RiskEngineException(String neighborhoodId, String message) {
        super("[" + neighborhoodId + "] " + message);
        this.neighborhoodId = neighborhoodId;
    }

    public RiskEngineException(String neighborhoodId, String message, Throwable cause) {
        super("[" + neighborhoodId + "] " + message, cause);
        this.neighborhoodId = neighborhoodId;
    }

    public String getNeighborhoodId() {
        return neighborhoodId;
    }
}
