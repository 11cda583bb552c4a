package com.safetyrisk.common.config;

/**
 * @param volumeThreshold   crime count in the latest period that raises a HIGH_VOLUME alert
 * @param increaseThreshold relative period-over-period increase that raises SIGNIFICANT_INCREASE
 */
public record AlertSettings(int volumeThreshold, double increaseThreshold) {

    public static final AlertSettings DEFAULTS = new AlertSettings(10, 0.30);

    public AlertSettings {
        if (volumeThreshold < 1) {
            throw new IllegalArgumentException("Alert volume threshold must be positive: " + volumeThreshold);
        }
        if (increaseThreshold <= 0) {
            throw new IllegalArgumentException("Alert increase threshold must be positive: " + increaseThreshold);
        }
    }
}
