package org.operaton.trainload.model;

/**
 * Coarse sport category used for matching and for per-sport calibration.
 */
public enum ActivityCategory {
    RUN,
    BIKE,
    SWIM,
    STRENGTH,
    OTHER;

    /**
     * Perceived intensity assumed when a workout carries no usable signal at all.
     */
    public double defaultPerceivedIntensity() {
        return switch (this) {
            case RUN, SWIM -> 0.7;
            case BIKE -> 0.65;
            case STRENGTH -> 0.6;
            case OTHER -> 0.5;
        };
    }
}
