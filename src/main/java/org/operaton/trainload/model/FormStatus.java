package org.operaton.trainload.model;

/**
 * Readiness bucket derived from Training Stress Balance.
 */
public enum FormStatus {
    VERY_FRESH,
    FRESH,
    NEUTRAL,
    TIRED,
    VERY_TIRED,
    UNKNOWN;

    public static FormStatus fromTsb(Double tsb) {
        if (tsb == null) {
            return UNKNOWN;
        }
        if (tsb >= 25) {
            return VERY_FRESH;
        } else if (tsb >= 10) {
            return FRESH;
        } else if (tsb >= -10) {
            return NEUTRAL;
        } else if (tsb >= -25) {
            return TIRED;
        }
        return VERY_TIRED;
    }
}
