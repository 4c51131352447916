package org.operaton.trainload.model;

/**
 * Injury-risk bucket for the acute:chronic workload ratio.
 */
public enum AcwrStatus {
    OPTIMAL,
    UNDERTRAINING,
    CAUTION,
    HIGH_RISK,
    VERY_LOW,
    UNKNOWN;

    public static AcwrStatus fromRatio(Double acwr) {
        if (acwr == null) {
            return UNKNOWN;
        }
        if (acwr >= 1.5) {
            return HIGH_RISK;
        } else if (acwr > 1.3) {
            return CAUTION;
        } else if (acwr >= 0.8) {
            return OPTIMAL;
        } else if (acwr >= 0.5) {
            return UNDERTRAINING;
        }
        return VERY_LOW;
    }
}
