package org.operaton.trainload.model;

/**
 * Strategy that produced a {@link StressResult}, in descending order of trust.
 */
public enum StressMethod {
    POWER,
    RUNNING_POWER,
    PACE,
    HEART_RATE,
    ESTIMATED;

    /**
     * Quality rank: power is the most accurate signal, an estimate the least.
     */
    public int qualityRank() {
        return switch (this) {
            case POWER, RUNNING_POWER -> 3;
            case PACE -> 2;
            case HEART_RATE -> 1;
            case ESTIMATED -> 0;
        };
    }
}
