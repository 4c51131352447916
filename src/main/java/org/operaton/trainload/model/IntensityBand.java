package org.operaton.trainload.model;

/**
 * Intensity stratum of a workout, bucketed by Intensity Factor.
 */
public enum IntensityBand {
    RECOVERY,        // IF < 0.75
    ENDURANCE,       // 0.75 - 0.90
    TEMPO,           // 0.90 - 1.05
    HIGH_INTENSITY;  // > 1.05

    public static IntensityBand fromIntensityFactor(double intensityFactor) {
        if (intensityFactor < 0.75) {
            return RECOVERY;
        } else if (intensityFactor < 0.90) {
            return ENDURANCE;
        } else if (intensityFactor < 1.05) {
            return TEMPO;
        }
        return HIGH_INTENSITY;
    }
}
