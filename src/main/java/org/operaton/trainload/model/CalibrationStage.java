package org.operaton.trainload.model;

/**
 * Stages of a single calibration event. Disabled learning ends the event in {@link #IDLE}.
 */
public enum CalibrationStage {
    IDLE,
    PROFILE_LOADED,
    DATA_POINTS_CREATED,
    FACTORS_RECOMPUTED,
    PERSISTED
}
