package org.operaton.trainload.model;

/**
 * Origin of a workout record.
 */
public enum WorkoutSource {
    WEARABLE,
    ACTIVITY_SERVICE,
    TRAINING_LOG_IMPORT,
    MANUAL
}
