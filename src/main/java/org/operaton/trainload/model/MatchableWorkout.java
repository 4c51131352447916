package org.operaton.trainload.model;

import java.time.LocalDateTime;

/**
 * Fields the matcher compares when deciding whether two records describe the same workout.
 */
public interface MatchableWorkout {

    /** Local wall-clock start time. */
    LocalDateTime getStartedAt();

    Long getDurationSeconds();

    /** Distance in meters, null when the source does not report one. */
    Double getDistanceMeters();

    ActivityCategory getActivityCategory();
}
