package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;

/**
 * Athlete threshold values. Any of them may be unknown (null).
 */
@Value
@Builder
public class AthleteThresholds {

    Integer ftpWatts;
    Integer runningFtpWatts;

    /** Threshold running pace in seconds per km. */
    Double thresholdPaceSecondsPerKm;

    /** Threshold swim pace in seconds per 100 m. */
    Double swimThresholdPacePer100m;

    Integer thresholdHeartRate;
}
