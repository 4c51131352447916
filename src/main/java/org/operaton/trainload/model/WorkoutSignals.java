package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything known about one workout's physiology, as input to stress scoring.
 */
@Value
@Builder
public class WorkoutSignals {

    ActivityCategory category;
    double durationSeconds;
    Double distanceMeters;

    @Singular
    List<TimedSample> powerSamples;

    @Singular
    List<TimedSample> heartRateSamples;

    @Singular
    List<TrackPoint> trackPoints;

    /** Normalized power already computed by the source, in watts. */
    Double normalizedPower;
    Double averagePower;
    Double averageHeartRate;
    Double totalAscent;
    Double totalDescent;

    /** Subjective effort on a 0-1 scale, used only by the estimate. */
    Double perceivedIntensity;

    public boolean hasPower() {
        return !powerSamples.isEmpty() || normalizedPower != null || averagePower != null;
    }

    public boolean hasHeartRate() {
        return !heartRateSamples.isEmpty() || averageHeartRate != null;
    }
}
