package org.operaton.trainload.model;

import lombok.Value;

/**
 * Accepted candidate for a workout match.
 *
 * @param <T> candidate type
 */
@Value
public class MatchResult<T extends MatchableWorkout> {

    T candidate;

    /** Additive score, 120 at most. */
    double score;

    /** Score normalized to 0-1. */
    double confidence;

    double timeDifferenceSeconds;
    double durationDifferencePercent;
    boolean activityCategoryMatched;
    Double distanceDifferencePercent;
    boolean impreciseTime;

    public boolean isHighConfidence() {
        return confidence >= 0.7;
    }
}
