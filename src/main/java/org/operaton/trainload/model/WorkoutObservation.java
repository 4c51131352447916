package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Workout as reported by an external data source.
 * Observations are immutable once fetched; fusion only ever changes the local canonical record.
 */
@Value
@Builder
@Jacksonized
public class WorkoutObservation implements MatchableWorkout {

    String sourceId;
    WorkoutSource source;
    String title;
    LocalDateTime startedAt;
    Long durationSeconds;
    Double distanceMeters;
    ActivityCategory activityCategory;
    Integer averageHeartRate;
    Integer averagePower;
    Integer normalizedPower;
    Double totalAscent;
    Double totalDescent;
    boolean indoor;

    @Builder.Default
    List<RoutePoint> route = List.of();

    public boolean hasRoute() {
        return route != null && !route.isEmpty();
    }
}
