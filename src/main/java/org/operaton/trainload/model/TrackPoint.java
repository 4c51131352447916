package org.operaton.trainload.model;

import java.time.LocalDateTime;

/**
 * Running trackpoint with instantaneous pace and elevation.
 */
public record TrackPoint(LocalDateTime timestamp, double paceSecondsPerKm, double elevationMeters) {
}
