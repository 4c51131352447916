package org.operaton.trainload.model;

import java.time.LocalDateTime;

/**
 * Timestamped sensor value (power in watts or heart rate in bpm).
 */
public record TimedSample(LocalDateTime timestamp, double value) {
}
