package org.operaton.trainload.model.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.MatchableWorkout;

import java.time.LocalDateTime;

/**
 * Request DTO for an externally computed stress score of one workout,
 * optionally with the external fitness, fatigue and form of that day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonRequest implements MatchableWorkout {

    @NotNull(message = "Start time is required")
    private LocalDateTime startedAt;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    private Long durationSeconds;

    @PositiveOrZero(message = "Distance must not be negative")
    private Double distanceMeters;

    private ActivityCategory activityCategory;

    @NotNull(message = "External TSS is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "External TSS must be positive")
    private Double externalTss;

    @DecimalMin(value = "0.0", inclusive = false, message = "Intensity factor must be positive")
    private Double externalIntensityFactor;

    private Double ctl;
    private Double atl;
    private Double tsb;

    public boolean hasPmcValues() {
        return ctl != null && atl != null;
    }
}
