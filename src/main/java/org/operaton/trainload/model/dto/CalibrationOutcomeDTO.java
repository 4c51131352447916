package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.CalibrationOutcome;
import org.operaton.trainload.model.CalibrationStage;

/**
 * DTO for the result of a calibration event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationOutcomeDTO {

    private CalibrationStage stage;
    private String skipReason;
    private int dataPointsCreated;
    private ScalingProfileDTO profile;

    public static CalibrationOutcomeDTO fromOutcome(CalibrationOutcome outcome) {
        return CalibrationOutcomeDTO.builder()
                .stage(outcome.getStage())
                .skipReason(outcome.getSkipReason())
                .dataPointsCreated(outcome.getDataPointsCreated())
                .profile(outcome.getProfile() != null ? ScalingProfileDTO.fromProfile(outcome.getProfile()) : null)
                .build();
    }
}
