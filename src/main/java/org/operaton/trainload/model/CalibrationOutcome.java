package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one calibration event: the stage it reached and, when it stopped early, why.
 */
@Value
@Builder
public class CalibrationOutcome {

    CalibrationStage stage;
    String skipReason;
    int dataPointsCreated;
    ScalingProfile profile;

    public static CalibrationOutcome skipped(CalibrationStage stage, String reason, ScalingProfile profile) {
        return CalibrationOutcome.builder()
                .stage(stage)
                .skipReason(reason)
                .profile(profile)
                .build();
    }

    public boolean isPersisted() {
        return stage == CalibrationStage.PERSISTED;
    }
}
