package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.FusionOutcome;
import org.operaton.trainload.model.StressMethod;
import org.operaton.trainload.model.entity.WorkoutRecord;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for the canonical workout affected by an import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutRecordDTO {

    private UUID id;
    private FusionOutcome.Action action;
    private Double matchConfidence;
    private String title;
    private ActivityCategory activityCategory;
    private LocalDateTime startedAt;
    private Long durationSeconds;
    private Double distanceMeters;
    private Double trainingStressScore;
    private StressMethod stressMethod;
    private Double intensityFactor;
    private boolean scalingApplied;
    private boolean hasRoute;

    public static WorkoutRecordDTO fromOutcome(FusionOutcome outcome) {
        WorkoutRecord record = outcome.getRecord();
        return WorkoutRecordDTO.builder()
                .id(record.getId())
                .action(outcome.getAction())
                .matchConfidence(outcome.getMatchConfidence())
                .title(record.getTitle())
                .activityCategory(record.getActivityCategory())
                .startedAt(record.getStartedAt())
                .durationSeconds(record.getDurationSeconds())
                .distanceMeters(record.getDistanceMeters())
                .trainingStressScore(record.getTrainingStressScore())
                .stressMethod(record.getStressMethod())
                .intensityFactor(record.getIntensityFactor())
                .scalingApplied(record.isScalingApplied())
                .hasRoute(record.hasRoute())
                .build();
    }
}
