package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.IntensityBand;
import org.operaton.trainload.model.ScalingProfile;
import org.operaton.trainload.model.StratumFactor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * DTO for the current scaling profile snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingProfileDTO {

    private long version;
    private double globalFactor;
    private double globalConfidence;
    private int globalSampleCount;
    private boolean learningEnabled;
    private boolean canApplyScaling;
    private Map<ActivityCategory, StratumFactor> perSport;
    private Map<IntensityBand, StratumFactor> perIntensityBand;
    private LocalDateTime updatedAt;

    public static ScalingProfileDTO fromProfile(ScalingProfile profile) {
        return ScalingProfileDTO.builder()
                .version(profile.getVersion())
                .globalFactor(profile.getGlobalFactor())
                .globalConfidence(profile.getGlobalConfidence())
                .globalSampleCount(profile.getGlobalSampleCount())
                .learningEnabled(profile.isLearningEnabled())
                .canApplyScaling(profile.canApplyScaling())
                .perSport(profile.getPerSport())
                .perIntensityBand(profile.getPerIntensityBand())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }
}
