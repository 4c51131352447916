package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.CalibrationStatistics;

import java.util.List;
import java.util.Map;

/**
 * DTO for calibration learning statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationStatisticsDTO {

    private ScalingProfileDTO profile;
    private int validDataPoints;
    private int directComparisons;
    private Map<ActivityCategory, Long> directComparisonsPerSport;
    private boolean calibrationComplete;
    private boolean canDisableImport;
    private List<CalibrationDataPointDTO> recentDataPoints;

    public static CalibrationStatisticsDTO fromStatistics(CalibrationStatistics statistics) {
        return CalibrationStatisticsDTO.builder()
                .profile(ScalingProfileDTO.fromProfile(statistics.getProfile()))
                .validDataPoints(statistics.getValidDataPoints())
                .directComparisons(statistics.getDirectComparisons())
                .directComparisonsPerSport(statistics.getDirectComparisonsPerSport())
                .calibrationComplete(statistics.isCalibrationComplete())
                .canDisableImport(statistics.isCanDisableImport())
                .recentDataPoints(statistics.getRecentDataPoints().stream()
                        .map(CalibrationDataPointDTO::fromEntity)
                        .toList())
                .build();
    }
}
