package org.operaton.trainload.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.DerivationMethod;
import org.operaton.trainload.model.IntensityBand;
import org.operaton.trainload.model.entity.CalibrationDataPoint;

import java.time.LocalDate;
import java.util.UUID;

/**
 * DTO for a calibration data point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationDataPointDTO {

    private UUID id;
    private LocalDate effectiveDate;
    private double extractedValue;
    private double calculatedValue;
    private Double scalingRatio;
    private double sourceConfidence;
    private ActivityCategory activityCategory;
    private boolean multiSport;
    private IntensityBand intensityBand;
    private DerivationMethod derivationMethod;
    private boolean valid;
    private String invalidReason;

    public static CalibrationDataPointDTO fromEntity(CalibrationDataPoint point) {
        return CalibrationDataPointDTO.builder()
                .id(point.getId())
                .effectiveDate(point.getEffectiveDate())
                .extractedValue(point.getExtractedValue())
                .calculatedValue(point.getCalculatedValue())
                .scalingRatio(point.getScalingRatio())
                .sourceConfidence(point.getSourceConfidence())
                .activityCategory(point.getActivityCategory())
                .multiSport(point.isMultiSport())
                .intensityBand(point.getIntensityBand())
                .derivationMethod(point.getDerivationMethod())
                .valid(point.isValid())
                .invalidReason(point.getInvalidReason())
                .build();
    }
}
