package org.operaton.trainload.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.DerivationMethod;
import org.operaton.trainload.model.IntensityBand;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * One comparison between a ground-truth stress value and this system's own estimate for the same day.
 * Points are never edited; a wrong point is soft deleted by clearing {@code valid}.
 */
@Entity
@Table(name = "calibration_data_points", indexes = {
    @Index(name = "idx_calibration_point_date", columnList = "effective_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalibrationDataPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    /** Ground-truth stress, read directly or derived from a load change. */
    @Column(name = "extracted_value", nullable = false)
    private double extractedValue;

    /** Stress this system calculated for the same day. */
    @Column(name = "calculated_value", nullable = false)
    private double calculatedValue;

    /** Extracted / calculated, null when the calculated value is not positive. */
    @Column(name = "scaling_ratio")
    private Double scalingRatio;

    @Column(name = "source_confidence", nullable = false)
    private double sourceConfidence;

    @Column(name = "activity_category", length = 20)
    @Enumerated(EnumType.STRING)
    private ActivityCategory activityCategory;

    @Column(name = "multi_sport", nullable = false)
    @Builder.Default
    private boolean multiSport = false;

    @Column(name = "intensity_band", length = 20)
    @Enumerated(EnumType.STRING)
    private IntensityBand intensityBand;

    @Column(name = "workout_intensity_factor")
    private Double workoutIntensityFactor;

    @Column(name = "derivation_method", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private DerivationMethod derivationMethod;

    @Column(nullable = false)
    @Builder.Default
    private boolean valid = true;

    @Column(name = "invalid_reason", length = 500)
    private String invalidReason;

    @Column(name = "calibration_record_id")
    private UUID calibrationRecordId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public static Double ratio(double extracted, double calculated) {
        return calculated > 0 ? extracted / calculated : null;
    }

    /**
     * Exponential decay by age: 1.0 today, 0.5 after one half-life.
     */
    public double timeWeight(LocalDate today, double halfLifeDays) {
        long ageDays = Math.max(0, ChronoUnit.DAYS.between(effectiveDate, today));
        return Math.pow(0.5, ageDays / halfLifeDays);
    }

    public double learningWeight(LocalDate today, double halfLifeDays) {
        return timeWeight(today, halfLifeDays) * sourceConfidence;
    }

    public boolean isUsableForLearning(double minSourceConfidence) {
        return valid
                && scalingRatio != null
                && sourceConfidence >= minSourceConfidence
                && calculatedValue > 0;
    }

    public void invalidate(String reason) {
        this.valid = false;
        this.invalidReason = reason;
    }
}
