package org.operaton.trainload.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.operaton.trainload.model.AcwrStatus;
import org.operaton.trainload.model.DailyLoadPoint;
import org.operaton.trainload.model.FormStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Stored Performance Management Chart value for one calendar day.
 * Form (TSB) is derived from fitness and fatigue on read and has no column.
 */
@Entity
@Table(name = "daily_load",
       uniqueConstraints = @UniqueConstraint(columnNames = {"date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyLoad {

    private static final int SCALE = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private LocalDate date;

    @Column(name = "activity_count")
    @Builder.Default
    private Integer activityCount = 0;

    @Column(name = "total_duration_seconds")
    @Builder.Default
    private Long totalDurationSeconds = 0L;

    /**
     * Sum of the Training Stress Scores of the day's workouts.
     */
    @Column(name = "daily_stress", precision = 10, scale = SCALE)
    @Builder.Default
    private BigDecimal dailyStress = BigDecimal.ZERO;

    /**
     * Acute Training Load (ATL), exponentially weighted over the acute time constant.
     */
    @Column(name = "acute_training_load", precision = 10, scale = SCALE)
    @Builder.Default
    private BigDecimal acuteTrainingLoad = BigDecimal.ZERO;

    /**
     * Chronic Training Load (CTL), exponentially weighted over the chronic time constant.
     */
    @Column(name = "chronic_training_load", precision = 10, scale = SCALE)
    @Builder.Default
    private BigDecimal chronicTrainingLoad = BigDecimal.ZERO;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Training Stress Balance, CTL - ATL.
     */
    @Transient
    public BigDecimal getTrainingStressBalance() {
        if (chronicTrainingLoad == null || acuteTrainingLoad == null) {
            return null;
        }
        return chronicTrainingLoad.subtract(acuteTrainingLoad);
    }

    @Transient
    public FormStatus getFormStatus() {
        BigDecimal tsb = getTrainingStressBalance();
        return FormStatus.fromTsb(tsb != null ? tsb.doubleValue() : null);
    }

    @Transient
    public AcwrStatus getAcwrStatus() {
        return toPoint().getAcwrStatus();
    }

    /**
     * Copy fitness, fatigue and stress from a computed point.
     */
    public void applyPoint(DailyLoadPoint point) {
        this.dailyStress = scaled(point.getDailyStress());
        this.chronicTrainingLoad = scaled(point.getCtl());
        this.acuteTrainingLoad = scaled(point.getAtl());
    }

    public DailyLoadPoint toPoint() {
        return new DailyLoadPoint(date,
                dailyStress != null ? dailyStress.doubleValue() : 0,
                chronicTrainingLoad != null ? chronicTrainingLoad.doubleValue() : 0,
                acuteTrainingLoad != null ? acuteTrainingLoad.doubleValue() : 0);
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
