package org.operaton.trainload.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.MatchableWorkout;
import org.operaton.trainload.model.StressMethod;
import org.operaton.trainload.model.StressResult;
import org.operaton.trainload.model.WorkoutSource;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Canonical local record of a workout.
 * Observations from external sources are fused into it; its stress score feeds the daily load.
 */
@Entity
@Table(name = "workout_records", indexes = {
    @Index(name = "idx_workout_started_at", columnList = "started_at"),
    @Index(name = "idx_workout_source_id", columnList = "source, source_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkoutRecord implements MatchableWorkout {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private WorkoutSource source;

    @Column(name = "source_id", length = 255)
    private String sourceId;

    @Column(length = 255)
    private String title;

    @Column(name = "activity_category", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private ActivityCategory activityCategory;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "duration_seconds", nullable = false)
    private Long durationSeconds;

    @Column(name = "distance_meters")
    private Double distanceMeters;

    @Column(name = "average_heart_rate")
    private Integer averageHeartRate;

    @Column(name = "average_power")
    private Integer averagePower;

    @Column(name = "normalized_power")
    private Integer normalizedPower;

    @Column(name = "total_ascent")
    private Double totalAscent;

    @Column(name = "total_descent")
    private Double totalDescent;

    @Column(nullable = false)
    @Builder.Default
    private boolean indoor = false;

    @Column(name = "training_stress_score")
    private Double trainingStressScore;

    @Column(name = "stress_method", length = 20)
    @Enumerated(EnumType.STRING)
    private StressMethod stressMethod;

    @Column(name = "intensity_factor")
    private Double intensityFactor;

    @Column(name = "scaling_applied", nullable = false)
    @Builder.Default
    private boolean scalingApplied = false;

    @Column(name = "applied_scaling_factor")
    private Double appliedScalingFactor;

    @Column(name = "pre_scaling_stress_score")
    private Double preScalingStressScore;

    /**
     * GPS route as a JSON array of {latitude, longitude} objects.
     */
    @Column(name = "route_json", columnDefinition = "TEXT")
    private String routeJson;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean hasRoute() {
        return routeJson != null && !routeJson.isBlank();
    }

    public void applyStress(StressResult result) {
        this.trainingStressScore = result.getValue();
        this.stressMethod = result.getMethod();
        this.intensityFactor = result.getIntensityFactor();
        this.scalingApplied = result.isScalingApplied();
        this.appliedScalingFactor = result.getAppliedScalingFactor();
        this.preScalingStressScore = result.getPreScalingValue();
    }

    /**
     * Stress score as learned factors never saw it.
     */
    @Transient
    public double getUnscaledStressScore() {
        if (scalingApplied && preScalingStressScore != null) {
            return preScalingStressScore;
        }
        return trainingStressScore != null ? trainingStressScore : 0;
    }
}
