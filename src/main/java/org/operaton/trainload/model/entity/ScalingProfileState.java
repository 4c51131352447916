package org.operaton.trainload.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Persisted form of the scaling profile. A single row with a fixed id.
 * Stratified factors are stored as JSON maps keyed by category or band name.
 */
@Entity
@Table(name = "scaling_profile")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScalingProfileState {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Builder.Default
    private Long id = SINGLETON_ID;

    @Column(nullable = false)
    private long version;

    @Column(name = "global_factor", nullable = false)
    private double globalFactor;

    @Column(name = "global_confidence", nullable = false)
    private double globalConfidence;

    @Column(name = "global_sample_count", nullable = false)
    private int globalSampleCount;

    @Column(name = "sport_factors_json", columnDefinition = "TEXT")
    private String sportFactorsJson;

    @Column(name = "band_factors_json", columnDefinition = "TEXT")
    private String bandFactorsJson;

    @Column(name = "learning_enabled", nullable = false)
    private boolean learningEnabled;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
