package org.operaton.trainload.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ground-truth fitness, fatigue and form as received from an external source.
 * Also the source of "yesterday's" known values when deriving stress from load changes.
 */
@Entity
@Table(name = "calibration_records", indexes = {
    @Index(name = "idx_calibration_record_date", columnList = "effective_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalibrationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    private Double ctl;
    private Double atl;
    private Double tsb;

    @Column(name = "daily_tss")
    private Double dailyTss;

    @Column(nullable = false)
    private double confidence;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private Origin origin;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public enum Origin {
        SCREENSHOT,
        MANUAL_COMPARISON
    }
}
