package org.operaton.trainload.repository;

import org.operaton.trainload.model.entity.CalibrationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CalibrationRecordRepository extends JpaRepository<CalibrationRecord, UUID> {

    /**
     * Most recent ground truth received for a day.
     */
    Optional<CalibrationRecord> findFirstByEffectiveDateOrderByCreatedAtDesc(LocalDate effectiveDate);
}
