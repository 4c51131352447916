package org.operaton.trainload.repository;

import org.operaton.trainload.model.entity.DailyLoad;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DailyLoadRepository extends JpaRepository<DailyLoad, UUID> {

    Optional<DailyLoad> findByDate(LocalDate date);

    /**
     * Find stored days within a date range, oldest first.
     */
    List<DailyLoad> findByDateBetweenOrderByDateAsc(LocalDate startDate, LocalDate endDate);

    /**
     * Find stored days after a date, oldest first. Used for forward recomputation.
     */
    List<DailyLoad> findByDateAfterOrderByDateAsc(LocalDate date);

    /**
     * Latest stored day strictly before a date, the seed for recomputation.
     */
    Optional<DailyLoad> findFirstByDateBeforeOrderByDateDesc(LocalDate date);

    Optional<DailyLoad> findFirstByOrderByDateDesc();
}
