package org.operaton.trainload.repository;

import org.operaton.trainload.model.WorkoutSource;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkoutRecordRepository extends JpaRepository<WorkoutRecord, UUID> {

    /**
     * Candidate pool for matching: workouts starting in [from, to), ordered by start time.
     */
    @Query("SELECT w FROM WorkoutRecord w " +
           "WHERE w.startedAt >= :from AND w.startedAt < :to " +
           "ORDER BY w.startedAt ASC")
    List<WorkoutRecord> findStartedBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    Optional<WorkoutRecord> findBySourceAndSourceId(WorkoutSource source, String sourceId);

    /**
     * Outdoor workouts in a range that have no route attached yet.
     */
    @Query("SELECT w FROM WorkoutRecord w " +
           "WHERE w.startedAt >= :from AND w.startedAt < :to " +
           "AND w.indoor = false AND (w.routeJson IS NULL OR w.routeJson = '') " +
           "ORDER BY w.startedAt ASC")
    List<WorkoutRecord> findOutdoorWithoutRoute(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
