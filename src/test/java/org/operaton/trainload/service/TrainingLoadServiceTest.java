package org.operaton.trainload.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.DailyLoadPoint;
import org.operaton.trainload.model.FormStatus;
import org.operaton.trainload.model.entity.DailyLoad;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.operaton.trainload.repository.DailyLoadRepository;
import org.operaton.trainload.repository.WorkoutRecordRepository;
import org.operaton.trainload.util.TrainingLoadCalculator;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrainingLoadService.
 * Tests daily aggregation, forward recomputation and chart queries.
 */
@ExtendWith(MockitoExtension.class)
class TrainingLoadServiceTest {

    @Mock
    private DailyLoadRepository dailyLoadRepository;

    @Mock
    private WorkoutRecordRepository workoutRecordRepository;

    @Captor
    private ArgumentCaptor<List<DailyLoad>> dailyLoadsCaptor;

    private TrainingLoadService trainingLoadService;
    private LocalDate testDate;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T09:00:00Z"), ZoneOffset.UTC);
        trainingLoadService = new TrainingLoadService(dailyLoadRepository, workoutRecordRepository,
                new TrainingLoadCalculator(), clock);
        testDate = LocalDate.of(2025, 6, 1);
    }

    @Test
    @DisplayName("Should aggregate multiple workouts in one day")
    void testUpdateDailyTrainingLoad_MultipleWorkouts() {
        // Given
        WorkoutRecord morning = createWorkout(testDate.atTime(7, 0), 1800L, 40.0);
        WorkoutRecord evening = createWorkout(testDate.atTime(18, 0), 3600L, 60.0);

        when(dailyLoadRepository.findByDate(testDate)).thenReturn(Optional.empty());
        when(workoutRecordRepository.findStartedBetween(testDate.atStartOfDay(), testDate.plusDays(1).atStartOfDay()))
                .thenReturn(List.of(morning, evening));
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(testDate)).thenReturn(Optional.empty());
        when(dailyLoadRepository.findByDateAfterOrderByDateAsc(testDate.minusDays(1))).thenReturn(List.of());

        // When
        trainingLoadService.updateDailyTrainingLoad(testDate);

        // Then
        ArgumentCaptor<DailyLoad> captor = ArgumentCaptor.forClass(DailyLoad.class);
        verify(dailyLoadRepository).save(captor.capture());
        DailyLoad saved = captor.getValue();

        assertEquals(0, BigDecimal.valueOf(100.0).compareTo(saved.getDailyStress()));
        assertEquals(2, saved.getActivityCount());
        assertEquals(5400L, saved.getTotalDurationSeconds());
        verify(dailyLoadRepository).saveAll(any());
    }

    @Test
    @DisplayName("Should treat missing stress as zero")
    void testUpdateDailyTrainingLoad_MissingStress() {
        // Given
        WorkoutRecord unscored = createWorkout(testDate.atTime(7, 0), 1800L, null);
        DailyLoad existing = DailyLoad.builder().date(testDate).dailyStress(BigDecimal.valueOf(55)).build();

        when(dailyLoadRepository.findByDate(testDate)).thenReturn(Optional.of(existing));
        when(workoutRecordRepository.findStartedBetween(any(), any())).thenReturn(List.of(unscored));
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(testDate)).thenReturn(Optional.empty());
        when(dailyLoadRepository.findByDateAfterOrderByDateAsc(any())).thenReturn(List.of(existing));

        // When
        trainingLoadService.updateDailyTrainingLoad(testDate);

        // Then
        assertEquals(0, BigDecimal.ZERO.compareTo(existing.getDailyStress()));
        assertEquals(0, BigDecimal.ZERO.compareTo(existing.getChronicTrainingLoad()));
    }

    @Test
    @DisplayName("Should recompute forward from the seed day and fill gaps as rest days")
    void testRecomputeFrom_SeedAndGap() {
        // Given
        DailyLoad seed = DailyLoad.builder()
                .date(testDate)
                .chronicTrainingLoad(BigDecimal.valueOf(42))
                .acuteTrainingLoad(BigDecimal.valueOf(56))
                .build();
        DailyLoad later = DailyLoad.builder()
                .date(testDate.plusDays(3))
                .dailyStress(BigDecimal.valueOf(70))
                .build();

        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(testDate.plusDays(1))).thenReturn(Optional.of(seed));
        when(dailyLoadRepository.findByDateAfterOrderByDateAsc(testDate)).thenReturn(List.of(later));

        // When
        trainingLoadService.recomputeFrom(testDate.plusDays(1));

        // Then
        verify(dailyLoadRepository).saveAll(dailyLoadsCaptor.capture());
        List<DailyLoad> saved = dailyLoadsCaptor.getValue();

        assertEquals(3, saved.size());
        assertEquals(testDate.plusDays(1), saved.get(0).getDate());
        assertEquals(41.0, saved.get(0).getChronicTrainingLoad().doubleValue(), 1e-4);
        assertEquals(48.0, saved.get(0).getAcuteTrainingLoad().doubleValue(), 1e-4);
        assertSame(later, saved.get(2));
        assertTrue(later.getChronicTrainingLoad().doubleValue() > saved.get(1).getChronicTrainingLoad().doubleValue());
    }

    @Test
    @DisplayName("Should return one point per day for a range")
    void testGetTrainingLoad_GapFree() {
        // Given
        DailyLoad day = DailyLoad.builder().date(testDate.plusDays(1)).dailyStress(BigDecimal.valueOf(100)).build();
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(testDate)).thenReturn(Optional.empty());
        when(dailyLoadRepository.findByDateBetweenOrderByDateAsc(testDate, testDate.plusDays(4))).thenReturn(List.of(day));

        // When
        List<DailyLoadPoint> points = trainingLoadService.getTrainingLoad(testDate, testDate.plusDays(4));

        // Then
        assertEquals(5, points.size());
        assertEquals(0.0, points.get(0).getCtl());
        assertEquals(100.0, points.get(1).getDailyStress());
        assertTrue(points.get(4).getAtl() < points.get(1).getAtl());
    }

    @Test
    @DisplayName("Should reject a range that ends before it starts")
    void testGetTrainingLoad_InvalidRange() {
        assertThrows(IllegalArgumentException.class,
                () -> trainingLoadService.getTrainingLoad(testDate, testDate.minusDays(1)));
        verifyNoInteractions(dailyLoadRepository);
    }

    @Test
    @DisplayName("Should report unknown form without any stored data")
    void testGetCurrentFormStatus_NoData() {
        // Given
        when(dailyLoadRepository.findFirstByOrderByDateDesc()).thenReturn(Optional.empty());

        // Then
        assertEquals(FormStatus.UNKNOWN, trainingLoadService.getCurrentFormStatus());
    }

    @Test
    @DisplayName("Should decay today's load from the last stored day")
    void testGetCurrentLoad_DecaysFromLastStoredDay() {
        // Given
        LocalDate today = LocalDate.of(2025, 6, 15);
        DailyLoad lastStored = DailyLoad.builder()
                .date(today.minusDays(2))
                .chronicTrainingLoad(BigDecimal.valueOf(60))
                .acuteTrainingLoad(BigDecimal.valueOf(40))
                .build();
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(today)).thenReturn(Optional.of(lastStored));
        when(dailyLoadRepository.findByDateBetweenOrderByDateAsc(today, today)).thenReturn(List.of());

        // When
        DailyLoadPoint current = trainingLoadService.getCurrentLoad();

        // Then
        assertEquals(today, current.getDate());
        assertEquals(60 * Math.pow(41.0 / 42, 2), current.getCtl(), 1e-9);
        assertEquals(40 * Math.pow(6.0 / 7, 2), current.getAtl(), 1e-9);
    }

    @Test
    @DisplayName("Should have no monotony for a week without training")
    void testGetMonotony_NoTraining() {
        // Given
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(any())).thenReturn(Optional.empty());
        when(dailyLoadRepository.findByDateBetweenOrderByDateAsc(any(), any())).thenReturn(List.of());

        // Then
        assertTrue(trainingLoadService.getMonotony().isEmpty());
        assertTrue(trainingLoadService.getStrain().isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive day limit")
    void testDaysToTargetTsb_InvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> trainingLoadService.daysToTargetTsb(5, 0));
    }

    @Test
    @DisplayName("Should project planned stress from today's load")
    void testProject() {
        // Given
        when(dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(any())).thenReturn(Optional.empty());
        when(dailyLoadRepository.findByDateBetweenOrderByDateAsc(any(), any())).thenReturn(List.of());

        // When
        List<DailyLoadPoint> projection = trainingLoadService.project(List.of(70.0, 70.0, 0.0));

        // Then
        assertEquals(3, projection.size());
        assertEquals(LocalDate.of(2025, 6, 16), projection.get(0).getDate());
        assertEquals(70.0 / 42, projection.get(0).getCtl(), 1e-9);
    }

    @Test
    @DisplayName("Should skip workouts without a start time")
    void testUpdateTrainingLoad_NoStartTime() {
        trainingLoadService.updateTrainingLoad(WorkoutRecord.builder().activityCategory(ActivityCategory.RUN).build());
        verifyNoInteractions(dailyLoadRepository, workoutRecordRepository);
    }

    private WorkoutRecord createWorkout(LocalDateTime startedAt, Long durationSeconds, Double tss) {
        return WorkoutRecord.builder()
                .activityCategory(ActivityCategory.RUN)
                .startedAt(startedAt)
                .durationSeconds(durationSeconds)
                .trainingStressScore(tss)
                .build();
    }
}
