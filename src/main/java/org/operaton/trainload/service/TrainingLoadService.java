package org.operaton.trainload.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.DailyLoadPoint;
import org.operaton.trainload.model.FormStatus;
import org.operaton.trainload.model.entity.DailyLoad;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.operaton.trainload.repository.DailyLoadRepository;
import org.operaton.trainload.repository.WorkoutRecordRepository;
import org.operaton.trainload.util.TrainingLoadCalculator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for calculating and managing training load metrics.
 * Keeps one stored chart value per calendar day and recomputes forward whenever a day's stress changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingLoadService {

    private final DailyLoadRepository dailyLoadRepository;
    private final WorkoutRecordRepository workoutRecordRepository;
    private final TrainingLoadCalculator trainingLoadCalculator;
    private final Clock clock;

    /**
     * Update training load for a workout.
     * Called after a workout record is saved.
     */
    @Transactional
    public void updateTrainingLoad(WorkoutRecord workout) {
        if (workout.getStartedAt() == null) {
            return;
        }
        updateDailyTrainingLoad(workout.getStartedAt().toLocalDate());
    }

    /**
     * Re-aggregate a day's workouts and recompute the chart from that day forward.
     */
    @Transactional
    public void updateDailyTrainingLoad(LocalDate date) {
        DailyLoad dailyLoad = dailyLoadRepository.findByDate(date)
                .orElse(DailyLoad.builder().date(date).build());

        List<WorkoutRecord> workouts = workoutRecordRepository
                .findStartedBetween(date.atStartOfDay(), date.plusDays(1).atStartOfDay());

        double dailyStress = workouts.stream()
                .mapToDouble(w -> w.getTrainingStressScore() != null ? w.getTrainingStressScore() : 0)
                .sum();
        long totalDuration = workouts.stream()
                .mapToLong(w -> w.getDurationSeconds() != null ? w.getDurationSeconds() : 0)
                .sum();

        dailyLoad.setActivityCount(workouts.size());
        dailyLoad.setTotalDurationSeconds(totalDuration);
        dailyLoad.setDailyStress(BigDecimal.valueOf(dailyStress));
        dailyLoadRepository.save(dailyLoad);

        log.debug("Updated daily stress on {}: TSS={} from {} workouts", date, dailyStress, workouts.size());
        recomputeFrom(date);
    }

    /**
     * Recompute fitness and fatigue for every day from {@code date} to the last stored day.
     * Seeded from the last stored day before {@code date}; gap days are filled in as rest days.
     */
    @Transactional
    public void recomputeFrom(LocalDate date) {
        Optional<DailyLoad> seed = dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(date);
        LocalDate start = seed.map(s -> s.getDate().plusDays(1)).orElse(date);
        double initialCtl = seed.map(s -> s.getChronicTrainingLoad().doubleValue()).orElse(0.0);
        double initialAtl = seed.map(s -> s.getAcuteTrainingLoad().doubleValue()).orElse(0.0);

        Map<LocalDate, DailyLoad> stored = dailyLoadRepository.findByDateAfterOrderByDateAsc(start.minusDays(1)).stream()
                .collect(Collectors.toMap(DailyLoad::getDate, Function.identity()));
        LocalDate end = stored.keySet().stream().max(LocalDate::compareTo).orElse(date);
        if (end.isBefore(date)) {
            end = date;
        }

        List<DailyLoadPoint> series = trainingLoadCalculator.computeSeries(
                stressByDate(stored.values()), start, end, initialCtl, initialAtl);

        List<DailyLoad> updated = new ArrayList<>(series.size());
        for (DailyLoadPoint point : series) {
            DailyLoad day = stored.getOrDefault(point.getDate(), DailyLoad.builder().date(point.getDate()).build());
            day.applyPoint(point);
            updated.add(day);
        }
        dailyLoadRepository.saveAll(updated);

        log.info("Recomputed training load for {} days from {} to {}", updated.size(), start, end);
    }

    /**
     * Gap-free chart for an inclusive date range.
     * Days before the first stored day start from zero; days after the last stored day decay as rest days.
     */
    @Transactional(readOnly = true)
    public List<DailyLoadPoint> getTrainingLoad(LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("End date " + endDate + " is before start date " + startDate);
        }

        Optional<DailyLoad> seed = dailyLoadRepository.findFirstByDateBeforeOrderByDateDesc(startDate);
        LocalDate seriesStart = seed.map(s -> s.getDate().plusDays(1)).orElse(startDate);
        double initialCtl = seed.map(s -> s.getChronicTrainingLoad().doubleValue()).orElse(0.0);
        double initialAtl = seed.map(s -> s.getAcuteTrainingLoad().doubleValue()).orElse(0.0);

        List<DailyLoad> stored = dailyLoadRepository.findByDateBetweenOrderByDateAsc(startDate, endDate);

        return trainingLoadCalculator.computeSeries(stressByDate(stored), seriesStart, endDate, initialCtl, initialAtl)
                .stream()
                .filter(p -> !p.getDate().isBefore(startDate))
                .toList();
    }

    /**
     * Today's chart value, decayed from the last stored day when nothing was recorded since.
     */
    @Transactional(readOnly = true)
    public DailyLoadPoint getCurrentLoad() {
        LocalDate today = LocalDate.now(clock);
        List<DailyLoadPoint> series = getTrainingLoad(today, today);
        return series.get(series.size() - 1);
    }

    /**
     * Get current form status.
     */
    @Transactional(readOnly = true)
    public FormStatus getCurrentFormStatus() {
        if (dailyLoadRepository.findFirstByOrderByDateDesc().isEmpty()) {
            return FormStatus.UNKNOWN;
        }
        return getCurrentLoad().getFormStatus();
    }

    /**
     * Training monotony of the last seven days including today.
     */
    @Transactional(readOnly = true)
    public OptionalDouble getMonotony() {
        return TrainingLoadCalculator.monotony(lastWeekStress());
    }

    @Transactional(readOnly = true)
    public OptionalDouble getStrain() {
        return TrainingLoadCalculator.strain(lastWeekStress());
    }

    /**
     * Project the chart over planned daily stress, starting tomorrow.
     */
    @Transactional(readOnly = true)
    public List<DailyLoadPoint> project(List<Double> plannedStress) {
        DailyLoadPoint current = getCurrentLoad();
        return trainingLoadCalculator.project(current.getDate(), current.getCtl(), current.getAtl(), plannedStress);
    }

    /**
     * Rest days needed until form reaches the target.
     */
    @Transactional(readOnly = true)
    public OptionalInt daysToTargetTsb(double targetTsb, int maxDays) {
        if (maxDays <= 0) {
            throw new IllegalArgumentException("maxDays must be positive, was " + maxDays);
        }
        DailyLoadPoint current = getCurrentLoad();
        return trainingLoadCalculator.daysToTargetTsb(current.getCtl(), current.getAtl(), targetTsb, maxDays);
    }

    private List<Double> lastWeekStress() {
        LocalDate today = LocalDate.now(clock);
        return getTrainingLoad(today.minusDays(6), today).stream()
                .map(DailyLoadPoint::getDailyStress)
                .toList();
    }

    private static Map<LocalDate, Double> stressByDate(Iterable<DailyLoad> days) {
        Map<LocalDate, Double> stress = new HashMap<>();
        for (DailyLoad day : days) {
            stress.put(day.getDate(), day.getDailyStress() != null ? day.getDailyStress().doubleValue() : 0);
        }
        return stress;
    }
}
