package org.operaton.trainload.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.CalibrationOutcome;
import org.operaton.trainload.model.CalibrationStage;
import org.operaton.trainload.model.MatchResult;
import org.operaton.trainload.model.PmcReading;
import org.operaton.trainload.model.dto.ComparisonRequest;
import org.operaton.trainload.model.dto.ScreenshotCalibrationRequest;
import org.operaton.trainload.model.entity.CalibrationRecord;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.operaton.trainload.repository.CalibrationRecordRepository;
import org.operaton.trainload.repository.WorkoutRecordRepository;
import org.operaton.trainload.util.PmcScreenshotParser;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns ground-truth input into calibration events.
 * Screenshots are parsed and compared with the day's local stress; manual comparisons are matched to a local workout first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationService {

    private final PmcScreenshotParser pmcScreenshotParser;
    private final CalibrationLearningService calibrationLearningService;
    private final WorkoutMatchingService workoutMatchingService;
    private final WorkoutRecordRepository workoutRecordRepository;
    private final CalibrationRecordRepository calibrationRecordRepository;
    private final Clock clock;

    /**
     * Calibrate from the recognized text of a performance chart screenshot.
     */
    public CalibrationOutcome processScreenshot(ScreenshotCalibrationRequest request) {
        Optional<PmcReading> parsed = pmcScreenshotParser.parse(request.getElements());
        if (parsed.isEmpty()) {
            log.warn("Screenshot with {} text elements yielded no chart values", request.getElements().size());
            return CalibrationOutcome.skipped(CalibrationStage.IDLE, "no chart values found on screenshot", null);
        }

        LocalDate effectiveDate = request.getEffectiveDate() != null ? request.getEffectiveDate() : LocalDate.now(clock);
        PmcReading reading = parsed.get().toBuilder().effectiveDate(effectiveDate).build();

        CalibrationRecord record = calibrationRecordRepository.save(CalibrationRecord.builder()
                .effectiveDate(effectiveDate)
                .ctl(reading.getCtl())
                .atl(reading.getAtl())
                .tsb(reading.getTsb())
                .dailyTss(reading.getDailyTss())
                .confidence(reading.getConfidence())
                .origin(CalibrationRecord.Origin.SCREENSHOT)
                .build());

        List<WorkoutRecord> workouts = workoutRecordRepository.findStartedBetween(
                effectiveDate.atStartOfDay(), effectiveDate.plusDays(1).atStartOfDay());
        double calculatedStress = workouts.stream().mapToDouble(WorkoutRecord::getUnscaledStressScore).sum();
        Map<ActivityCategory, Double> stressPerCategory = stressPerCategory(workouts);
        ActivityCategory primary = stressPerCategory.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
        boolean multiSport = stressPerCategory.size() > 1;

        log.debug("Screenshot for {}: ctl={}, atl={}, tsb={}, tss={}, calculated={}, primary={}, multiSport={}",
                effectiveDate, reading.getCtl(), reading.getAtl(), reading.getTsb(), reading.getDailyTss(),
                calculatedStress, primary, multiSport);

        return calibrationLearningService.processReading(reading, calculatedStress, primary, multiSport, record.getId());
    }

    /**
     * Queue a screenshot on the calibration worker. Events run one after another;
     * failures go to the async uncaught exception handler.
     */
    @Async("calibrationExecutor")
    public void processScreenshotAsync(ScreenshotCalibrationRequest request) {
        CalibrationOutcome outcome = processScreenshot(request);
        log.info("Queued screenshot calibration finished at stage {}, skip reason: {}",
                outcome.getStage(), outcome.getSkipReason());
    }

    /**
     * Calibrate from an external stress score for a workout, matched against the local store.
     */
    public CalibrationOutcome processComparison(ComparisonRequest request) {
        LocalDate day = request.getStartedAt().toLocalDate();
        List<WorkoutRecord> candidates = workoutRecordRepository.findStartedBetween(
                workoutMatchingService.candidateWindowStart(day),
                workoutMatchingService.candidateWindowEnd(day));

        Optional<MatchResult<WorkoutRecord>> match = workoutMatchingService.findBestMatch(request, candidates);
        if (match.isEmpty()) {
            log.warn("No local workout matches the comparison at {} ({} candidates)", request.getStartedAt(), candidates.size());
            return CalibrationOutcome.skipped(CalibrationStage.IDLE, "no matching local workout", null);
        }

        WorkoutRecord workout = match.get().getCandidate();
        double confidence = match.get().getConfidence();
        log.debug("Comparison matched workout {} with confidence {}", workout.getId(), confidence);

        if (request.hasPmcValues()) {
            PmcReading pmc = PmcReading.builder()
                    .ctl(request.getCtl())
                    .atl(request.getAtl())
                    .tsb(request.getTsb() != null ? request.getTsb() : request.getCtl() - request.getAtl())
                    .dailyTss(request.getExternalTss())
                    .effectiveDate(day)
                    .confidence(confidence)
                    .build();
            return calibrationLearningService.recordCombined(workout, request.getExternalTss(),
                    request.getExternalIntensityFactor(), pmc, confidence);
        }
        return calibrationLearningService.recordDirectComparison(workout, request.getExternalTss(),
                request.getExternalIntensityFactor(), confidence);
    }

    private static Map<ActivityCategory, Double> stressPerCategory(List<WorkoutRecord> workouts) {
        Map<ActivityCategory, Double> perCategory = new EnumMap<>(ActivityCategory.class);
        for (WorkoutRecord workout : workouts) {
            perCategory.merge(workout.getActivityCategory(), workout.getUnscaledStressScore(), Double::sum);
        }
        return perCategory;
    }
}
