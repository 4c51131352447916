package org.operaton.trainload.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.CalibrationOutcome;
import org.operaton.trainload.model.CalibrationStage;
import org.operaton.trainload.model.CalibrationStatistics;
import org.operaton.trainload.model.DerivationMethod;
import org.operaton.trainload.model.IntensityBand;
import org.operaton.trainload.model.PmcReading;
import org.operaton.trainload.model.ScalingProfile;
import org.operaton.trainload.model.StratumFactor;
import org.operaton.trainload.model.entity.CalibrationDataPoint;
import org.operaton.trainload.model.entity.CalibrationRecord;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.operaton.trainload.repository.CalibrationDataPointRepository;
import org.operaton.trainload.repository.CalibrationRecordRepository;
import org.operaton.trainload.repository.DailyLoadRepository;
import org.operaton.trainload.util.TrainingLoadCalculator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Learns stress scaling factors from ground-truth observations.
 *
 * Each ground-truth observation becomes at most one calibration data point. After every change the
 * profile is recomputed from scratch over all usable points:
 * factor = sum(ratio * weight) / sum(weight), weight = 0.5^(age / halfLife) * sourceConfidence.
 *
 * All writes hold a single lock and commit inside it, so at most one recompute is in flight
 * and the profile snapshot is replaced whole.
 */
@Service
@Slf4j
public class CalibrationLearningService {

    private static final int FULL_SAMPLE_COUNT = 10;
    private static final double RATIO_STD_DEV_SCALE = 0.3;
    private static final double DERIVED_CONFIDENCE_PENALTY = 0.9;
    private static final double MIN_DERIVATION_AGREEMENT = 0.8;

    private final CalibrationDataPointRepository dataPointRepository;
    private final CalibrationRecordRepository calibrationRecordRepository;
    private final DailyLoadRepository dailyLoadRepository;
    private final ScalingProfileStore profileStore;
    private final TrainingLoadCalculator trainingLoadCalculator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final double halfLifeDays;
    private final double minSourceConfidence;

    private final ReentrantLock writeLock = new ReentrantLock();

    public CalibrationLearningService(CalibrationDataPointRepository dataPointRepository,
                                      CalibrationRecordRepository calibrationRecordRepository,
                                      DailyLoadRepository dailyLoadRepository,
                                      ScalingProfileStore profileStore,
                                      TrainingLoadCalculator trainingLoadCalculator,
                                      PlatformTransactionManager transactionManager,
                                      Clock clock,
                                      @Value("${trainload.calibration.half-life-days:30}") double halfLifeDays,
                                      @Value("${trainload.calibration.min-source-confidence:0.5}") double minSourceConfidence) {
        this.dataPointRepository = dataPointRepository;
        this.calibrationRecordRepository = calibrationRecordRepository;
        this.dailyLoadRepository = dailyLoadRepository;
        this.profileStore = profileStore;
        this.trainingLoadCalculator = trainingLoadCalculator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.halfLifeDays = halfLifeDays;
        this.minSourceConfidence = minSourceConfidence;
    }

    /**
     * Learn from a performance chart reading for one day.
     *
     * A daily TSS on the reading gives a direct point. Otherwise the day's stress is derived from the change
     * in fitness (and fatigue, when both agree) against yesterday's known values.
     *
     * @param reading ground truth, dated today when the reading carries no date
     * @param calculatedDailyStress this system's unscaled stress total for the same day
     * @param primaryCategory sport of the day's workouts, ignored for multi-sport days
     * @param calibrationRecordId stored record the reading came from, may be null
     */
    public CalibrationOutcome processReading(PmcReading reading,
                                             double calculatedDailyStress,
                                             ActivityCategory primaryCategory,
                                             boolean multiSport,
                                             UUID calibrationRecordId) {
        return locked(() -> {
            ScalingProfile profile = profileStore.current();
            if (!profile.isLearningEnabled()) {
                log.info("Learning disabled, ignoring performance chart reading");
                return CalibrationOutcome.skipped(CalibrationStage.IDLE, "learning disabled", profile);
            }

            LocalDate effectiveDate = reading.getEffectiveDate() != null ? reading.getEffectiveDate() : LocalDate.now(clock);
            if (calculatedDailyStress <= 0) {
                return skipNotPositive(effectiveDate, calculatedDailyStress, profile);
            }
            ActivityCategory category = multiSport ? null : primaryCategory;

            Optional<CalibrationDataPoint> point = createDataPoint(reading, effectiveDate, calculatedDailyStress, category);
            if (point.isEmpty()) {
                log.warn("No calibration data point from reading on {}: no daily TSS and no usable load change", effectiveDate);
                return CalibrationOutcome.skipped(CalibrationStage.PROFILE_LOADED,
                        "no daily TSS and no usable fitness change", profile);
            }

            CalibrationDataPoint dataPoint = point.get();
            dataPoint.setMultiSport(multiSport);
            dataPoint.setCalibrationRecordId(calibrationRecordId);
            return storeAndRecompute(List.of(dataPoint));
        });
    }

    /**
     * Learn from an external stress score for one specific local workout.
     *
     * @param externalIntensityFactor IF reported with the external score, the workout's own IF when null
     * @param matchConfidence how sure the match between external and local workout is, used as source confidence
     */
    public CalibrationOutcome recordDirectComparison(WorkoutRecord workout,
                                                     double externalTss,
                                                     Double externalIntensityFactor,
                                                     double matchConfidence) {
        return locked(() -> {
            ScalingProfile profile = profileStore.current();
            if (!profile.isLearningEnabled()) {
                log.info("Learning disabled, ignoring direct comparison for workout {}", workout.getId());
                return CalibrationOutcome.skipped(CalibrationStage.IDLE, "learning disabled", profile);
            }
            if (workout.getUnscaledStressScore() <= 0) {
                return skipNotPositive(workout.getStartedAt().toLocalDate(), workout.getUnscaledStressScore(), profile);
            }
            return storeAndRecompute(List.of(directPoint(workout, externalTss, externalIntensityFactor, matchConfidence)));
        });
    }

    /**
     * Direct comparison plus the external fitness, fatigue and form for the workout's day.
     * The chart values are stored as a calibration record and become "yesterday" for the next day's derivation.
     */
    public CalibrationOutcome recordCombined(WorkoutRecord workout,
                                             double externalTss,
                                             Double externalIntensityFactor,
                                             PmcReading pmc,
                                             double matchConfidence) {
        return locked(() -> {
            ScalingProfile profile = profileStore.current();
            if (!profile.isLearningEnabled()) {
                log.info("Learning disabled, ignoring combined calibration for workout {}", workout.getId());
                return CalibrationOutcome.skipped(CalibrationStage.IDLE, "learning disabled", profile);
            }

            CalibrationRecord record = calibrationRecordRepository.save(CalibrationRecord.builder()
                    .effectiveDate(workout.getStartedAt().toLocalDate())
                    .ctl(pmc.getCtl())
                    .atl(pmc.getAtl())
                    .tsb(pmc.getTsb())
                    .dailyTss(externalTss)
                    .confidence(matchConfidence)
                    .origin(CalibrationRecord.Origin.MANUAL_COMPARISON)
                    .build());

            if (workout.getUnscaledStressScore() <= 0) {
                return skipNotPositive(record.getEffectiveDate(), workout.getUnscaledStressScore(), profile);
            }
            CalibrationDataPoint point = directPoint(workout, externalTss, externalIntensityFactor, matchConfidence);
            point.setCalibrationRecordId(record.getId());
            return storeAndRecompute(List.of(point));
        });
    }

    /**
     * Soft delete a point and recompute without it.
     *
     * @throws EntityNotFoundException when no point has the id
     */
    public ScalingProfile invalidate(UUID dataPointId, String reason) {
        return locked(() -> {
            CalibrationDataPoint point = dataPointRepository.findById(dataPointId)
                    .orElseThrow(() -> new EntityNotFoundException("Calibration data point not found: " + dataPointId));
            point.invalidate(reason);
            dataPointRepository.save(point);
            log.info("Invalidated calibration data point {} on {}: {}", dataPointId, point.getEffectiveDate(), reason);
            return profileStore.replace(recomputeProfile(profileStore.current()));
        });
    }

    public ScalingProfile setLearningEnabled(boolean enabled) {
        return locked(() -> {
            ScalingProfile current = profileStore.current();
            log.info("Learning {}", enabled ? "enabled" : "disabled");
            return profileStore.replace(current.toBuilder().learningEnabled(enabled).build());
        });
    }

    /**
     * Delete every data point and return to a neutral profile. The learning switch is kept.
     */
    public ScalingProfile reset() {
        return locked(() -> {
            boolean learningEnabled = profileStore.current().isLearningEnabled();
            dataPointRepository.deleteAll();
            log.info("Calibration learning data reset");
            return profileStore.replace(profileStore.neutral().toBuilder().learningEnabled(learningEnabled).build());
        });
    }

    public CalibrationStatistics statistics() {
        List<CalibrationDataPoint> valid = dataPointRepository.findByValidTrue();
        List<CalibrationDataPoint> direct = valid.stream()
                .filter(p -> p.getDerivationMethod() == DerivationMethod.DIRECT)
                .toList();
        Map<ActivityCategory, Long> perSport = direct.stream()
                .filter(p -> p.getActivityCategory() != null)
                .collect(Collectors.groupingBy(CalibrationDataPoint::getActivityCategory,
                        () -> new EnumMap<>(ActivityCategory.class), Collectors.counting()));

        return CalibrationStatistics.builder()
                .profile(profileStore.current())
                .validDataPoints(valid.size())
                .directComparisons(direct.size())
                .directComparisonsPerSport(perSport)
                .recentDataPoints(dataPointRepository.findTop20ByOrderByEffectiveDateDescCreatedAtDesc())
                .build();
    }

    /**
     * Data point for a reading: direct when it carries a daily TSS, otherwise derived from load changes.
     */
    Optional<CalibrationDataPoint> createDataPoint(PmcReading reading, LocalDate effectiveDate,
                                                   double calculatedDailyStress, ActivityCategory category) {
        if (reading.getDailyTss() != null && reading.getDailyTss() > 0) {
            return Optional.of(dataPoint(effectiveDate, reading.getDailyTss(), calculatedDailyStress,
                    reading.getConfidence(), category, DerivationMethod.DIRECT));
        }

        if (reading.getCtl() == null && reading.getAtl() == null) {
            return Optional.empty();
        }

        Optional<double[]> yesterday = yesterdayValues(effectiveDate);
        if (yesterday.isEmpty()) {
            log.debug("No known fitness and fatigue for the day before {}", effectiveDate);
            return Optional.empty();
        }
        double yesterdayCtl = yesterday.get()[0];
        double yesterdayAtl = yesterday.get()[1];

        Double fromCtl = reading.getCtl() != null
                ? trainingLoadCalculator.stressFromCtlChange(yesterdayCtl, reading.getCtl())
                : null;
        Double fromAtl = reading.getAtl() != null
                ? trainingLoadCalculator.stressFromAtlChange(yesterdayAtl, reading.getAtl())
                : null;

        if (fromCtl != null && fromAtl != null && fromCtl >= 0 && fromAtl >= 0) {
            double average = (fromCtl + fromAtl) / 2;
            double agreement = average > 0 ? 1 - Math.abs(fromCtl - fromAtl) / average : 0;
            if (agreement >= MIN_DERIVATION_AGREEMENT) {
                log.debug("Cross-validated stress on {}: ctl={}, atl={}, agreement={}", effectiveDate, fromCtl, fromAtl, agreement);
                return Optional.of(dataPoint(effectiveDate, average, calculatedDailyStress,
                        reading.getConfidence() * Math.min(1.0, agreement), category, DerivationMethod.CROSS_VALIDATED));
            }
        }

        if (fromCtl != null) {
            return Optional.of(dataPoint(effectiveDate, Math.max(0, fromCtl), calculatedDailyStress,
                    reading.getConfidence() * DERIVED_CONFIDENCE_PENALTY, category, DerivationMethod.CTL_DERIVED));
        }
        return Optional.of(dataPoint(effectiveDate, Math.max(0, fromAtl), calculatedDailyStress,
                reading.getConfidence() * DERIVED_CONFIDENCE_PENALTY, category, DerivationMethod.ATL_DERIVED));
    }

    /**
     * Full recompute of global and stratified factors from all usable points.
     * A stratum without points keeps its previous factor.
     */
    ScalingProfile recomputeProfile(ScalingProfile prior) {
        LocalDate today = LocalDate.now(clock);
        List<CalibrationDataPoint> usable = dataPointRepository.findByValidTrue().stream()
                .filter(p -> p.isUsableForLearning(minSourceConfidence))
                .toList();

        StratumFactor global = weightedFactor(usable, today);
        ScalingProfile.ScalingProfileBuilder builder = prior.toBuilder()
                .globalFactor(global.getFactor())
                .globalConfidence(global.getConfidence())
                .globalSampleCount(global.getSampleCount());

        for (ActivityCategory category : ActivityCategory.values()) {
            List<CalibrationDataPoint> subset = filter(usable, p -> p.getActivityCategory() == category && !p.isMultiSport());
            if (!subset.isEmpty()) {
                builder.sportFactor(category, weightedFactor(subset, today));
            }
        }
        for (IntensityBand band : IntensityBand.values()) {
            List<CalibrationDataPoint> subset = filter(usable, p -> p.getIntensityBand() == band);
            if (!subset.isEmpty()) {
                builder.bandFactor(band, weightedFactor(subset, today));
            }
        }

        log.debug("Recomputed scaling from {} usable points: factor={}, confidence={}",
                usable.size(), global.getFactor(), global.getConfidence());
        return builder.build();
    }

    /**
     * Weighted factor and confidence of a set of usable points; neutral with zero confidence when empty.
     *
     * confidence = 0.4 * min(1, n / 10) + 0.4 * max(0, 1 - stdDev(ratios) / 0.3) + 0.2 * mean(timeWeight)
     */
    StratumFactor weightedFactor(List<CalibrationDataPoint> points, LocalDate today) {
        if (points.isEmpty()) {
            return new StratumFactor(1.0, 0, 0.0);
        }

        double weightedSum = 0;
        double totalWeight = 0;
        double timeWeightSum = 0;
        List<Double> ratios = new ArrayList<>(points.size());

        for (CalibrationDataPoint point : points) {
            double timeWeight = point.timeWeight(today, halfLifeDays);
            double weight = point.learningWeight(today, halfLifeDays);
            weightedSum += point.getScalingRatio() * weight;
            totalWeight += weight;
            timeWeightSum += timeWeight;
            ratios.add(point.getScalingRatio());
        }

        double factor = totalWeight > 0 ? weightedSum / totalWeight : 1.0;
        int n = points.size();
        double sampleScore = Math.min(1.0, (double) n / FULL_SAMPLE_COUNT);
        double consistencyScore = Math.max(0, 1.0 - Math.sqrt(sampleVariance(ratios)) / RATIO_STD_DEV_SCALE);
        double recencyScore = timeWeightSum / n;
        double confidence = 0.4 * sampleScore + 0.4 * consistencyScore + 0.2 * recencyScore;

        return new StratumFactor(factor, n, confidence);
    }

    private CalibrationOutcome storeAndRecompute(List<CalibrationDataPoint> points) {
        dataPointRepository.saveAll(points);
        for (CalibrationDataPoint point : points) {
            log.info("Calibration data point on {} ({}): extracted={}, calculated={}, ratio={}",
                    point.getEffectiveDate(), point.getDerivationMethod(), point.getExtractedValue(),
                    point.getCalculatedValue(), point.getScalingRatio());
            if (!point.isUsableForLearning(minSourceConfidence)) {
                log.warn("Calibration data point on {} is not usable for learning (confidence={}, calculated={})",
                        point.getEffectiveDate(), point.getSourceConfidence(), point.getCalculatedValue());
            }
        }

        ScalingProfile recomputed = recomputeProfile(profileStore.current());
        ScalingProfile stored = profileStore.replace(recomputed);

        return CalibrationOutcome.builder()
                .stage(CalibrationStage.PERSISTED)
                .dataPointsCreated(points.size())
                .profile(stored)
                .build();
    }

    private CalibrationOutcome skipNotPositive(LocalDate effectiveDate, double calculated, ScalingProfile profile) {
        log.warn("No calibration data point on {}: calculated stress {} is not positive", effectiveDate, calculated);
        return CalibrationOutcome.skipped(CalibrationStage.PROFILE_LOADED, "calculated stress is not positive", profile);
    }

    private CalibrationDataPoint directPoint(WorkoutRecord workout, double externalTss,
                                             Double externalIntensityFactor, double matchConfidence) {
        CalibrationDataPoint point = dataPoint(workout.getStartedAt().toLocalDate(), externalTss,
                workout.getUnscaledStressScore(), matchConfidence, workout.getActivityCategory(), DerivationMethod.DIRECT);

        Double intensityFactor = externalIntensityFactor != null ? externalIntensityFactor : workout.getIntensityFactor();
        if (intensityFactor != null && intensityFactor > 0) {
            point.setWorkoutIntensityFactor(intensityFactor);
            point.setIntensityBand(IntensityBand.fromIntensityFactor(intensityFactor));
        }
        return point;
    }

    private CalibrationDataPoint dataPoint(LocalDate effectiveDate, double extracted, double calculated,
                                           double confidence, ActivityCategory category, DerivationMethod method) {
        return CalibrationDataPoint.builder()
                .effectiveDate(effectiveDate)
                .extractedValue(extracted)
                .calculatedValue(calculated)
                .scalingRatio(CalibrationDataPoint.ratio(extracted, calculated))
                .sourceConfidence(confidence)
                .activityCategory(category)
                .derivationMethod(method)
                .build();
    }

    /**
     * Yesterday's fitness and fatigue: from received ground truth first, else from the stored chart.
     */
    private Optional<double[]> yesterdayValues(LocalDate date) {
        LocalDate yesterday = date.minusDays(1);
        Optional<double[]> fromRecord = calibrationRecordRepository.findFirstByEffectiveDateOrderByCreatedAtDesc(yesterday)
                .filter(r -> r.getCtl() != null && r.getAtl() != null)
                .map(r -> new double[]{r.getCtl(), r.getAtl()});
        if (fromRecord.isPresent()) {
            return fromRecord;
        }
        return dailyLoadRepository.findByDate(yesterday)
                .map(d -> new double[]{d.getChronicTrainingLoad().doubleValue(), d.getAcuteTrainingLoad().doubleValue()});
    }

    private <T> T locked(Supplier<T> work) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            profileStore.evict();
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private static List<CalibrationDataPoint> filter(List<CalibrationDataPoint> points,
                                                     Predicate<CalibrationDataPoint> predicate) {
        return points.stream().filter(predicate).toList();
    }

    /**
     * Sample variance (n - 1), zero for fewer than two values.
     */
    private static double sampleVariance(List<Double> values) {
        if (values.size() <= 1) {
            return 0;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double squared = values.stream().mapToDouble(v -> Math.pow(v - mean, 2)).sum();
        return squared / (values.size() - 1);
    }
}
