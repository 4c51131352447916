package org.operaton.trainload.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.AthleteThresholds;
import org.operaton.trainload.model.ScalingProfile;
import org.operaton.trainload.model.StressMethod;
import org.operaton.trainload.model.StressResult;
import org.operaton.trainload.model.TimedSample;
import org.operaton.trainload.model.WorkoutSignals;
import org.operaton.trainload.util.IntensitySmoother;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Computes the Training Stress Score of a workout.
 *
 * Every strategy normalizes to 100 points for one hour at threshold intensity:
 * TSS = hours * IF^2 * 100. Strategies never throw; unusable inputs give a zero result
 * tagged with the strategy that was attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StressScoreService {

    private static final double SECONDS_PER_HOUR = 3600;

    private final IntensitySmoother intensitySmoother;

    /**
     * Score a workout with the most trustworthy strategy its signals and the thresholds allow.
     * Order: cycling power, running power, running pace, swim pace, heart rate, estimate.
     */
    public StressResult score(WorkoutSignals signals, AthleteThresholds thresholds) {
        ActivityCategory category = signals.getCategory() != null ? signals.getCategory() : ActivityCategory.OTHER;
        double duration = signals.getDurationSeconds();

        if (category == ActivityCategory.BIKE && signals.hasPower() && isPositive(thresholds.getFtpWatts())) {
            OptionalDouble np = normalizedPowerOf(signals);
            if (np.isPresent()) {
                return powerStress(np.getAsDouble(), duration, thresholds.getFtpWatts());
            }
        }

        if (category == ActivityCategory.RUN && signals.hasPower() && isPositive(thresholds.getRunningFtpWatts())) {
            OptionalDouble np = strictNormalizedPowerOf(signals);
            if (np.isPresent()) {
                return runningPowerStress(np.getAsDouble(), duration, thresholds.getRunningFtpWatts());
            }
        }

        if (category == ActivityCategory.RUN && thresholds.getThresholdPaceSecondsPerKm() != null) {
            return runningPaceStress(signals, thresholds.getThresholdPaceSecondsPerKm());
        }

        if (category == ActivityCategory.SWIM && thresholds.getSwimThresholdPacePer100m() != null) {
            double threshold = thresholds.getSwimThresholdPacePer100m();
            Double distance = signals.getDistanceMeters();
            double averagePace = distance != null && distance > 0 ? duration / (distance / 100) : threshold;
            return swimStress(averagePace, duration, threshold);
        }

        if (signals.hasHeartRate() && isPositive(thresholds.getThresholdHeartRate())) {
            double averageHeartRate = averageHeartRateOf(signals);
            return heartRateStress(averageHeartRate, duration, thresholds.getThresholdHeartRate());
        }

        double perceived = signals.getPerceivedIntensity() != null
                ? signals.getPerceivedIntensity()
                : category.defaultPerceivedIntensity();
        return estimatedStress(duration, perceived);
    }

    /**
     * Score a workout and apply the learned factor of the given profile snapshot.
     */
    public StressResult scoreAndScale(WorkoutSignals signals, AthleteThresholds thresholds, ScalingProfile profile) {
        StressResult base = score(signals, thresholds);
        return applyScaling(base, profile, signals.getCategory());
    }

    /**
     * Multiply by the applicable learned factor. A result that was already scaled is returned unchanged.
     */
    public StressResult applyScaling(StressResult result, ScalingProfile profile, ActivityCategory category) {
        if (result.isScalingApplied() || profile == null || !profile.canApplyScaling()) {
            return result;
        }
        double factor = profile.scalingFactorFor(category, result.getIntensityBand());
        log.debug("Scaling {} stress {} by {} (category={}, band={})",
                result.getMethod(), result.getValue(), factor, category, result.getIntensityBand());
        return result.applyScaling(factor);
    }

    /**
     * Power based TSS: duration * NP * IF / (FTP * 3600) * 100.
     */
    public StressResult powerStress(double normalizedPower, double durationSeconds, int ftpWatts) {
        return powerBased(StressMethod.POWER, normalizedPower, durationSeconds, ftpWatts);
    }

    public StressResult runningPowerStress(double normalizedPower, double durationSeconds, int runningFtpWatts) {
        return powerBased(StressMethod.RUNNING_POWER, normalizedPower, durationSeconds, runningFtpWatts);
    }

    private StressResult powerBased(StressMethod method, double normalizedPower, double durationSeconds, int ftp) {
        if (ftp <= 0 || durationSeconds <= 0 || normalizedPower < 0) {
            return StressResult.zero(method);
        }
        double intensityFactor = normalizedPower / ftp;
        double tss = durationSeconds * normalizedPower * intensityFactor / (ftp * SECONDS_PER_HOUR) * 100;
        return StressResult.builder()
                .value(tss)
                .method(method)
                .intensityFactor(intensityFactor)
                .normalizedPower(normalizedPower)
                .build();
    }

    /**
     * Pace based TSS. Pace is inverted: a lower value is faster, so IF = threshold / actual.
     *
     * @param normalizedPaceSecondsPerKm normalized graded pace in seconds per km
     */
    public StressResult paceStress(double normalizedPaceSecondsPerKm, double durationSeconds, double thresholdPace) {
        if (thresholdPace <= 0 || durationSeconds <= 0 || normalizedPaceSecondsPerKm <= 0) {
            return StressResult.zero(StressMethod.PACE);
        }
        double intensityFactor = thresholdPace / normalizedPaceSecondsPerKm;
        return StressResult.builder()
                .value(hoursAtIntensity(durationSeconds, intensityFactor))
                .method(StressMethod.PACE)
                .intensityFactor(intensityFactor)
                .normalizedPace(normalizedPaceSecondsPerKm)
                .build();
    }

    /**
     * Swim TSS from pace per 100 m.
     */
    public StressResult swimStress(double averagePacePer100m, double durationSeconds, double thresholdPacePer100m) {
        return paceStress(averagePacePer100m, durationSeconds, thresholdPacePer100m);
    }

    public StressResult heartRateStress(double averageHeartRate, double durationSeconds, int thresholdHeartRate) {
        if (thresholdHeartRate <= 0 || durationSeconds <= 0 || averageHeartRate <= 0) {
            return StressResult.zero(StressMethod.HEART_RATE);
        }
        double intensityFactor = averageHeartRate / thresholdHeartRate;
        return StressResult.builder()
                .value(hoursAtIntensity(durationSeconds, intensityFactor))
                .method(StressMethod.HEART_RATE)
                .intensityFactor(intensityFactor)
                .averageHeartRate((int) Math.round(averageHeartRate))
                .build();
    }

    /**
     * Crude fallback from perceived effort: IF = 0.5 + intensity * 0.6.
     *
     * @param perceivedIntensity effort on a 0-1 scale, clamped into that range
     */
    public StressResult estimatedStress(double durationSeconds, double perceivedIntensity) {
        if (durationSeconds <= 0) {
            return StressResult.zero(StressMethod.ESTIMATED);
        }
        double intensity = Math.max(0, Math.min(1, perceivedIntensity));
        double intensityFactor = 0.5 + intensity * 0.6;
        return StressResult.builder()
                .value(hoursAtIntensity(durationSeconds, intensityFactor))
                .method(StressMethod.ESTIMATED)
                .intensityFactor(intensityFactor)
                .build();
    }

    private StressResult runningPaceStress(WorkoutSignals signals, double thresholdPace) {
        double duration = signals.getDurationSeconds();
        Double distance = signals.getDistanceMeters();
        double averagePace = distance != null && distance > 0 ? duration / (distance / 1000) : thresholdPace;

        OptionalDouble ngp = intensitySmoother.normalizedGradedPace(signals.getTrackPoints());
        if (ngp.isEmpty() && distance != null && signals.getTotalAscent() != null && signals.getTotalDescent() != null) {
            ngp = intensitySmoother.normalizedGradedPace(averagePace, distance,
                    signals.getTotalAscent(), signals.getTotalDescent());
        }

        return paceStress(ngp.orElse(averagePace), duration, thresholdPace);
    }

    /**
     * NP from samples, else the source's NP, else average power.
     */
    private OptionalDouble normalizedPowerOf(WorkoutSignals signals) {
        OptionalDouble normalized = strictNormalizedPowerOf(signals);
        if (normalized.isPresent()) {
            return normalized;
        }
        if (signals.getAveragePower() != null) {
            return OptionalDouble.of(signals.getAveragePower());
        }
        return signals.getPowerSamples().stream().mapToDouble(TimedSample::value).average();
    }

    /**
     * NP from samples or as reported by the source, never an average.
     */
    private OptionalDouble strictNormalizedPowerOf(WorkoutSignals signals) {
        OptionalDouble fromSamples = intensitySmoother.normalizedPower(signals.getPowerSamples());
        if (fromSamples.isPresent()) {
            return fromSamples;
        }
        if (signals.getNormalizedPower() != null) {
            return OptionalDouble.of(signals.getNormalizedPower());
        }
        return OptionalDouble.empty();
    }

    private double averageHeartRateOf(WorkoutSignals signals) {
        if (signals.getAverageHeartRate() != null) {
            return signals.getAverageHeartRate();
        }
        return signals.getHeartRateSamples().stream().mapToDouble(TimedSample::value).average().orElse(0);
    }

    private static double hoursAtIntensity(double durationSeconds, double intensityFactor) {
        return durationSeconds / SECONDS_PER_HOUR * intensityFactor * intensityFactor * 100;
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }
}
