package org.operaton.trainload.util;

import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.exception.InvalidLoadParameterException;
import org.operaton.trainload.model.TimedSample;
import org.operaton.trainload.model.TrackPoint;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Smoothed intensity metrics derived from raw samples.
 * Normalized Power weights hard surges more than a plain average,
 * Normalized Graded Pace corrects running pace for the cost of climbing.
 */
@Component
@Slf4j
public class IntensitySmoother {

    public static final int DEFAULT_ROLLING_WINDOW_SECONDS = 30;

    // Grade factor bounds, keeps the polynomial from extrapolating at extreme grades
    private static final double MIN_GRADE_FACTOR = 0.7;
    private static final double MAX_GRADE_FACTOR = 2.0;

    // Metabolic cost of running on flat ground in J/(kg*m)
    private static final double FLAT_GROUND_COST = 3.6;

    public OptionalDouble normalizedPower(List<TimedSample> samples) {
        return normalizedPower(samples, DEFAULT_ROLLING_WINDOW_SECONDS);
    }

    /**
     * Normalized Power in watts.
     *
     * @param samples power samples, in any order
     * @param windowSeconds rolling mean window
     * @return normalized power, or empty when there are not enough samples
     */
    public OptionalDouble normalizedPower(List<TimedSample> samples, int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new InvalidLoadParameterException("Rolling window must be positive, was " + windowSeconds);
        }
        if (samples == null || samples.size() <= windowSeconds) {
            return OptionalDouble.empty();
        }

        List<TimedSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(TimedSample::timestamp));

        double[] resampled = resampleToOneSecond(sorted);
        if (resampled.length <= windowSeconds) {
            log.debug("Only {} resampled seconds, need more than {}", resampled.length, windowSeconds);
            return OptionalDouble.empty();
        }

        double windowSum = 0;
        for (int i = 0; i < windowSeconds - 1; i++) {
            windowSum += resampled[i];
        }

        double fourthPowerSum = 0;
        int count = 0;
        for (int i = windowSeconds - 1; i < resampled.length; i++) {
            windowSum += resampled[i];
            if (i >= windowSeconds) {
                windowSum -= resampled[i - windowSeconds];
            }
            double rollingMean = windowSum / windowSeconds;
            fourthPowerSum += Math.pow(rollingMean, 4);
            count++;
        }

        return OptionalDouble.of(Math.pow(fourthPowerSum / count, 0.25));
    }

    /**
     * Linear interpolation onto a uniform one second grid starting at the first sample.
     */
    private double[] resampleToOneSecond(List<TimedSample> sorted) {
        TimedSample first = sorted.get(0);
        TimedSample last = sorted.get(sorted.size() - 1);
        long totalSeconds = Duration.between(first.timestamp(), last.timestamp()).getSeconds();
        if (totalSeconds <= 0) {
            return new double[0];
        }

        double[] resampled = new double[(int) totalSeconds];
        int upper = 1;
        for (int second = 0; second < totalSeconds; second++) {
            while (upper < sorted.size() - 1 && secondsFrom(first, sorted.get(upper)) < second) {
                upper++;
            }
            TimedSample before = sorted.get(upper - 1);
            TimedSample after = sorted.get(upper);
            double t0 = secondsFrom(first, before);
            double t1 = secondsFrom(first, after);
            if (t1 <= t0) {
                resampled[second] = after.value();
            } else {
                double fraction = Math.max(0, Math.min(1, (second - t0) / (t1 - t0)));
                resampled[second] = before.value() + fraction * (after.value() - before.value());
            }
        }
        return resampled;
    }

    private static double secondsFrom(TimedSample origin, TimedSample sample) {
        return Duration.between(origin.timestamp(), sample.timestamp()).toMillis() / 1000.0;
    }

    /**
     * Normalized Graded Pace in seconds per km from per-sample trackpoints.
     * Pairs with no elapsed time, no pace or no horizontal distance are skipped.
     */
    public OptionalDouble normalizedGradedPace(List<TrackPoint> trackPoints) {
        if (trackPoints == null || trackPoints.size() < 2) {
            return OptionalDouble.empty();
        }

        double adjustedSum = 0;
        int count = 0;
        for (int i = 1; i < trackPoints.size(); i++) {
            TrackPoint previous = trackPoints.get(i - 1);
            TrackPoint current = trackPoints.get(i);

            double seconds = Duration.between(previous.timestamp(), current.timestamp()).toMillis() / 1000.0;
            double pace = current.paceSecondsPerKm();
            if (seconds <= 0 || pace <= 0) {
                continue;
            }

            double horizontalMeters = seconds / pace * 1000;
            if (horizontalMeters <= 0) {
                continue;
            }

            double gradePercent = (current.elevationMeters() - previous.elevationMeters()) / horizontalMeters * 100;
            adjustedSum += pace / gradeAdjustmentFactor(gradePercent);
            count++;
        }

        if (count == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(adjustedSum / count);
    }

    /**
     * Normalized Graded Pace from workout totals when no trackpoints are available.
     * Average grade plus a climbing penalty for the total elevation change stands in for the grade profile.
     */
    public OptionalDouble normalizedGradedPace(double averagePaceSecondsPerKm, double distanceMeters,
                                               double totalAscent, double totalDescent) {
        if (averagePaceSecondsPerKm <= 0 || distanceMeters <= 0) {
            return OptionalDouble.empty();
        }

        double averageGrade = (totalAscent - totalDescent) / distanceMeters * 100;
        double climbingPenalty = (totalAscent + totalDescent) / distanceMeters * 50;
        double effectiveGrade = averageGrade + climbingPenalty;

        return OptionalDouble.of(averagePaceSecondsPerKm / gradeAdjustmentFactor(effectiveGrade));
    }

    /**
     * Energy cost multiplier of running at a grade, relative to flat ground.
     * Quintic fit of the Minetti cost curve, clamped to [0.7, 2.0].
     *
     * @param gradePercent grade in percent, positive uphill
     */
    public double gradeAdjustmentFactor(double gradePercent) {
        double g = gradePercent / 100;
        double cost = 155.4 * Math.pow(g, 5)
                - 30.4 * Math.pow(g, 4)
                - 43.3 * Math.pow(g, 3)
                + 46.3 * g * g
                + 19.5 * g
                + FLAT_GROUND_COST;
        double factor = cost / FLAT_GROUND_COST;
        return Math.max(MIN_GRADE_FACTOR, Math.min(MAX_GRADE_FACTOR, factor));
    }

    /**
     * Variability index NP / average power, 1.0 when there is no average.
     */
    public double variabilityIndex(double normalizedPower, double averagePower) {
        if (averagePower <= 0) {
            return 1.0;
        }
        return normalizedPower / averagePower;
    }
}
