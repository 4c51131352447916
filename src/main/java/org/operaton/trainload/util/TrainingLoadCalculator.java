package org.operaton.trainload.util;

import org.operaton.trainload.exception.InvalidLoadParameterException;
import org.operaton.trainload.model.DailyLoadPoint;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Fitness/fatigue model of the Performance Management Chart.
 *
 * CTL_today = CTL_yesterday + (TSS_today - CTL_yesterday) / ctlTau
 * ATL_today = ATL_yesterday + (TSS_today - ATL_yesterday) / atlTau
 * TSB = CTL - ATL
 *
 * Each day depends on the previous one, so series are computed as a strict sequential fold.
 */
public final class TrainingLoadCalculator {

    public static final double DEFAULT_CTL_TIME_CONSTANT = 42;
    public static final double DEFAULT_ATL_TIME_CONSTANT = 7;

    private final double ctlTimeConstant;
    private final double atlTimeConstant;

    public TrainingLoadCalculator() {
        this(DEFAULT_CTL_TIME_CONSTANT, DEFAULT_ATL_TIME_CONSTANT);
    }

    public TrainingLoadCalculator(double ctlTimeConstant, double atlTimeConstant) {
        requirePositive("CTL time constant", ctlTimeConstant);
        requirePositive("ATL time constant", atlTimeConstant);
        this.ctlTimeConstant = ctlTimeConstant;
        this.atlTimeConstant = atlTimeConstant;
    }

    public double getCtlTimeConstant() {
        return ctlTimeConstant;
    }

    public double getAtlTimeConstant() {
        return atlTimeConstant;
    }

    /**
     * Single-pole exponential moving average step.
     */
    public static double decay(double previous, double todayStress, double timeConstant) {
        requirePositive("time constant", timeConstant);
        return previous + (todayStress - previous) / timeConstant;
    }

    /**
     * Advance fitness and fatigue by one day.
     */
    public DailyLoadPoint advance(LocalDate date, double previousCtl, double previousAtl, double todayStress) {
        double ctl = decay(previousCtl, todayStress, ctlTimeConstant);
        double atl = decay(previousAtl, todayStress, atlTimeConstant);
        return new DailyLoadPoint(date, todayStress, ctl, atl);
    }

    /**
     * Compute the chart for every calendar day of the inclusive range.
     * Days without an entry in {@code dailyStress} count as rest days.
     */
    public List<DailyLoadPoint> computeSeries(Map<LocalDate, Double> dailyStress,
                                              LocalDate start,
                                              LocalDate end,
                                              double initialCtl,
                                              double initialAtl) {
        if (start == null || end == null || end.isBefore(start)) {
            return Collections.emptyList();
        }

        List<DailyLoadPoint> series = new ArrayList<>();
        double ctl = initialCtl;
        double atl = initialAtl;

        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            double stress = dailyStress.getOrDefault(day, 0.0);
            DailyLoadPoint point = advance(day, ctl, atl, stress);
            ctl = point.getCtl();
            atl = point.getAtl();
            series.add(point);
        }

        return series;
    }

    /**
     * Run the recurrence forward over planned stress values, one per day after {@code today}.
     */
    public List<DailyLoadPoint> project(LocalDate today, double currentCtl, double currentAtl,
                                        List<Double> plannedStress) {
        List<DailyLoadPoint> projection = new ArrayList<>(plannedStress.size());
        double ctl = currentCtl;
        double atl = currentAtl;
        LocalDate day = today;

        for (Double planned : plannedStress) {
            day = day.plusDays(1);
            DailyLoadPoint point = advance(day, ctl, atl, planned != null ? planned : 0.0);
            ctl = point.getCtl();
            atl = point.getAtl();
            projection.add(point);
        }

        return projection;
    }

    /**
     * Number of rest days until form reaches {@code targetTsb}, empty if not reached within {@code maxDays}.
     */
    public OptionalInt daysToTargetTsb(double currentCtl, double currentAtl, double targetTsb, int maxDays) {
        double ctl = currentCtl;
        double atl = currentAtl;

        for (int day = 1; day <= maxDays; day++) {
            ctl = decay(ctl, 0, ctlTimeConstant);
            atl = decay(atl, 0, atlTimeConstant);
            if (ctl - atl >= targetTsb) {
                return OptionalInt.of(day);
            }
        }

        return OptionalInt.empty();
    }

    /**
     * Daily stress implied by a change in chronic load: the CTL recurrence solved for TSS.
     */
    public double stressFromCtlChange(double yesterdayCtl, double todayCtl) {
        return ctlTimeConstant * (todayCtl - yesterdayCtl) + yesterdayCtl;
    }

    /**
     * Daily stress implied by a change in acute load.
     */
    public double stressFromAtlChange(double yesterdayAtl, double todayAtl) {
        return atlTimeConstant * (todayAtl - yesterdayAtl) + yesterdayAtl;
    }

    public static Optional<Double> acwr(double ctl, double atl) {
        if (ctl <= 0) {
            return Optional.empty();
        }
        return Optional.of(atl / ctl);
    }

    /**
     * Training monotony of the last seven days: mean / standard deviation.
     */
    public static OptionalDouble monotony(List<Double> dailyStress) {
        if (dailyStress.size() < 7) {
            return OptionalDouble.empty();
        }

        List<Double> lastWeek = dailyStress.subList(dailyStress.size() - 7, dailyStress.size());
        double mean = lastWeek.stream().mapToDouble(Double::doubleValue).sum() / 7;
        if (mean <= 0) {
            return OptionalDouble.empty();
        }

        double variance = lastWeek.stream()
                .mapToDouble(v -> Math.pow(v - mean, 2))
                .sum() / 7;
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(mean / stdDev);
    }

    /**
     * Weekly strain: sum of the last seven days times monotony.
     */
    public static OptionalDouble strain(List<Double> dailyStress) {
        OptionalDouble monotony = monotony(dailyStress);
        if (monotony.isEmpty()) {
            return OptionalDouble.empty();
        }
        double weekSum = dailyStress.subList(dailyStress.size() - 7, dailyStress.size()).stream()
                .mapToDouble(Double::doubleValue)
                .sum();
        return OptionalDouble.of(weekSum * monotony.getAsDouble());
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new InvalidLoadParameterException(name + " must be positive, was " + value);
        }
    }
}
