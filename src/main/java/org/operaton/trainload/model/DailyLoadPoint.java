package org.operaton.trainload.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * One day of the Performance Management Chart.
 * Form (TSB) is always derived from fitness and fatigue, never stored.
 */
@Value
public class DailyLoadPoint {

    LocalDate date;
    double dailyStress;
    double ctl;
    double atl;

    public double getTsb() {
        return ctl - atl;
    }

    /**
     * Acute:chronic workload ratio, or null while there is no chronic load yet.
     */
    public Double getAcwr() {
        return ctl > 0 ? atl / ctl : null;
    }

    public FormStatus getFormStatus() {
        return FormStatus.fromTsb(getTsb());
    }

    public AcwrStatus getAcwrStatus() {
        return AcwrStatus.fromRatio(getAcwr());
    }
}
