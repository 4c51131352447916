package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Ground-truth fitness, fatigue, form and daily stress read from an external source.
 */
@Value
@Builder(toBuilder = true)
public class PmcReading {

    Double ctl;
    Double atl;
    Double tsb;
    Double dailyTss;

    /** Day the values belong to, null when the source did not state one. */
    LocalDate effectiveDate;

    double confidence;
    int matchedValues;
}
