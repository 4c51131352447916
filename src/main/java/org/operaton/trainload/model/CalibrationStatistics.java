package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;
import org.operaton.trainload.model.entity.CalibrationDataPoint;

import java.util.List;
import java.util.Map;

/**
 * Summary of the learning state for display.
 */
@Value
@Builder
public class CalibrationStatistics {

    public static final double COMPLETE_CONFIDENCE = 0.95;
    public static final int DISABLE_IMPORT_MIN_SAMPLES = 10;
    public static final double DISABLE_IMPORT_MIN_CONFIDENCE = 0.9;

    ScalingProfile profile;
    int validDataPoints;
    int directComparisons;
    Map<ActivityCategory, Long> directComparisonsPerSport;
    List<CalibrationDataPoint> recentDataPoints;

    public boolean isCalibrationComplete() {
        return profile.getGlobalConfidence() >= COMPLETE_CONFIDENCE;
    }

    /**
     * Enough high quality data that manual ground-truth input is no longer needed.
     */
    public boolean isCanDisableImport() {
        return profile.getGlobalSampleCount() >= DISABLE_IMPORT_MIN_SAMPLES
                && profile.getGlobalConfidence() >= DISABLE_IMPORT_MIN_CONFIDENCE;
    }
}
