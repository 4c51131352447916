package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Value;

/**
 * Training Stress Score of a single workout together with how it was obtained.
 * Scaling by a learned factor is recorded on the result so it is applied at most once.
 */
@Value
@Builder(toBuilder = true)
public class StressResult {

    double value;
    StressMethod method;
    double intensityFactor;

    /** Normalized power in watts, for power based methods. */
    Double normalizedPower;

    /** Normalized graded pace in seconds per km (seconds per 100 m for swims). */
    Double normalizedPace;

    Integer averageHeartRate;

    boolean scalingApplied;
    Double appliedScalingFactor;
    Double preScalingValue;

    /**
     * Result used when the attempted strategy had unusable inputs.
     */
    public static StressResult zero(StressMethod method) {
        return StressResult.builder()
                .value(0)
                .method(method)
                .intensityFactor(0)
                .build();
    }

    /**
     * Multiplies the value by a learned factor unless a factor was already applied.
     */
    public StressResult applyScaling(double factor) {
        if (scalingApplied) {
            return this;
        }
        return toBuilder()
                .preScalingValue(value)
                .value(value * factor)
                .appliedScalingFactor(factor)
                .scalingApplied(true)
                .build();
    }

    public IntensityBand getIntensityBand() {
        return IntensityBand.fromIntensityFactor(intensityFactor);
    }
}
