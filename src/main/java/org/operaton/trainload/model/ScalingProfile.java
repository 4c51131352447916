package org.operaton.trainload.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Immutable snapshot of the learned stress scaling factors.
 * A new snapshot with a higher version replaces the previous one on every recompute;
 * readers never observe a partially updated profile.
 */
@Value
@Builder(toBuilder = true)
public class ScalingProfile {

    long version;

    @Builder.Default
    double globalFactor = 1.0;
    double globalConfidence;
    int globalSampleCount;

    @Singular("sportFactor")
    Map<ActivityCategory, StratumFactor> perSport;

    @Singular("bandFactor")
    Map<IntensityBand, StratumFactor> perIntensityBand;

    @Builder.Default
    boolean learningEnabled = true;

    /** Minimum number of usable points before any factor is applied. */
    @Builder.Default
    int minSamples = 3;

    @Builder.Default
    double minConfidence = 0.5;

    /** Sanity bounds for the global factor. */
    @Builder.Default
    double minFactor = 0.8;

    @Builder.Default
    double maxFactor = 1.5;

    LocalDateTime updatedAt;

    public static ScalingProfile neutral() {
        return ScalingProfile.builder().build();
    }

    public boolean canApplyScaling() {
        return learningEnabled
                && globalSampleCount >= minSamples
                && globalConfidence >= minConfidence
                && globalFactor >= minFactor
                && globalFactor <= maxFactor;
    }

    /**
     * Factor to apply to a workout's stress: sport specific, then intensity band, then global.
     * Returns 1.0 while the profile is not applicable.
     */
    public double scalingFactorFor(ActivityCategory category, IntensityBand band) {
        if (!canApplyScaling()) {
            return 1.0;
        }
        StratumFactor sport = category != null ? perSport.get(category) : null;
        if (sport != null && sport.getSampleCount() >= minSamples) {
            return sport.getFactor();
        }
        StratumFactor intensity = band != null ? perIntensityBand.get(band) : null;
        if (intensity != null && intensity.getSampleCount() >= minSamples) {
            return intensity.getFactor();
        }
        return globalFactor;
    }
}
