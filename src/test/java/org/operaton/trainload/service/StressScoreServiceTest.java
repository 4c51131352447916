package org.operaton.trainload.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.AthleteThresholds;
import org.operaton.trainload.model.IntensityBand;
import org.operaton.trainload.model.ScalingProfile;
import org.operaton.trainload.model.StratumFactor;
import org.operaton.trainload.model.StressMethod;
import org.operaton.trainload.model.StressResult;
import org.operaton.trainload.model.WorkoutSignals;
import org.operaton.trainload.util.IntensitySmoother;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StressScoreService.
 */
class StressScoreServiceTest {

    private static final double TOLERANCE = 1e-6;

    private StressScoreService stressScoreService;
    private AthleteThresholds thresholds;

    @BeforeEach
    void setUp() {
        stressScoreService = new StressScoreService(new IntensitySmoother());
        thresholds = AthleteThresholds.builder()
                .ftpWatts(250)
                .runningFtpWatts(300)
                .thresholdPaceSecondsPerKm(270.0)
                .swimThresholdPacePer100m(100.0)
                .thresholdHeartRate(170)
                .build();
    }

    @Test
    @DisplayName("One hour at FTP scores 100 from power")
    void testPowerAtThreshold() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.BIKE)
                .durationSeconds(3600)
                .normalizedPower(250.0)
                .averageHeartRate(150.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.POWER, result.getMethod());
        assertEquals(100.0, result.getValue(), TOLERANCE);
        assertEquals(1.0, result.getIntensityFactor(), TOLERANCE);
        assertEquals(250.0, result.getNormalizedPower());
    }

    @Test
    @DisplayName("Cycling falls back to average power without normalized power")
    void testPowerFromAverage() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.BIKE)
                .durationSeconds(7200)
                .averagePower(200.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.POWER, result.getMethod());
        assertEquals(0.8, result.getIntensityFactor(), TOLERANCE);
        assertEquals(128.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("One hour at running FTP scores 100 from running power")
    void testRunningPower() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.RUN)
                .durationSeconds(3600)
                .distanceMeters(13000.0)
                .normalizedPower(300.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.RUNNING_POWER, result.getMethod());
        assertEquals(100.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Running power needs normalized power, average power falls through to pace")
    void testRunningAveragePowerFallsThroughToPace() {
        // Given: 10 km in 45 minutes is exactly threshold pace
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.RUN)
                .durationSeconds(2700)
                .distanceMeters(10000.0)
                .averagePower(280.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.PACE, result.getMethod());
        assertEquals(1.0, result.getIntensityFactor(), TOLERANCE);
        assertEquals(75.0, result.getValue(), TOLERANCE);
        assertEquals(270.0, result.getNormalizedPace(), TOLERANCE);
    }

    @Test
    @DisplayName("Pace is inverted: running faster than threshold gives IF above 1")
    void testPaceStress() {
        StressResult atThreshold = stressScoreService.paceStress(270, 3600, 270);
        StressResult faster = stressScoreService.paceStress(250, 3600, 270);

        assertEquals(100.0, atThreshold.getValue(), TOLERANCE);
        assertTrue(faster.getIntensityFactor() > 1.0);
        assertTrue(faster.getValue() > 100.0);
    }

    @Test
    @DisplayName("One hour at threshold swim pace scores 100")
    void testSwimStress() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.SWIM)
                .durationSeconds(3600)
                .distanceMeters(3600.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.PACE, result.getMethod());
        assertEquals(100.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("One hour at threshold heart rate scores 100")
    void testHeartRateStress() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.STRENGTH)
                .durationSeconds(3600)
                .averageHeartRate(170.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, thresholds);

        // Then
        assertEquals(StressMethod.HEART_RATE, result.getMethod());
        assertEquals(100.0, result.getValue(), TOLERANCE);
        assertEquals(170, result.getAverageHeartRate());
    }

    @Test
    @DisplayName("Cycling without an FTP is scored from heart rate")
    void testBikeWithoutFtpUsesHeartRate() {
        // Given
        AthleteThresholds heartRateOnly = AthleteThresholds.builder().thresholdHeartRate(170).build();
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.BIKE)
                .durationSeconds(3600)
                .averagePower(220.0)
                .averageHeartRate(153.0)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, heartRateOnly);

        // Then
        assertEquals(StressMethod.HEART_RATE, result.getMethod());
        assertEquals(0.9, result.getIntensityFactor(), TOLERANCE);
        assertEquals(81.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Workouts without signals are estimated from perceived effort")
    void testEstimatedStress() {
        // Given
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.OTHER)
                .durationSeconds(3600)
                .perceivedIntensity(0.5)
                .build();

        // When
        StressResult result = stressScoreService.score(signals, AthleteThresholds.builder().build());

        // Then
        assertEquals(StressMethod.ESTIMATED, result.getMethod());
        assertEquals(0.8, result.getIntensityFactor(), TOLERANCE);
        assertEquals(64.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Perceived effort is clamped to the 0-1 range")
    void testEstimatedStressClamped() {
        assertEquals(1.1, stressScoreService.estimatedStress(3600, 5.0).getIntensityFactor(), TOLERANCE);
        assertEquals(0.5, stressScoreService.estimatedStress(3600, -1.0).getIntensityFactor(), TOLERANCE);
    }

    @Test
    @DisplayName("Unusable inputs give a zero result instead of failing")
    void testGuards() {
        StressResult noFtp = stressScoreService.powerStress(200, 3600, 0);
        assertEquals(0.0, noFtp.getValue());
        assertEquals(StressMethod.POWER, noFtp.getMethod());

        assertEquals(0.0, stressScoreService.paceStress(0, 3600, 270).getValue());
        assertEquals(0.0, stressScoreService.heartRateStress(150, 0, 170).getValue());
        assertEquals(0.0, stressScoreService.estimatedStress(-10, 0.5).getValue());
    }

    @Test
    @DisplayName("Learned factor is applied once and recorded on the result")
    void testScalingAppliedOnce() {
        // Given
        ScalingProfile profile = ScalingProfile.builder()
                .globalFactor(1.2)
                .globalConfidence(0.8)
                .globalSampleCount(10)
                .build();
        StressResult base = stressScoreService.heartRateStress(170, 3600, 170);

        // When
        StressResult scaled = stressScoreService.applyScaling(base, profile, ActivityCategory.RUN);
        StressResult again = stressScoreService.applyScaling(scaled, profile, ActivityCategory.RUN);

        // Then
        assertTrue(scaled.isScalingApplied());
        assertEquals(120.0, scaled.getValue(), TOLERANCE);
        assertEquals(100.0, scaled.getPreScalingValue(), TOLERANCE);
        assertEquals(1.2, scaled.getAppliedScalingFactor(), TOLERANCE);
        assertSame(scaled, again);
    }

    @Test
    @DisplayName("Sport factor takes precedence over the global factor")
    void testSportFactorPreferred() {
        // Given
        ScalingProfile profile = ScalingProfile.builder()
                .globalFactor(1.2)
                .globalConfidence(0.8)
                .globalSampleCount(10)
                .sportFactor(ActivityCategory.BIKE, new StratumFactor(0.9, 4, 0.7))
                .bandFactor(IntensityBand.TEMPO, new StratumFactor(1.1, 5, 0.7))
                .build();
        WorkoutSignals signals = WorkoutSignals.builder()
                .category(ActivityCategory.BIKE)
                .durationSeconds(3600)
                .normalizedPower(250.0)
                .build();

        // When
        StressResult result = stressScoreService.scoreAndScale(signals, thresholds, profile);

        // Then
        assertEquals(90.0, result.getValue(), TOLERANCE);
    }

    @Test
    @DisplayName("Profile below its confidence threshold leaves the score unscaled")
    void testScalingSkippedWhenNotApplicable() {
        // Given
        ScalingProfile profile = ScalingProfile.builder()
                .globalFactor(1.3)
                .globalConfidence(0.3)
                .globalSampleCount(10)
                .build();
        StressResult base = stressScoreService.heartRateStress(170, 3600, 170);

        // When
        StressResult result = stressScoreService.applyScaling(base, profile, ActivityCategory.RUN);

        // Then
        assertFalse(result.isScalingApplied());
        assertEquals(100.0, result.getValue(), TOLERANCE);
    }
}
