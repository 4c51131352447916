package org.operaton.trainload.config;

import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.AthleteThresholds;
import org.operaton.trainload.util.TrainingLoadCalculator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the load model and the athlete's thresholds.
 */
@Configuration
@Slf4j
public class TrainingLoadConfiguration {

    @Bean
    public TrainingLoadCalculator trainingLoadCalculator(
            @Value("${trainload.load.ctl-time-constant:42}") double ctlTimeConstant,
            @Value("${trainload.load.atl-time-constant:7}") double atlTimeConstant) {
        log.info("Load model time constants: ctl={} days, atl={} days", ctlTimeConstant, atlTimeConstant);
        return new TrainingLoadCalculator(ctlTimeConstant, atlTimeConstant);
    }

    /**
     * Threshold values from configuration. Unset properties stay unknown.
     */
    @Bean
    public AthleteThresholds athleteThresholds(
            @Value("${trainload.athlete.ftp-watts:#{null}}") Integer ftpWatts,
            @Value("${trainload.athlete.running-ftp-watts:#{null}}") Integer runningFtpWatts,
            @Value("${trainload.athlete.threshold-pace-seconds-per-km:#{null}}") Double thresholdPace,
            @Value("${trainload.athlete.swim-threshold-pace-per-100m:#{null}}") Double swimThresholdPace,
            @Value("${trainload.athlete.threshold-heart-rate:#{null}}") Integer thresholdHeartRate) {
        return AthleteThresholds.builder()
                .ftpWatts(ftpWatts)
                .runningFtpWatts(runningFtpWatts)
                .thresholdPaceSecondsPerKm(thresholdPace)
                .swimThresholdPacePer100m(swimThresholdPace)
                .thresholdHeartRate(thresholdHeartRate)
                .build();
    }
}
