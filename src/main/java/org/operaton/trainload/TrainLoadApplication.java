package org.operaton.trainload;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main Spring Boot application class for trainload.
 * Estimates training load from workouts and calibrates its own stress scores against external ground truth.
 */
@SpringBootApplication
@Slf4j
public class TrainLoadApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainLoadApplication.class, args);
        log.info("trainload application started successfully!");
    }

    /**
     * Source of "now" for age-based weighting and the recent-timestamp heuristic.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
