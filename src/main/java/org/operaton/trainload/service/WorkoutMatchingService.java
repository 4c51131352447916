package org.operaton.trainload.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.MatchResult;
import org.operaton.trainload.model.MatchableWorkout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether workouts observed by different sources describe the same real activity.
 *
 * Candidates are scored additively on start time, duration, activity category and distance.
 * The matcher only returns decisions; callers do the deduplication or enrichment.
 */
@Service
@Slf4j
public class WorkoutMatchingService {

    public static final double MIN_MATCH_SCORE = 50;
    public static final double MAX_SCORE = 120;

    // Stamped this close to "now" means the operator entered a date without a real time
    private static final long RECENT_STAMP_SECONDS = 300;

    private static final double CATEGORY_MATCH_POINTS = 25;

    private final Clock clock;
    private final int searchWindowDays;

    public WorkoutMatchingService(Clock clock,
                                  @Value("${trainload.matching.search-window-days:2}") int searchWindowDays) {
        this.clock = clock;
        this.searchWindowDays = searchWindowDays;
    }

    /**
     * Start of the candidate window: local midnight of the observation's day minus the search window.
     */
    public LocalDateTime candidateWindowStart(LocalDate day) {
        return day.minusDays(searchWindowDays).atStartOfDay();
    }

    /**
     * Exclusive end of the candidate window.
     */
    public LocalDateTime candidateWindowEnd(LocalDate day) {
        return day.plusDays(searchWindowDays + 1L).atStartOfDay();
    }

    /**
     * Best candidate scoring at least {@link #MIN_MATCH_SCORE}.
     * Only a strictly higher score replaces the current best, so ties go to the earlier candidate in the pool.
     */
    public <T extends MatchableWorkout> Optional<MatchResult<T>> findBestMatch(MatchableWorkout observation,
                                                                              List<T> candidates) {
        if (observation == null || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        MatchResult<T> best = null;
        for (T candidate : candidates) {
            Optional<MatchResult<T>> result = score(observation, candidate);
            if (result.isPresent() && (best == null || result.get().getScore() > best.getScore())) {
                best = result.get();
            }
        }

        if (best == null) {
            log.debug("No match for workout at {} among {} candidates", observation.getStartedAt(), candidates.size());
        } else {
            log.debug("Best match for workout at {}: score={}, confidence={}",
                    observation.getStartedAt(), best.getScore(), best.getConfidence());
        }
        return Optional.ofNullable(best);
    }

    /**
     * All accepted candidates, most confident first. The sort is stable, equal confidence keeps pool order.
     */
    public <T extends MatchableWorkout> List<MatchResult<T>> findAllMatches(MatchableWorkout observation,
                                                                            List<T> candidates) {
        List<MatchResult<T>> matches = new ArrayList<>();
        if (observation == null || candidates == null) {
            return matches;
        }
        for (T candidate : candidates) {
            score(observation, candidate).ifPresent(matches::add);
        }
        matches.sort(Comparator.comparingDouble((MatchResult<T> m) -> m.getConfidence()).reversed());
        return matches;
    }

    /**
     * Score one candidate against an observation.
     *
     * @return the result, or empty when the start times are too far apart or the total is below the threshold
     */
    public <T extends MatchableWorkout> Optional<MatchResult<T>> score(MatchableWorkout observation, T candidate) {
        if (observation.getStartedAt() == null || candidate.getStartedAt() == null) {
            return Optional.empty();
        }

        LocalDateTime observedStart = observation.getStartedAt();
        LocalDateTime candidateStart = candidate.getStartedAt();
        double timeDifference = Math.abs(Duration.between(observedStart, candidateStart).getSeconds());
        boolean imprecise = isImpreciseTime(observedStart);

        double score = 0;

        if (imprecise) {
            if (observedStart.toLocalDate().equals(candidateStart.toLocalDate())) {
                score += 40;
            } else if (Math.abs(ChronoUnit.DAYS.between(observedStart.toLocalDate(), candidateStart.toLocalDate())) <= 1) {
                score += 20;
            } else {
                return Optional.empty();
            }
        } else {
            if (timeDifference < 60) {
                score += 50;
            } else if (timeDifference < 120) {
                score += 35;
            } else if (timeDifference < 300) {
                score += 20;
            } else if (observedStart.toLocalDate().equals(candidateStart.toLocalDate())) {
                score += 10;
            } else {
                return Optional.empty();
            }
        }

        double durationDifference = durationDifference(observation.getDurationSeconds(), candidate.getDurationSeconds());
        if (durationDifference < 0.02) {
            score += 30;
        } else if (durationDifference < 0.05) {
            score += 25;
        } else if (durationDifference < 0.10) {
            score += 15;
        } else if (durationDifference < 0.20) {
            score += 5;
        }

        boolean categoryMatched = observation.getActivityCategory() != null
                && observation.getActivityCategory() == candidate.getActivityCategory();
        if (categoryMatched) {
            score += CATEGORY_MATCH_POINTS;
        }

        Double distanceDifference = null;
        Double observedDistance = observation.getDistanceMeters();
        if (observedDistance != null && observedDistance > 0 && candidate.getDistanceMeters() != null) {
            distanceDifference = Math.abs(candidate.getDistanceMeters() - observedDistance) / observedDistance;
            if (distanceDifference < 0.02) {
                score += 15;
            } else if (distanceDifference < 0.05) {
                score += 10;
            } else if (distanceDifference < 0.10) {
                score += 5;
            }
        }

        if (score < MIN_MATCH_SCORE) {
            log.debug("Rejected candidate at {}: score {} below {}", candidateStart, score, MIN_MATCH_SCORE);
            return Optional.empty();
        }

        return Optional.of(new MatchResult<>(
                candidate,
                score,
                Math.min(1.0, score / MAX_SCORE),
                timeDifference,
                durationDifference * 100,
                categoryMatched,
                distanceDifference != null ? distanceDifference * 100 : null,
                imprecise));
    }

    /**
     * A start time at exactly midnight, or stamped within five minutes of now, is taken to carry a date only.
     */
    public boolean isImpreciseTime(LocalDateTime startedAt) {
        boolean midnight = startedAt.getHour() == 0 && startedAt.getMinute() == 0;
        long secondsFromNow = Math.abs(Duration.between(LocalDateTime.now(clock), startedAt).getSeconds());
        return midnight || secondsFromNow < RECENT_STAMP_SECONDS;
    }

    /**
     * Relative duration difference against the observation, infinite when either side is unknown.
     */
    private static double durationDifference(Long observed, Long candidate) {
        if (observed == null || candidate == null) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(candidate - observed) / (double) Math.max(1L, observed);
    }
}
