package org.operaton.trainload.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.MatchResult;
import org.operaton.trainload.model.WorkoutObservation;
import org.operaton.trainload.model.WorkoutSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkoutMatchingService.
 */
class WorkoutMatchingServiceTest {

    private WorkoutMatchingService matchingService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        matchingService = new WorkoutMatchingService(clock, 2);
    }

    @Test
    @DisplayName("Identical workout scores the maximum")
    void testIdenticalWorkout() {
        // Given
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 10, 15), 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation candidate = workout(LocalDateTime.of(2025, 6, 10, 10, 15), 3600L, 10000.0, ActivityCategory.RUN);

        // When
        Optional<MatchResult<WorkoutObservation>> result = matchingService.score(observation, candidate);

        // Then
        assertTrue(result.isPresent());
        assertEquals(120.0, result.get().getScore());
        assertEquals(1.0, result.get().getConfidence());
        assertTrue(result.get().isHighConfidence());
        assertTrue(result.get().isActivityCategoryMatched());
        assertFalse(result.get().isImpreciseTime());
    }

    @Test
    @DisplayName("Workouts days apart are rejected")
    void testDifferentDayRejected() {
        // Given
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 1, 10, 15), 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation candidate = workout(LocalDateTime.of(2025, 6, 11, 10, 15), 3600L, 40000.0, ActivityCategory.BIKE);

        // Then
        assertTrue(matchingService.score(observation, candidate).isEmpty());
    }

    @Test
    @DisplayName("Midnight start time is treated as date only")
    void testMidnightIsImprecise() {
        // Given
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 0, 0), 3600L, null, ActivityCategory.RUN);
        WorkoutObservation sameDay = workout(LocalDateTime.of(2025, 6, 10, 7, 30), 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation nextDay = workout(LocalDateTime.of(2025, 6, 11, 7, 30), 3600L, 10000.0, ActivityCategory.RUN);

        // When
        MatchResult<WorkoutObservation> sameDayResult = matchingService.score(observation, sameDay).orElseThrow();
        MatchResult<WorkoutObservation> nextDayResult = matchingService.score(observation, nextDay).orElseThrow();

        // Then
        assertTrue(sameDayResult.isImpreciseTime());
        assertEquals(95.0, sameDayResult.getScore());
        assertEquals(75.0, nextDayResult.getScore());
        assertNull(sameDayResult.getDistanceDifferencePercent());
    }

    @Test
    @DisplayName("Date-only start gives adjacent-day credit by calendar day")
    void testImpreciseAdjacentDayUsesCalendarDays() {
        // Given: 25 hours apart, but two calendar days
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 0, 0), 3600L, null, ActivityCategory.RUN);
        WorkoutObservation twoDaysBefore = workout(LocalDateTime.of(2025, 6, 8, 23, 0), 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation dayBefore = workout(LocalDateTime.of(2025, 6, 9, 0, 30), 3600L, 10000.0, ActivityCategory.RUN);

        // When / Then
        assertTrue(matchingService.score(observation, twoDaysBefore).isEmpty());
        assertEquals(75.0, matchingService.score(observation, dayBefore).orElseThrow().getScore());
    }

    @Test
    @DisplayName("Start time stamped just now is treated as date only")
    void testRecentStampIsImprecise() {
        assertTrue(matchingService.isImpreciseTime(LocalDateTime.of(2025, 6, 15, 11, 58)));
        assertFalse(matchingService.isImpreciseTime(LocalDateTime.of(2025, 6, 15, 9, 30)));
    }

    @Test
    @DisplayName("Same day but hours apart needs the category and duration to agree")
    void testSameDayLooseMatch() {
        // Given
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 7, 0), 3600L, null, ActivityCategory.BIKE);
        WorkoutObservation sameCategory = workout(LocalDateTime.of(2025, 6, 10, 10, 0), 3600L, null, ActivityCategory.BIKE);
        WorkoutObservation otherCategory = workout(LocalDateTime.of(2025, 6, 10, 10, 0), 3600L, null, ActivityCategory.RUN);

        // Then
        assertEquals(65.0, matchingService.score(observation, sameCategory).orElseThrow().getScore());
        assertTrue(matchingService.score(observation, otherCategory).isEmpty());
    }

    @Test
    @DisplayName("Unknown duration earns no duration points")
    void testUnknownDuration() {
        // Given
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 10, 15), null, 10000.0, ActivityCategory.RUN);
        WorkoutObservation candidate = workout(LocalDateTime.of(2025, 6, 10, 10, 15), 3600L, 10000.0, ActivityCategory.RUN);

        // When
        MatchResult<WorkoutObservation> result = matchingService.score(observation, candidate).orElseThrow();

        // Then
        assertEquals(90.0, result.getScore());
    }

    @Test
    @DisplayName("Best match returns the first of equally scored candidates")
    void testTieGoesToFirstCandidate() {
        // Given
        LocalDateTime start = LocalDateTime.of(2025, 6, 10, 10, 15);
        WorkoutObservation observation = workout(start, 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation first = workout(start, 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation second = workout(start, 3600L, 10000.0, ActivityCategory.RUN);

        // When
        MatchResult<WorkoutObservation> result = matchingService.findBestMatch(observation, List.of(first, second)).orElseThrow();

        // Then
        assertSame(first, result.getCandidate());
    }

    @Test
    @DisplayName("Best match prefers the closer candidate")
    void testBestMatchPrefersHigherScore() {
        // Given
        LocalDateTime start = LocalDateTime.of(2025, 6, 10, 10, 15);
        WorkoutObservation observation = workout(start, 3600L, 10000.0, ActivityCategory.RUN);
        WorkoutObservation loose = workout(start.plusMinutes(3), 3400L, 9700.0, ActivityCategory.RUN);
        WorkoutObservation exact = workout(start.plusSeconds(20), 3610L, 10010.0, ActivityCategory.RUN);

        // When
        MatchResult<WorkoutObservation> best = matchingService.findBestMatch(observation, List.of(loose, exact)).orElseThrow();
        List<MatchResult<WorkoutObservation>> all = matchingService.findAllMatches(observation, List.of(loose, exact));

        // Then
        assertSame(exact, best.getCandidate());
        assertEquals(2, all.size());
        assertSame(exact, all.get(0).getCandidate());
        assertTrue(all.get(0).getConfidence() >= all.get(1).getConfidence());
    }

    @Test
    @DisplayName("No candidates means no match")
    void testNoCandidates() {
        WorkoutObservation observation = workout(LocalDateTime.of(2025, 6, 10, 10, 15), 3600L, 10000.0, ActivityCategory.RUN);

        assertTrue(matchingService.findBestMatch(observation, List.of()).isEmpty());
        assertTrue(matchingService.findAllMatches(observation, List.of()).isEmpty());
    }

    @Test
    @DisplayName("Candidate window spans the search window around the day")
    void testCandidateWindow() {
        LocalDate day = LocalDate.of(2025, 6, 10);

        assertEquals(LocalDateTime.of(2025, 6, 8, 0, 0), matchingService.candidateWindowStart(day));
        assertEquals(LocalDateTime.of(2025, 6, 13, 0, 0), matchingService.candidateWindowEnd(day));
    }

    private WorkoutObservation workout(LocalDateTime start, Long duration, Double distance, ActivityCategory category) {
        return WorkoutObservation.builder()
                .source(WorkoutSource.ACTIVITY_SERVICE)
                .startedAt(start)
                .durationSeconds(duration)
                .distanceMeters(distance)
                .activityCategory(category)
                .build();
    }
}
