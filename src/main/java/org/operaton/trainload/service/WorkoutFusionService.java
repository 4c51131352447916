package org.operaton.trainload.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.exception.StoredStateException;
import org.operaton.trainload.model.ActivityCategory;
import org.operaton.trainload.model.AthleteThresholds;
import org.operaton.trainload.model.FusionOutcome;
import org.operaton.trainload.model.MatchResult;
import org.operaton.trainload.model.RouteEnrichmentResult;
import org.operaton.trainload.model.RoutePoint;
import org.operaton.trainload.model.StressResult;
import org.operaton.trainload.model.WorkoutObservation;
import org.operaton.trainload.model.WorkoutSignals;
import org.operaton.trainload.model.WorkoutSource;
import org.operaton.trainload.model.entity.WorkoutRecord;
import org.operaton.trainload.repository.WorkoutRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Fuses workouts observed by external sources into the local canonical records.
 * Observations are never modified; only missing fields of local records are filled in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutFusionService {

    private final WorkoutRecordRepository workoutRecordRepository;
    private final WorkoutMatchingService workoutMatchingService;
    private final StressScoreService stressScoreService;
    private final ScalingProfileStore scalingProfileStore;
    private final TrainingLoadService trainingLoadService;
    private final AthleteThresholds athleteThresholds;
    private final ObjectMapper objectMapper;

    /**
     * Import one observation: merge it into the best matching local record, or create a new record.
     */
    @Transactional
    public FusionOutcome importObservation(WorkoutObservation observation) {
        if (observation.getStartedAt() == null) {
            throw new IllegalArgumentException("Observation has no start time");
        }
        if (observation.getDurationSeconds() == null || observation.getDurationSeconds() <= 0) {
            throw new IllegalArgumentException("Observation duration must be positive");
        }

        if (observation.getSourceId() != null && observation.getSource() != null) {
            Optional<WorkoutRecord> known = workoutRecordRepository
                    .findBySourceAndSourceId(observation.getSource(), observation.getSourceId());
            if (known.isPresent()) {
                log.debug("Observation {}/{} already imported as {}",
                        observation.getSource(), observation.getSourceId(), known.get().getId());
                return FusionOutcome.merged(mergeInto(known.get(), observation), 1.0);
            }
        }

        LocalDate day = observation.getStartedAt().toLocalDate();
        List<WorkoutRecord> candidates = workoutRecordRepository.findStartedBetween(
                workoutMatchingService.candidateWindowStart(day),
                workoutMatchingService.candidateWindowEnd(day));

        Optional<MatchResult<WorkoutRecord>> match = workoutMatchingService.findBestMatch(observation, candidates);
        if (match.isPresent()) {
            WorkoutRecord merged = mergeInto(match.get().getCandidate(), observation);
            log.info("Merged {} observation {} into workout {} (confidence {})",
                    observation.getSource(), observation.getSourceId(), merged.getId(), match.get().getConfidence());
            return FusionOutcome.merged(merged, match.get().getConfidence());
        }

        WorkoutRecord record = WorkoutRecord.builder()
                .source(observation.getSource() != null ? observation.getSource() : WorkoutSource.MANUAL)
                .sourceId(observation.getSourceId())
                .title(observation.getTitle())
                .activityCategory(observation.getActivityCategory() != null
                        ? observation.getActivityCategory()
                        : ActivityCategory.OTHER)
                .startedAt(observation.getStartedAt())
                .durationSeconds(observation.getDurationSeconds())
                .distanceMeters(observation.getDistanceMeters())
                .averageHeartRate(observation.getAverageHeartRate())
                .averagePower(observation.getAveragePower())
                .normalizedPower(observation.getNormalizedPower())
                .totalAscent(observation.getTotalAscent())
                .totalDescent(observation.getTotalDescent())
                .indoor(observation.isIndoor())
                .routeJson(observation.hasRoute() ? toJson(observation.getRoute()) : null)
                .build();

        record.applyStress(stressScoreService.scoreAndScale(signalsOf(record), athleteThresholds,
                scalingProfileStore.current()));
        WorkoutRecord saved = workoutRecordRepository.save(record);
        trainingLoadService.updateTrainingLoad(saved);

        log.info("Created workout {} from {} observation {}: TSS={} ({})", saved.getId(),
                observation.getSource(), observation.getSourceId(), saved.getTrainingStressScore(), saved.getStressMethod());
        return FusionOutcome.created(saved);
    }

    /**
     * Attach routes from external observations to local outdoor workouts that have none.
     */
    @Transactional
    public RouteEnrichmentResult enrichRoutes(List<WorkoutObservation> received) {
        List<WorkoutObservation> observations = received == null ? List.of() : received.stream()
                .filter(o -> o.getStartedAt() != null)
                .toList();
        if (observations.isEmpty()) {
            return RouteEnrichmentResult.builder().build();
        }

        LocalDate first = observations.stream()
                .map(o -> o.getStartedAt().toLocalDate())
                .min(Comparator.naturalOrder())
                .orElseThrow();
        LocalDate last = observations.stream()
                .map(o -> o.getStartedAt().toLocalDate())
                .max(Comparator.naturalOrder())
                .orElseThrow();

        List<WorkoutRecord> withoutRoute = workoutRecordRepository.findOutdoorWithoutRoute(
                workoutMatchingService.candidateWindowStart(first),
                workoutMatchingService.candidateWindowEnd(last));

        int matched = 0;
        int enriched = 0;
        int noRoute = 0;
        int unmatched = 0;

        for (WorkoutRecord record : withoutRoute) {
            Optional<MatchResult<WorkoutObservation>> match = workoutMatchingService.findBestMatch(record, observations);
            if (match.isEmpty()) {
                unmatched++;
                continue;
            }
            matched++;
            WorkoutObservation observation = match.get().getCandidate();
            if (!observation.hasRoute()) {
                noRoute++;
                continue;
            }
            record.setRouteJson(toJson(observation.getRoute()));
            workoutRecordRepository.save(record);
            enriched++;
        }

        log.info("Route enrichment: total={}, matched={}, enriched={}, noRoute={}, unmatched={}",
                withoutRoute.size(), matched, enriched, noRoute, unmatched);

        return RouteEnrichmentResult.builder()
                .total(withoutRoute.size())
                .matched(matched)
                .enriched(enriched)
                .noRoute(noRoute)
                .unmatched(unmatched)
                .build();
    }

    /**
     * Fill the record's missing fields from the observation. Rescores when the new data allows a better method.
     */
    private WorkoutRecord mergeInto(WorkoutRecord record, WorkoutObservation observation) {
        boolean changed = false;
        if (record.getDistanceMeters() == null && observation.getDistanceMeters() != null) {
            record.setDistanceMeters(observation.getDistanceMeters());
            changed = true;
        }
        if (record.getAverageHeartRate() == null && observation.getAverageHeartRate() != null) {
            record.setAverageHeartRate(observation.getAverageHeartRate());
            changed = true;
        }
        if (record.getAveragePower() == null && observation.getAveragePower() != null) {
            record.setAveragePower(observation.getAveragePower());
            changed = true;
        }
        if (record.getNormalizedPower() == null && observation.getNormalizedPower() != null) {
            record.setNormalizedPower(observation.getNormalizedPower());
            changed = true;
        }
        if (record.getTotalAscent() == null && observation.getTotalAscent() != null) {
            record.setTotalAscent(observation.getTotalAscent());
            record.setTotalDescent(observation.getTotalDescent());
            changed = true;
        }
        if (!record.hasRoute() && observation.hasRoute()) {
            record.setRouteJson(toJson(observation.getRoute()));
            changed = true;
        }

        if (!changed) {
            return record;
        }

        StressResult rescored = stressScoreService.scoreAndScale(signalsOf(record), athleteThresholds,
                scalingProfileStore.current());
        boolean better = record.getStressMethod() == null
                || rescored.getMethod().qualityRank() > record.getStressMethod().qualityRank();
        if (better) {
            log.debug("Rescored workout {} with {} instead of {}", record.getId(), rescored.getMethod(), record.getStressMethod());
            record.applyStress(rescored);
        }

        WorkoutRecord saved = workoutRecordRepository.save(record);
        if (better) {
            trainingLoadService.updateTrainingLoad(saved);
        }
        return saved;
    }

    private WorkoutSignals signalsOf(WorkoutRecord record) {
        return WorkoutSignals.builder()
                .category(record.getActivityCategory())
                .durationSeconds(record.getDurationSeconds() != null ? record.getDurationSeconds() : 0)
                .distanceMeters(record.getDistanceMeters())
                .normalizedPower(record.getNormalizedPower() != null ? record.getNormalizedPower().doubleValue() : null)
                .averagePower(record.getAveragePower() != null ? record.getAveragePower().doubleValue() : null)
                .averageHeartRate(record.getAverageHeartRate() != null ? record.getAverageHeartRate().doubleValue() : null)
                .totalAscent(record.getTotalAscent())
                .totalDescent(record.getTotalDescent())
                .build();
    }

    private String toJson(List<RoutePoint> route) {
        try {
            return objectMapper.writeValueAsString(route);
        } catch (JsonProcessingException e) {
            throw new StoredStateException("Failed to serialize route to JSON", e);
        }
    }
}
