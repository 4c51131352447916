package org.operaton.trainload.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.FusionOutcome;
import org.operaton.trainload.model.RouteEnrichmentResult;
import org.operaton.trainload.model.WorkoutObservation;
import org.operaton.trainload.model.dto.WorkoutRecordDTO;
import org.operaton.trainload.service.WorkoutFusionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for workouts observed by external sources.
 */
@RestController
@RequestMapping("/api/workouts")
@RequiredArgsConstructor
@Slf4j
public class WorkoutImportController {

    private final WorkoutFusionService workoutFusionService;

    /**
     * Import one external observation.
     *
     * @return 201 when a new workout was created, 200 when merged into an existing one
     */
    @PostMapping("/observations")
    public ResponseEntity<WorkoutRecordDTO> importObservation(@RequestBody WorkoutObservation observation) {
        FusionOutcome outcome = workoutFusionService.importObservation(observation);
        HttpStatus status = outcome.getAction() == FusionOutcome.Action.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(WorkoutRecordDTO.fromOutcome(outcome));
    }

    /**
     * Attach routes from external observations to local workouts without one.
     */
    @PostMapping("/routes/enrich")
    public ResponseEntity<RouteEnrichmentResult> enrichRoutes(@RequestBody List<WorkoutObservation> observations) {
        log.debug("Route enrichment with {} observations", observations.size());
        return ResponseEntity.ok(workoutFusionService.enrichRoutes(observations));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    record ErrorResponse(String error, String message) {}
}
