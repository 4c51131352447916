package org.operaton.trainload.controller;

import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.model.CalibrationOutcome;
import org.operaton.trainload.model.dto.CalibrationOutcomeDTO;
import org.operaton.trainload.model.dto.CalibrationStatisticsDTO;
import org.operaton.trainload.model.dto.ComparisonRequest;
import org.operaton.trainload.model.dto.ScalingProfileDTO;
import org.operaton.trainload.model.dto.ScreenshotCalibrationRequest;
import org.operaton.trainload.service.CalibrationLearningService;
import org.operaton.trainload.service.CalibrationService;
import org.operaton.trainload.service.ScalingProfileStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for stress score calibration.
 */
@RestController
@RequestMapping("/api/calibration")
@RequiredArgsConstructor
@Slf4j
public class CalibrationController {

    private final CalibrationService calibrationService;
    private final CalibrationLearningService calibrationLearningService;
    private final ScalingProfileStore scalingProfileStore;

    @GetMapping("/profile")
    public ResponseEntity<ScalingProfileDTO> getProfile() {
        return ResponseEntity.ok(ScalingProfileDTO.fromProfile(scalingProfileStore.current()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<CalibrationStatisticsDTO> getStatistics() {
        return ResponseEntity.ok(CalibrationStatisticsDTO.fromStatistics(calibrationLearningService.statistics()));
    }

    /**
     * Calibrate from one performance chart screenshot.
     */
    @PostMapping("/screenshot")
    public ResponseEntity<CalibrationOutcomeDTO> calibrateFromScreenshot(
            @Valid @RequestBody ScreenshotCalibrationRequest request) {
        log.debug("Screenshot calibration with {} text elements", request.getElements().size());
        CalibrationOutcome outcome = calibrationService.processScreenshot(request);
        return ResponseEntity.ok(CalibrationOutcomeDTO.fromOutcome(outcome));
    }

    /**
     * Queue several screenshots on the calibration worker.
     *
     * @return number of queued screenshots
     */
    @PostMapping("/screenshots")
    public ResponseEntity<QueuedResponse> queueScreenshots(
            @RequestBody List<ScreenshotCalibrationRequest> requests) {
        requests.forEach(calibrationService::processScreenshotAsync);
        log.info("Queued {} screenshots for calibration", requests.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new QueuedResponse(requests.size()));
    }

    /**
     * Calibrate from an external stress score for one workout.
     */
    @PostMapping("/comparison")
    public ResponseEntity<CalibrationOutcomeDTO> calibrateFromComparison(@Valid @RequestBody ComparisonRequest request) {
        CalibrationOutcome outcome = calibrationService.processComparison(request);
        return ResponseEntity.ok(CalibrationOutcomeDTO.fromOutcome(outcome));
    }

    @PostMapping("/points/{id}/invalidate")
    public ResponseEntity<ScalingProfileDTO> invalidatePoint(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "flagged by operator") String reason) {
        return ResponseEntity.ok(ScalingProfileDTO.fromProfile(calibrationLearningService.invalidate(id, reason)));
    }

    @PutMapping("/learning")
    public ResponseEntity<ScalingProfileDTO> setLearningEnabled(@RequestParam boolean enabled) {
        return ResponseEntity.ok(ScalingProfileDTO.fromProfile(calibrationLearningService.setLearningEnabled(enabled)));
    }

    /**
     * Delete all learning data and return to a neutral profile.
     */
    @DeleteMapping
    public ResponseEntity<ScalingProfileDTO> reset() {
        return ResponseEntity.ok(ScalingProfileDTO.fromProfile(calibrationLearningService.reset()));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    record QueuedResponse(int queued) {}

    record ErrorResponse(String error, String message) {}
}
