package org.operaton.trainload.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.trainload.exception.InvalidLoadParameterException;
import org.operaton.trainload.model.DailyLoadPoint;
import org.operaton.trainload.model.dto.DailyLoadDTO;
import org.operaton.trainload.model.dto.FormSummaryDTO;
import org.operaton.trainload.model.dto.ProjectionRequest;
import org.operaton.trainload.service.TrainingLoadService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * REST controller for the Performance Management Chart.
 */
@RestController
@RequestMapping("/api/training-load")
@RequiredArgsConstructor
@Slf4j
public class TrainingLoadController {

    private final TrainingLoadService trainingLoadService;

    /**
     * Get the chart for an inclusive date range, one entry per calendar day.
     *
     * @param start first day
     * @param end last day
     * @return daily load ordered by date
     */
    @GetMapping
    public ResponseEntity<List<DailyLoadDTO>> getTrainingLoad(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        log.debug("Training load requested from {} to {}", start, end);

        List<DailyLoadDTO> series = trainingLoadService.getTrainingLoad(start, end).stream()
                .map(DailyLoadDTO::fromPoint)
                .toList();
        return ResponseEntity.ok(series);
    }

    /**
     * Today's form with weekly monotony and strain.
     */
    @GetMapping("/form")
    public ResponseEntity<FormSummaryDTO> getForm() {
        DailyLoadPoint today = trainingLoadService.getCurrentLoad();
        OptionalDouble monotony = trainingLoadService.getMonotony();
        OptionalDouble strain = trainingLoadService.getStrain();

        return ResponseEntity.ok(FormSummaryDTO.builder()
                .today(DailyLoadDTO.fromPoint(today))
                .formStatus(trainingLoadService.getCurrentFormStatus())
                .monotony(monotony.isPresent() ? monotony.getAsDouble() : null)
                .strain(strain.isPresent() ? strain.getAsDouble() : null)
                .build());
    }

    /**
     * Project the chart over planned daily stress.
     */
    @PostMapping("/projection")
    public ResponseEntity<List<DailyLoadDTO>> project(@Valid @RequestBody ProjectionRequest request) {
        List<DailyLoadDTO> projection = trainingLoadService.project(request.getPlannedStress()).stream()
                .map(DailyLoadDTO::fromPoint)
                .toList();
        return ResponseEntity.ok(projection);
    }

    /**
     * Rest days until form reaches a target.
     */
    @GetMapping("/days-to-form")
    public ResponseEntity<DaysToFormResponse> daysToForm(
            @RequestParam double targetTsb,
            @RequestParam(defaultValue = "60") int maxDays) {
        OptionalInt days = trainingLoadService.daysToTargetTsb(targetTsb, maxDays);
        return ResponseEntity.ok(new DaysToFormResponse(targetTsb, days.isPresent(), days.isPresent() ? days.getAsInt() : null));
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidLoadParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    record DaysToFormResponse(double targetTsb, boolean reached, Integer days) {}

    record ErrorResponse(String error, String message) {}
}
