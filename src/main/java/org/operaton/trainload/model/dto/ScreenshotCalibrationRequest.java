package org.operaton.trainload.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.trainload.model.OcrTextElement;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO with the recognized text of a performance chart screenshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenshotCalibrationRequest {

    @NotEmpty(message = "Recognized text elements are required")
    private List<OcrTextElement> elements;

    /**
     * Day the screenshot shows. Today when omitted.
     */
    private LocalDate effectiveDate;
}
